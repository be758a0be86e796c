package io.holdings.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin view over a shared {@link MetricRegistry} that prefixes every name with a component
 * scope, e.g. {@code fetch.attempts}.
 */
public class Metrics {
    private final MetricRegistry registry;
    private final String scope;

    public Metrics(MetricRegistry registry) { this(registry, ""); }

    public Metrics(MetricRegistry registry, String scope) {
        this.registry = registry == null ? new MetricRegistry() : registry;
        this.scope = scope == null ? "" : scope;
    }

    public Metrics scoped(String child) {
        return new Metrics(registry, name(child));
    }

    public Counter counter(String name) { return registry.counter(name(name)); }
    public Timer timer(String name) { return registry.timer(name(name)); }

    /** Current value of a scoped counter; 0 when it was never touched. */
    public long count(String name) {
        Counter c = registry.getCounters().get(name(name));
        return c == null ? 0 : c.getCount();
    }

    private String name(String name) {
        return scope.isEmpty() ? name : MetricRegistry.name(scope, name);
    }
}

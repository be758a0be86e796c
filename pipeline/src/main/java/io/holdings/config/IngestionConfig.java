package io.holdings.config;

import io.holdings.http.TlsPolicy;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Settings for one ingestion process. Each key is read from the system property
 * {@code holdings.<key>} first, then the environment variable {@code HOLDINGS_<KEY>}
 * (camel case split on humps, e.g. {@code HOLDINGS_MAX_FETCH_CONCURRENCY}), then the default.
 * Durations use ISO-8601 ({@code PT1S}, {@code P7D}).
 */
public record IngestionConfig(
        Path storeDir,
        int maxFetchConcurrency,
        Duration minRequestInterval,
        int maxRetryAttempts,
        Duration backoffBase,
        Duration backoffMax,
        Duration backoffJitter,
        int schedulerWorkerCount,
        Duration runDeadline,
        Duration requestTimeout,
        TlsPolicy tlsPolicy,
        Duration noDataSettle,
        URI sourceUrl,
        URI universeUrl
) {
    public static final URI DEFAULT_SOURCE_URL = URI.create("https://www.tdcc.com.tw/portal/zh/smWeb/qryStock");
    public static final URI DEFAULT_UNIVERSE_URL = URI.create("https://moneydj.emega.com.tw/js/StockTable.htm");

    public IngestionConfig {
        if (storeDir == null) throw new IllegalArgumentException("storeDir is required");
        requirePositive("maxFetchConcurrency", maxFetchConcurrency);
        requireNonNegative("minRequestInterval", minRequestInterval);
        requirePositive("maxRetryAttempts", maxRetryAttempts);
        requireNonNegative("backoffBase", backoffBase);
        requireNonNegative("backoffMax", backoffMax);
        requireNonNegative("backoffJitter", backoffJitter);
        requirePositive("schedulerWorkerCount", schedulerWorkerCount);
        requirePositive("runDeadline", runDeadline);
        requirePositive("requestTimeout", requestTimeout);
        requireNonNegative("noDataSettle", noDataSettle);
        if (tlsPolicy == null) tlsPolicy = TlsPolicy.verify();
        if (sourceUrl == null) sourceUrl = DEFAULT_SOURCE_URL;
        if (universeUrl == null) universeUrl = DEFAULT_UNIVERSE_URL;
    }

    public static IngestionConfig defaults() {
        return load(k -> null, Map.of());
    }

    public static IngestionConfig fromEnv() {
        return load(System::getProperty, System.getenv());
    }

    static IngestionConfig load(Function<String, String> props, Map<String, String> env) {
        Source s = new Source(props, env);
        return new IngestionConfig(
                Path.of(s.get("storeDir", "./ownership-data")),
                s.getInt("maxFetchConcurrency", 2),
                s.getDuration("minRequestInterval", "PT1S"),
                s.getInt("maxRetryAttempts", 3),
                s.getDuration("backoffBase", "PT0.5S"),
                s.getDuration("backoffMax", "PT10S"),
                s.getDuration("backoffJitter", "PT0.5S"),
                s.getInt("schedulerWorkerCount", 4),
                s.getDuration("runDeadline", "PT6H"),
                s.getDuration("requestTimeout", "PT25S"),
                s.getTls("tlsVerify", "verify"),
                s.getDuration("noDataSettle", "P7D"),
                s.getUri("sourceUrl", DEFAULT_SOURCE_URL.toString()),
                s.getUri("universeUrl", DEFAULT_UNIVERSE_URL.toString()));
    }

    public IngestionConfig withStoreDir(Path dir) {
        return new IngestionConfig(dir, maxFetchConcurrency, minRequestInterval, maxRetryAttempts, backoffBase, backoffMax,
                backoffJitter, schedulerWorkerCount, runDeadline, requestTimeout, tlsPolicy, noDataSettle, sourceUrl, universeUrl);
    }

    public IngestionConfig withRunDeadline(Duration deadline) {
        return new IngestionConfig(storeDir, maxFetchConcurrency, minRequestInterval, maxRetryAttempts, backoffBase, backoffMax,
                backoffJitter, schedulerWorkerCount, deadline, requestTimeout, tlsPolicy, noDataSettle, sourceUrl, universeUrl);
    }

    public IngestionConfig withTlsPolicy(TlsPolicy policy) {
        return new IngestionConfig(storeDir, maxFetchConcurrency, minRequestInterval, maxRetryAttempts, backoffBase, backoffMax,
                backoffJitter, schedulerWorkerCount, runDeadline, requestTimeout, policy, noDataSettle, sourceUrl, universeUrl);
    }

    public IngestionConfig withWorkers(int workers, int fetchConcurrency) {
        return new IngestionConfig(storeDir, fetchConcurrency, minRequestInterval, maxRetryAttempts, backoffBase, backoffMax,
                backoffJitter, workers, runDeadline, requestTimeout, tlsPolicy, noDataSettle, sourceUrl, universeUrl);
    }

    static String envName(String key) {
        StringBuilder sb = new StringBuilder("HOLDINGS_");
        for (char c : key.toCharArray()) {
            if (Character.isUpperCase(c)) sb.append('_');
            sb.append(Character.toUpperCase(c));
        }
        return sb.toString();
    }

    private static void requirePositive(String key, int v) {
        if (v < 1) throw new IllegalArgumentException(key + " must be >= 1, got " + v);
    }

    private static void requirePositive(String key, Duration d) {
        if (d == null || d.isNegative() || d.isZero()) throw new IllegalArgumentException(key + " must be > 0, got " + d);
    }

    private static void requireNonNegative(String key, Duration d) {
        if (d == null || d.isNegative()) throw new IllegalArgumentException(key + " must be >= 0, got " + d);
    }

    private static final class Source {
        private final Function<String, String> props;
        private final Map<String, String> env;

        Source(Function<String, String> props, Map<String, String> env) {
            this.props = props;
            this.env = env;
        }

        String get(String key, String def) {
            String v = props.apply("holdings." + key);
            if (v == null || v.isBlank()) v = env.get(envName(key));
            return v == null || v.isBlank() ? def : v.trim();
        }

        int getInt(String key, int def) {
            String v = get(key, Integer.toString(def));
            try {
                return Integer.parseInt(v);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " is not an integer: " + v, e);
            }
        }

        Duration getDuration(String key, String def) {
            String v = get(key, def);
            try {
                return Duration.parse(v.toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(key + " is not an ISO-8601 duration: " + v, e);
            }
        }

        TlsPolicy getTls(String key, String def) {
            return TlsPolicy.parse(get(key, def));
        }

        URI getUri(String key, String def) {
            String v = get(key, def);
            try {
                return URI.create(v);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(key + " is not a URI: " + v, e);
            }
        }
    }
}

package io.holdings.ownership.ingestor;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.holdings.budget.Budget;
import io.holdings.budget.RequestGate;
import io.holdings.config.IngestionConfig;
import io.holdings.http.HttpClients;
import io.holdings.metrics.Metrics;
import io.holdings.ownership.fetch.DisclosureSource;
import io.holdings.ownership.fetch.RateLimitedFetcher;
import io.holdings.ownership.fetch.TransientFetchException;
import io.holdings.ownership.provider.MoneyDjUniverseProvider;
import io.holdings.ownership.provider.TdccDisclosureSource;
import io.holdings.ownership.resolve.DateResolver;
import io.holdings.ownership.schedule.IngestionScheduler;
import io.holdings.ownership.series.OwnershipSeriesReader;
import io.holdings.ownership.store.FileNoDataLedger;
import io.holdings.ownership.store.FileSnapshotStore;
import io.holdings.ownership.store.NoDataLedger;
import io.holdings.ownership.store.SnapshotStore;
import io.holdings.ownership.universe.SecurityFilter;
import io.holdings.ownership.universe.UniverseProvider;
import io.holdings.retry.ExponentialBackoffRetryPolicy;
import io.holdings.retry.RetryPolicy;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Clock;

/** Wires the ingestion stack from an {@link IngestionConfig}. */
public class OwnershipModule extends AbstractModule {
    private final IngestionConfig config;

    public OwnershipModule(IngestionConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(IngestionConfig.class).toInstance(config);
        bind(Clock.class).toInstance(Clock.systemDefaultZone());
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton Budget gate() { return new RequestGate(config.maxFetchConcurrency(), config.minRequestInterval()); }

    @Provides @Singleton RetryPolicy retryPolicy() {
        return ExponentialBackoffRetryPolicy.of(config.maxRetryAttempts(), config.backoffBase(), config.backoffMax(),
                config.backoffJitter(), e -> e instanceof TransientFetchException);
    }

    @Provides @Singleton HttpClient httpClient() throws IOException {
        return HttpClients.create(config.tlsPolicy(), config.requestTimeout());
    }

    @Provides @Singleton SnapshotStore store() throws IOException { return new FileSnapshotStore(config.storeDir()); }

    @Provides @Singleton NoDataLedger ledger() { return new FileNoDataLedger(config.storeDir()); }

    @Provides @Singleton DisclosureSource source(HttpClient http) {
        return new TdccDisclosureSource(http, config.sourceUrl(), config.requestTimeout());
    }

    @Provides @Singleton UniverseProvider universe(HttpClient http) {
        return new MoneyDjUniverseProvider(http, config.universeUrl(), config.requestTimeout(), new SecurityFilter());
    }

    @Provides @Singleton RateLimitedFetcher fetcher(DisclosureSource source, Budget gate, RetryPolicy retry, Metrics metrics) {
        return new RateLimitedFetcher(source, gate, retry, metrics);
    }

    @Provides @Singleton IngestionScheduler scheduler(SnapshotStore store, NoDataLedger ledger, RateLimitedFetcher fetcher,
                                                      Clock clock, Metrics metrics) {
        return new IngestionScheduler(store, ledger, fetcher, config.schedulerWorkerCount(), config.runDeadline(),
                config.noDataSettle(), clock, metrics);
    }

    @Provides DateResolver resolver(SnapshotStore store) { return new DateResolver(store); }

    @Provides OwnershipSeriesReader seriesReader(SnapshotStore store, DateResolver resolver) {
        return new OwnershipSeriesReader(store, resolver);
    }
}

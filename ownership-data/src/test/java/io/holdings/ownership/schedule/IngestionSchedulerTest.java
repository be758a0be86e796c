package io.holdings.ownership.schedule;

import com.codahale.metrics.MetricRegistry;
import io.holdings.budget.RequestGate;
import io.holdings.metrics.Metrics;
import io.holdings.ownership.fetch.FetchJob;
import io.holdings.ownership.fetch.RateLimitedFetcher;
import io.holdings.ownership.fetch.TransientFetchException;
import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.model.StoreKey;
import io.holdings.ownership.store.InMemoryNoDataLedger;
import io.holdings.ownership.store.InMemorySnapshotStore;
import io.holdings.ownership.store.NoDataLedger;
import io.holdings.ownership.store.SnapshotStore;
import io.holdings.ownership.testing.FakeDisclosureSource;
import io.holdings.ownership.testing.FakeDisclosureSource.Answer;
import io.holdings.ownership.testing.InstrumentedStore;
import io.holdings.ownership.testing.Snapshots;
import io.holdings.retry.ExponentialBackoffRetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class IngestionSchedulerTest {
    private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate JAN_8 = LocalDate.of(2024, 1, 8);
    private static final LocalDate JAN_15 = LocalDate.of(2024, 1, 15);
    private static final PublicationCalendar MONDAYS = PublicationCalendar.weekly(DayOfWeek.MONDAY);
    private static final SecurityId TSMC = SecurityId.of("2330");
    private static final Clock MARCH = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);

    private FakeDisclosureSource source;
    private InMemorySnapshotStore memory;
    private InstrumentedStore store;
    private InMemoryNoDataLedger ledger;
    private Metrics metrics;

    @BeforeEach
    void setUp() {
        source = new FakeDisclosureSource();
        memory = new InMemorySnapshotStore();
        store = new InstrumentedStore(memory);
        ledger = new InMemoryNoDataLedger();
        metrics = new Metrics(new MetricRegistry());
    }

    private IngestionScheduler scheduler(SnapshotStore s, int workers, Duration deadline) {
        ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(3, 5, 20, 0,
                e -> e instanceof TransientFetchException);
        RateLimitedFetcher fetcher = new RateLimitedFetcher(source, new RequestGate(4, Duration.ZERO), policy, metrics);
        return new IngestionScheduler(s, ledger, fetcher, workers, deadline, Duration.ofDays(7), MARCH, metrics);
    }

    private IngestionScheduler scheduler() {
        return scheduler(store, 4, Duration.ofMinutes(1));
    }

    @Test
    void fetches_only_calendar_dates_missing_from_the_store() throws Exception {
        memory.put(Snapshots.snapshot("2330", LocalDate.of(2024, 1, 2)));
        memory.put(Snapshots.snapshot("2330", LocalDate.of(2024, 1, 9)));

        IngestionReport report = scheduler().run(IngestionRequest.of(List.of(TSMC), JAN_1, JAN_15, MONDAYS));

        assertEquals(Set.of(JAN_1, JAN_8, JAN_15), Set.copyOf(source.callLog().stream().map(k -> k.date()).toList()));
        assertEquals(3, source.calls());
        assertEquals(new TreeSet<>(List.of(JAN_1, JAN_8, JAN_15)), report.forSecurity(TSMC).fetched());
        assertEquals(5, memory.listDates(TSMC).size());
        assertFalse(report.hasFailures());
        assertEquals(3, metrics.count("scheduler.jobs.fetched"));
    }

    @Test
    void plan_uses_the_same_date_granularity_as_the_store() throws Exception {
        memory.put(Snapshots.snapshot("2330", LocalDate.of(2024, 1, 2)));
        memory.put(Snapshots.snapshot("2330", LocalDate.of(2024, 1, 9)));
        memory.put(Snapshots.snapshot("1301", JAN_8));

        List<StoreKey> planned = scheduler()
                .plan(IngestionRequest.of(List.of(TSMC, SecurityId.of("1301")), JAN_1, JAN_15, MONDAYS), IngestionReport.builder())
                .stream().map(FetchJob::key).toList();
        assertEquals(List.of(StoreKey.of("2330", JAN_1), StoreKey.of("2330", JAN_8), StoreKey.of("2330", JAN_15),
                StoreKey.of("1301", JAN_1), StoreKey.of("1301", JAN_15)), planned);
    }

    @Test
    void second_run_makes_no_requests() {
        IngestionRequest request = IngestionRequest.of(List.of(TSMC, SecurityId.of("1301")), JAN_1, JAN_15, MONDAYS);
        IngestionScheduler scheduler = scheduler();
        assertEquals(6, scheduler.run(request).totalFetched());

        IngestionReport again = scheduler.run(request);
        assertEquals(6, source.calls());
        assertEquals(0, again.totalFetched());
        assertEquals(6, again.totalSkippedExisting());
    }

    @Test
    void settled_empty_dates_are_remembered_and_recent_ones_asked_again() {
        LocalDate recent = LocalDate.of(2024, 2, 26);
        source.script("2330", JAN_8, Answer.NO_DATA);
        source.script("2330", recent, Answer.NO_DATA);
        IngestionRequest request = IngestionRequest.of(List.of(TSMC), JAN_1, recent, MONDAYS);

        IngestionReport first = scheduler().run(request);
        assertEquals(new TreeSet<>(List.of(JAN_8, recent)), first.forSecurity(TSMC).noData());
        assertEquals(Set.of(JAN_8), ledger.knownEmpty(TSMC));

        IngestionReport second = scheduler().run(request);
        assertEquals(1, source.calls("2330", JAN_8));
        assertEquals(2, source.calls("2330", recent));
        assertEquals(1, second.forSecurity(TSMC).skippedKnownEmpty());
        assertFalse(first.hasFailures());
    }

    @Test
    void failures_are_reported_per_date_and_do_not_stop_the_rest() {
        source.script("2330", JAN_1, Answer.PERMANENT);
        source.script("2330", JAN_8, Answer.TRANSIENT);
        source.script("2330", JAN_15, Answer.TRANSIENT, Answer.OK);

        IngestionReport report = scheduler().run(IngestionRequest.of(List.of(TSMC), JAN_1, JAN_15, MONDAYS));
        IngestionReport.SecurityReport r = report.forSecurity(TSMC);

        assertEquals(FailureReason.PERMANENT_ERROR, r.failed().get(JAN_1).reason());
        assertEquals(FailureReason.RETRIES_EXHAUSTED, r.failed().get(JAN_8).reason());
        assertTrue(r.failed().get(JAN_8).detail().contains("503"), r.failed().get(JAN_8).detail());
        assertEquals(new TreeSet<>(List.of(JAN_15)), r.fetched());
        assertEquals(1, source.calls("2330", JAN_1));
        assertEquals(3, source.calls("2330", JAN_8));
        assertEquals(2, source.calls("2330", JAN_15));
        assertTrue(report.hasFailures());
    }

    @Test
    void store_write_failure_only_affects_its_own_job() throws Exception {
        store.failWrites("2330", JAN_8);
        IngestionReport report = scheduler().run(IngestionRequest.of(List.of(TSMC), JAN_1, JAN_15, MONDAYS));
        IngestionReport.SecurityReport r = report.forSecurity(TSMC);
        assertEquals(FailureReason.STORE_IO, r.failed().get(JAN_8).reason());
        assertEquals(new TreeSet<>(List.of(JAN_1, JAN_15)), r.fetched());
        assertEquals(List.of(JAN_1, JAN_15), memory.listDates(TSMC));
    }

    @Test
    void unchecked_store_error_fails_only_its_own_job() throws Exception {
        store.breakWrites("2330", JAN_8);
        long started = System.nanoTime();
        IngestionReport report = scheduler(store, 1, Duration.ofSeconds(20))
                .run(IngestionRequest.of(List.of(TSMC), JAN_1, JAN_15, MONDAYS));
        IngestionReport.SecurityReport r = report.forSecurity(TSMC);

        assertFalse(report.deadlineExceeded());
        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(10)) < 0);
        assertEquals(FailureReason.STORE_IO, r.failed().get(JAN_8).reason());
        assertTrue(r.failed().get(JAN_8).detail().contains("backend rejected"), r.failed().get(JAN_8).detail());
        assertEquals(new TreeSet<>(List.of(JAN_1, JAN_15)), r.fetched());
        assertEquals(List.of(JAN_1, JAN_15), memory.listDates(TSMC));
    }

    @Test
    void unchecked_ledger_error_does_not_stall_the_run() {
        source.script("2330", JAN_1, Answer.NO_DATA);
        NoDataLedger broken = new NoDataLedger() {
            @Override
            public void record(SecurityId security, LocalDate date) {
                throw new IllegalStateException("ledger unavailable");
            }

            @Override
            public Set<LocalDate> knownEmpty(SecurityId security) {
                return Set.of();
            }
        };
        ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(3, 5, 20);
        RateLimitedFetcher fetcher = new RateLimitedFetcher(source, new RequestGate(1, Duration.ZERO), policy, metrics);
        IngestionScheduler scheduler = new IngestionScheduler(store, broken, fetcher, 1, Duration.ofSeconds(20),
                Duration.ofDays(7), MARCH, metrics);

        IngestionReport report = scheduler.run(IngestionRequest.of(List.of(TSMC), JAN_1, JAN_15, MONDAYS));
        assertFalse(report.deadlineExceeded());
        assertEquals(new TreeSet<>(List.of(JAN_1)), report.forSecurity(TSMC).noData());
        assertEquals(new TreeSet<>(List.of(JAN_8, JAN_15)), report.forSecurity(TSMC).fetched());
    }

    @Test
    void cancel_during_planning_cancels_every_planned_job() throws Exception {
        CountDownLatch planning = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean first = new AtomicBoolean(true);
        store.beforeExists(() -> {
            if (!first.getAndSet(false)) return;
            planning.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        IngestionScheduler scheduler = scheduler();
        IngestionRequest request = IngestionRequest.of(List.of(TSMC), JAN_1, JAN_15, MONDAYS);
        CompletableFuture<IngestionReport> running = CompletableFuture.supplyAsync(() -> scheduler.run(request));
        assertTrue(planning.await(10, TimeUnit.SECONDS));

        assertThrows(IllegalStateException.class, () -> scheduler.run(request));
        scheduler.cancel();
        release.countDown();

        IngestionReport report = running.get(30, TimeUnit.SECONDS);
        assertTrue(report.cancelled());
        assertEquals(0, source.calls());
        assertEquals(3, report.forSecurity(TSMC).failed().size());
        assertTrue(report.forSecurity(TSMC).failed().values().stream().allMatch(f -> f.reason() == FailureReason.CANCELLED));
        assertEquals(3, metrics.count("scheduler.jobs.planned"));
    }

    @Test
    void force_refetches_stored_dates() throws Exception {
        memory.put(Snapshots.snapshot("2330", JAN_8, 7));
        IngestionRequest forced = new IngestionRequest(List.of(TSMC), JAN_1, JAN_15, MONDAYS, true);
        IngestionReport report = scheduler().run(forced);
        assertEquals(3, report.totalFetched());
        assertEquals(Snapshots.snapshot("2330", JAN_8), memory.get(TSMC, JAN_8));
    }

    @Test
    void deadline_closes_unfinished_jobs_and_keeps_committed_ones() throws Exception {
        source.latency(Duration.ofMillis(100));
        LocalDate end = JAN_1.plusWeeks(29);
        IngestionReport report = scheduler(store, 1, Duration.ofMillis(450))
                .run(IngestionRequest.of(List.of(TSMC), JAN_1, end, MONDAYS));
        IngestionReport.SecurityReport r = report.forSecurity(TSMC);

        assertTrue(report.deadlineExceeded());
        assertFalse(report.cancelled());
        assertFalse(r.fetched().isEmpty());
        assertEquals(30, r.fetched().size() + r.failed().size());
        assertTrue(r.failed().values().stream().allMatch(f -> f.reason() == FailureReason.DEADLINE_EXCEEDED));
        assertFalse(r.failed().isEmpty());
        for (LocalDate d : r.fetched()) {
            assertEquals(Snapshots.snapshot("2330", d), memory.get(TSMC, d));
        }
        for (LocalDate d : r.failed().keySet()) {
            assertFalse(memory.exists(TSMC, d));
        }
    }

    @Test
    void cancel_stops_the_run() throws Exception {
        source.latency(Duration.ofMillis(50));
        IngestionScheduler scheduler = scheduler(store, 2, Duration.ofMinutes(1));
        IngestionRequest request = IngestionRequest.of(List.of(TSMC), JAN_1, JAN_1.plusWeeks(99), MONDAYS);
        CompletableFuture<IngestionReport> running = CompletableFuture.supplyAsync(() -> scheduler.run(request));
        long until = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (source.calls() < 2 && System.nanoTime() < until) Thread.sleep(5);
        scheduler.cancel();

        IngestionReport report = running.get(30, TimeUnit.SECONDS);
        IngestionReport.SecurityReport r = report.forSecurity(TSMC);
        assertTrue(report.cancelled());
        assertFalse(report.deadlineExceeded());
        assertTrue(r.failed().size() > 0);
        assertTrue(r.failed().values().stream().allMatch(f -> f.reason() == FailureReason.CANCELLED));
        assertEquals(100, r.fetched().size() + r.failed().size());
        assertTrue(source.calls() < 100);
    }

    @Test
    void many_securities_in_parallel() throws Exception {
        List<SecurityId> ids = new ArrayList<>();
        for (int i = 0; i < 60; i++) ids.add(SecurityId.of(String.valueOf(2000 + i)));
        source.script("2003", JAN_8, Answer.TRANSIENT, Answer.OK);

        IngestionReport report = scheduler(store, 8, Duration.ofMinutes(1))
                .run(IngestionRequest.of(ids, JAN_1, JAN_15, MONDAYS));

        assertEquals(180, report.totalFetched());
        assertEquals(181, source.calls());
        assertEquals(60, memory.listSecurities().size());
        for (SecurityId id : ids) assertEquals(List.of(JAN_1, JAN_8, JAN_15), memory.listDates(id));
    }

    @Test
    void empty_plan_returns_immediately() {
        IngestionReport report = scheduler().run(IngestionRequest.of(List.of(TSMC), JAN_1.plusDays(1), JAN_1.plusDays(3), MONDAYS));
        assertEquals(0, source.calls());
        assertEquals(0, report.totalFetched());
        assertTrue(report.securities().containsKey(TSMC));
    }
}

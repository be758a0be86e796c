package io.holdings.ownership.schedule;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Timer;
import io.holdings.metrics.Metrics;
import io.holdings.ownership.fetch.FetchJob;
import io.holdings.ownership.fetch.FetchOutcome;
import io.holdings.ownership.fetch.RateLimitedFetcher;
import io.holdings.ownership.model.OwnershipSnapshot;
import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.model.StoreKey;
import io.holdings.ownership.store.NoDataLedger;
import io.holdings.ownership.store.SnapshotStore;
import io.holdings.ownership.store.StoreIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Brings the store up to date for a set of securities and a date window.
 *
 * <p>Planning subtracts stored dates (and dates the source already confirmed empty) from the
 * calendar's candidates, so a repeated run only fetches what is missing. The remaining
 * {@link FetchJob}s go into a {@link DelayQueue}; a fixed pool of workers takes whichever job is
 * eligible, makes one attempt through the {@link RateLimitedFetcher} and either commits the
 * snapshot, records the outcome, or puts the job back with its backoff delay. Retry budgets are
 * the fetcher's; the scheduler never adds attempts of its own.
 *
 * <p>A job commits under its own monitor: the snapshot is stored and the job marked succeeded
 * together, and the deadline or a cancellation can only close jobs that have not committed.
 * Snapshots already stored are never rolled back.
 */
public class IngestionScheduler {
    private static final Logger log = LoggerFactory.getLogger(IngestionScheduler.class);
    private static final long POLL_MILLIS = 100;
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final SnapshotStore store;
    private final NoDataLedger ledger;
    private final RateLimitedFetcher fetcher;
    private final int workerCount;
    private final Duration runDeadline;
    private final Duration noDataSettle;
    private final Clock clock;
    private final Counter planned;
    private final Counter fetched;
    private final Counter failed;
    private final Counter noData;
    private final Timer runTime;
    private final AtomicReference<Run> active = new AtomicReference<>();

    public IngestionScheduler(SnapshotStore store, NoDataLedger ledger, RateLimitedFetcher fetcher, int workerCount,
                              Duration runDeadline, Duration noDataSettle, Clock clock, Metrics metrics) {
        if (workerCount < 1) throw new IllegalArgumentException("workerCount must be >= 1: " + workerCount);
        this.store = store;
        this.ledger = ledger;
        this.fetcher = fetcher;
        this.workerCount = workerCount;
        this.runDeadline = runDeadline;
        this.noDataSettle = noDataSettle;
        this.clock = clock;
        Metrics m = metrics.scoped("scheduler");
        this.planned = m.counter("jobs.planned");
        this.fetched = m.counter("jobs.fetched");
        this.failed = m.counter("jobs.failed");
        this.noData = m.counter("jobs.nodata");
        this.runTime = m.timer("run.time");
    }

    /**
     * Run to completion, deadline or cancellation. Job-level errors never escape; they are entries
     * in the returned report. If the calling thread is interrupted the run is cancelled and the
     * interrupt flag is set again on return.
     *
     * @throws IllegalStateException if this scheduler is already running
     */
    public IngestionReport run(IngestionRequest request) {
        Run run = new Run();
        if (!active.compareAndSet(null, run)) {
            throw new IllegalStateException("a run is already in progress");
        }
        long startNanos = System.nanoTime();
        IngestionReport.Builder report = IngestionReport.builder();
        List<FetchJob> jobs;
        boolean deadlineExceeded = false;
        boolean interrupted = false;
        try (Timer.Context ignored = runTime.time()) {
            jobs = plan(request, report);
            run.begin(jobs);
            log.info("Ingestion run: {} securities, {}..{} ({}), {} jobs, {} workers, deadline {}",
                    request.securities().size(), request.start(), request.endInclusive(), request.calendar(),
                    jobs.size(), workerCount, runDeadline);
            if (!jobs.isEmpty() && !run.stopped) {
                ExecutorService pool = Executors.newFixedThreadPool(Math.min(workerCount, jobs.size()), new WorkerThreads());
                for (int i = 0; i < Math.min(workerCount, jobs.size()); i++) pool.execute(() -> work(run));
                try {
                    if (!run.remaining.await(runDeadline.toNanos(), TimeUnit.NANOSECONDS)) {
                        deadlineExceeded = !run.cancelled;
                        run.close(deadlineExceeded);
                    }
                } catch (InterruptedException e) {
                    interrupted = true;
                    run.close(false);
                }
                stop(pool);
            }
        } finally {
            active.set(null);
        }
        IngestionReport result = summarize(jobs, report, deadlineExceeded, run.cancelled,
                Duration.ofNanos(System.nanoTime() - startNanos));
        log.info("Ingestion finished: {}", result);
        if (interrupted) Thread.currentThread().interrupt();
        return result;
    }

    /**
     * Stop the current run: no new attempts start, jobs not yet committed end as CANCELLED and
     * in-flight requests are interrupted. A run still planning is cancelled as soon as its jobs
     * exist. Does nothing when no run is active.
     */
    public void cancel() {
        Run run = active.get();
        if (run != null) {
            log.info("Cancelling ingestion run");
            run.close(false);
        }
    }

    List<FetchJob> plan(IngestionRequest request, IngestionReport.Builder report) {
        List<FetchJob> jobs = new ArrayList<>();
        for (SecurityId security : request.securities()) {
            report.security(security);
            Set<LocalDate> knownEmpty = request.force() ? Set.of() : knownEmpty(security);
            int before = jobs.size();
            for (LocalDate date : request.calendar().candidates(request.start(), request.endInclusive())) {
                if (!request.force()) {
                    try {
                        if (store.exists(security, date)) {
                            report.skippedExisting(security);
                            continue;
                        }
                    } catch (StoreIoException e) {
                        log.warn("{}@{}: existence check failed: {}", security, date, e.getMessage());
                        report.failed(security, date, FailureReason.STORE_IO, e.getMessage());
                        failed.inc();
                        continue;
                    }
                    if (knownEmpty.contains(date)) {
                        report.skippedKnownEmpty(security);
                        continue;
                    }
                }
                jobs.add(new FetchJob(new StoreKey(security, date)));
            }
            log.debug("{}: {} dates to fetch", security, jobs.size() - before);
        }
        planned.inc(jobs.size());
        return jobs;
    }

    private Set<LocalDate> knownEmpty(SecurityId security) {
        try {
            return ledger.knownEmpty(security);
        } catch (StoreIoException e) {
            log.warn("{}: no-data ledger unreadable, planning without it: {}", security, e.getMessage());
            return Set.of();
        }
    }

    private void work(Run run) {
        try {
            while (!run.stopped && run.remaining.getCount() > 0) {
                FetchJob job = run.queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (job == null) continue;
                try {
                    process(run, job);
                } catch (RuntimeException e) {
                    abandonAfterError(run, job, e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void process(Run run, FetchJob job) throws InterruptedException {
        FetchOutcome outcome = fetcher.attempt(job);
        switch (outcome.kind()) {
            case SUCCESS -> commit(run, job, outcome.snapshot());
            case RETRY -> run.queue.add(job);
            case NO_DATA -> {
                noData.inc();
                try {
                    rememberEmpty(job.key());
                } finally {
                    run.remaining.countDown();
                }
            }
            case PERMANENT, RETRIES_EXHAUSTED -> {
                failed.inc();
                run.remaining.countDown();
            }
            case ABANDONED -> { }
        }
    }

    private void commit(Run run, FetchJob job, OwnershipSnapshot snapshot) {
        synchronized (job) {
            if (job.state() != FetchJob.State.IN_FLIGHT) return;
            try {
                store.put(snapshot);
                job.succeed();
                fetched.inc();
            } catch (StoreIoException | RuntimeException e) {
                log.warn("{}: store write failed: {}", job.key(), e.toString());
                job.storeFailed(e);
                failed.inc();
            }
        }
        run.remaining.countDown();
    }

    /** Last resort for an unexpected error: end the job if it is still open so the run can finish. */
    private void abandonAfterError(Run run, FetchJob job, RuntimeException e) {
        log.warn("{}: unexpected error, giving up on this date", job.key(), e);
        boolean closed = false;
        synchronized (job) {
            if (job.state() == FetchJob.State.IN_FLIGHT) closed = job.storeFailed(e);
        }
        if (closed) {
            failed.inc();
            run.remaining.countDown();
        }
    }

    private void rememberEmpty(StoreKey key) {
        LocalDate settledBefore = LocalDate.now(clock).minusDays(noDataSettle.toDays());
        if (!key.date().isBefore(settledBefore)) return;
        try {
            ledger.record(key.security(), key.date());
        } catch (StoreIoException | RuntimeException e) {
            log.warn("{}: could not record empty date, it will be asked again next run: {}", key, e.toString());
        }
    }

    private static void stop(ExecutorService pool) {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Workers still busy {}s after shutdown", SHUTDOWN_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private IngestionReport summarize(List<FetchJob> jobs, IngestionReport.Builder report, boolean deadlineExceeded,
                                      boolean cancelled, Duration elapsed) {
        for (FetchJob job : jobs) {
            SecurityId s = job.key().security();
            LocalDate d = job.key().date();
            String detail = job.lastError() == null ? null : job.lastError().getMessage();
            switch (job.state()) {
                case SUCCEEDED -> report.fetched(s, d);
                case NO_DATA -> report.noData(s, d);
                case PERMANENT_FAILURE -> report.failed(s, d, FailureReason.PERMANENT_ERROR, detail);
                case RETRIES_EXHAUSTED -> report.failed(s, d, FailureReason.RETRIES_EXHAUSTED, detail);
                case STORE_IO -> report.failed(s, d, FailureReason.STORE_IO, detail);
                case DEADLINE_EXCEEDED -> report.failed(s, d, FailureReason.DEADLINE_EXCEEDED, "run deadline " + runDeadline + " elapsed");
                case CANCELLED -> report.failed(s, d, FailureReason.CANCELLED, "run cancelled");
                default -> throw new IllegalStateException("job left open after run: " + job);
            }
        }
        IngestionReport result = report.build(deadlineExceeded, cancelled, elapsed);
        for (Map.Entry<SecurityId, IngestionReport.SecurityReport> e : result.securities().entrySet()) {
            IngestionReport.SecurityReport r = e.getValue();
            log.info("{}: fetched={} noData={} failed={} skippedExisting={} skippedKnownEmpty={}", e.getKey(),
                    r.fetched().size(), r.noData().size(), r.failed().size(), r.skippedExisting(), r.skippedKnownEmpty());
        }
        return result;
    }

    /** State shared by the workers of one run. Exists from the start of planning. */
    private static final class Run {
        final DelayQueue<FetchJob> queue = new DelayQueue<>();
        volatile List<FetchJob> jobs = List.of();
        volatile CountDownLatch remaining = new CountDownLatch(0);
        volatile boolean stopped;
        volatile boolean cancelled;

        /** Hand over the planned jobs; closes them at once if the run was cancelled while planning. */
        synchronized void begin(List<FetchJob> planned) {
            jobs = planned;
            remaining = new CountDownLatch(planned.size());
            if (stopped) {
                closeJobs(false);
            } else {
                queue.addAll(planned);
            }
        }

        /** Close every open job, as expired or as cancelled. Committing jobs finish first. */
        synchronized void close(boolean deadline) {
            if (stopped) return;
            stopped = true;
            cancelled = !deadline;
            closeJobs(deadline);
        }

        private void closeJobs(boolean deadline) {
            queue.clear();
            for (FetchJob job : jobs) {
                boolean closed;
                synchronized (job) {
                    closed = deadline ? job.expire() : job.cancel();
                }
                if (closed) remaining.countDown();
            }
        }
    }

    private static final class WorkerThreads implements ThreadFactory {
        private final AtomicInteger n = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "ingest-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}

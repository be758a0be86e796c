package io.holdings.ownership.fetch;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Timer;
import io.holdings.budget.Budget;
import io.holdings.metrics.Metrics;
import io.holdings.ownership.model.OwnershipSnapshot;
import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.model.StoreKey;
import io.holdings.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.concurrent.TimeUnit;

/**
 * Puts a {@link DisclosureSource} behind a shared {@link Budget} (concurrency cap and request
 * spacing) and a {@link RetryPolicy}. Only {@link TransientFetchException} is retried; no-data
 * and permanent answers end the job on the first attempt.
 *
 * <p>{@link #attempt(FetchJob)} runs exactly one attempt and leaves waiting for the backoff to
 * the caller, which lets a scheduler park the job instead of a worker thread.
 * {@link #fetch(SecurityId, LocalDate)} drives a whole job on the calling thread.
 */
public class RateLimitedFetcher {
    private static final Logger log = LoggerFactory.getLogger(RateLimitedFetcher.class);

    private final DisclosureSource source;
    private final Budget gate;
    private final RetryPolicy retryPolicy;
    private final Counter attempts;
    private final Counter successes;
    private final Counter noData;
    private final Counter transients;
    private final Counter permanents;
    private final Counter retries;
    private final Timer latency;

    public RateLimitedFetcher(DisclosureSource source, Budget gate, RetryPolicy retryPolicy, Metrics metrics) {
        this.source = source;
        this.gate = gate;
        this.retryPolicy = retryPolicy;
        Metrics m = metrics.scoped("fetch");
        this.attempts = m.counter("attempts");
        this.successes = m.counter("success");
        this.noData = m.counter("nodata");
        this.transients = m.counter("transient");
        this.permanents = m.counter("permanent");
        this.retries = m.counter("retries");
        this.latency = m.timer("latency");
    }

    /**
     * Fetch one snapshot, retrying transient failures with backoff on this thread.
     *
     * @throws NoDataException the source has nothing for this date
     * @throws PermanentFetchException not retryable
     * @throws TransientFetchException the last failure once the attempt budget is spent
     */
    public OwnershipSnapshot fetch(SecurityId security, LocalDate date) throws FetchException, InterruptedException {
        FetchJob job = new FetchJob(new StoreKey(security, date));
        while (true) {
            long waitMillis = job.getDelay(TimeUnit.MILLISECONDS);
            if (waitMillis > 0) Thread.sleep(waitMillis);
            FetchOutcome outcome = attempt(job);
            switch (outcome.kind()) {
                case SUCCESS:
                    job.succeed();
                    return outcome.snapshot();
                case RETRY:
                    continue;
                case ABANDONED:
                    throw new IllegalStateException("job closed outside of a run: " + job);
                default:
                    throw outcome.error();
            }
        }
    }

    /**
     * One gated attempt for a PENDING job. Blocks for the gate, calls the source once and moves
     * the job according to the answer (see {@link FetchOutcome}).
     *
     * @throws InterruptedException while waiting for the gate or during the call; the job is then
     *         left as it was (PENDING or IN_FLIGHT) for the caller to close
     */
    public FetchOutcome attempt(FetchJob job) throws InterruptedException {
        StoreKey key = job.key();
        try (Budget.Permit ignored = gate.acquireExternalOp()) {
            if (!job.start()) return FetchOutcome.abandoned();
            int attempt = job.attemptCount();
            attempts.inc();
            log.debug("{} attempt {} via {}", key, attempt, source.name());
            try (Timer.Context t = latency.time()) {
                OwnershipSnapshot snapshot = source.fetch(key.security(), key.date());
                if (!snapshot.key().equals(key)) {
                    PermanentFetchException e = new PermanentFetchException(key, "source returned " + snapshot.key());
                    return permanent(job, e);
                }
                successes.inc();
                return FetchOutcome.success(snapshot);
            } catch (NoDataException e) {
                noData.inc();
                log.debug("{} no data: {}", key, e.getMessage());
                return job.noData(e) ? FetchOutcome.of(FetchOutcome.Kind.NO_DATA, e) : FetchOutcome.abandoned();
            } catch (TransientFetchException e) {
                transients.inc();
                if (retryPolicy.shouldRetry(attempt, e)) {
                    long delay = retryPolicy.backoffMillis(attempt);
                    if (!job.retryAfter(e, delay)) return FetchOutcome.abandoned();
                    retries.inc();
                    log.debug("{} transient failure on attempt {}, retrying in {} ms: {}", key, attempt, delay, e.getMessage());
                    return FetchOutcome.retry(e, delay);
                }
                if (!job.exhaust(e)) return FetchOutcome.abandoned();
                log.warn("{} gave up after {} attempts: {}", key, attempt, e.getMessage());
                return FetchOutcome.of(FetchOutcome.Kind.RETRIES_EXHAUSTED, e);
            } catch (PermanentFetchException e) {
                return permanent(job, e);
            } catch (FetchException e) {
                return permanent(job, new PermanentFetchException(key, "unclassified failure: " + e.getMessage(), e));
            } catch (RuntimeException e) {
                return permanent(job, new PermanentFetchException(key, "source error: " + e, e));
            }
        }
    }

    private FetchOutcome permanent(FetchJob job, PermanentFetchException e) {
        permanents.inc();
        if (!job.failPermanently(e)) return FetchOutcome.abandoned();
        log.warn("{} permanent failure: {}", job.key(), e.getMessage());
        return FetchOutcome.of(FetchOutcome.Kind.PERMANENT, e);
    }
}

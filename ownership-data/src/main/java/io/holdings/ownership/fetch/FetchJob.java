package io.holdings.ownership.fetch;

import io.holdings.ownership.model.StoreKey;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * Work item for one (security, date) during a single run. Its retry control flow is an explicit
 * state machine:
 * <pre>
 * PENDING ──start──▶ IN_FLIGHT ──▶ SUCCEEDED | NO_DATA | PERMANENT_FAILURE | RETRIES_EXHAUSTED | STORE_IO
 *    ▲                   │
 *    └──── retryAfter ───┘
 * PENDING, IN_FLIGHT ──▶ DEADLINE_EXCEEDED | CANCELLED
 * </pre>
 * Transitions not shown throw {@link IllegalStateException}. A job closed by the deadline or by
 * cancellation while an attempt is running stays closed: the late result is reported back as
 * {@code false} from the transition method and must be dropped.
 *
 * <p>Jobs order by the time they next become eligible so they can sit in a
 * {@link java.util.concurrent.DelayQueue}. The job's monitor guards every transition; callers
 * that must pair a side effect with a transition (storing a snapshot, then marking success)
 * hold it across both.
 */
public final class FetchJob implements Delayed {
    public enum State {
        PENDING, IN_FLIGHT, SUCCEEDED, NO_DATA, PERMANENT_FAILURE, RETRIES_EXHAUSTED,
        DEADLINE_EXCEEDED, CANCELLED, STORE_IO;

        public boolean isTerminal() { return this != PENDING && this != IN_FLIGHT; }
    }

    private static final Set<State> ABANDONED = EnumSet.of(State.DEADLINE_EXCEEDED, State.CANCELLED);

    private final StoreKey key;
    private State state = State.PENDING;
    private int attemptCount;
    private long nextEligibleNanos;
    private Exception lastError;

    public FetchJob(StoreKey key) {
        this.key = key;
        this.nextEligibleNanos = System.nanoTime();
    }

    public StoreKey key() { return key; }

    public synchronized State state() { return state; }

    public synchronized int attemptCount() { return attemptCount; }

    public synchronized Exception lastError() { return lastError; }

    /** {@code System.nanoTime()} value at which the next attempt may start. */
    public synchronized long nextEligibleNanos() { return nextEligibleNanos; }

    /**
     * PENDING to IN_FLIGHT; counts the attempt. Returns false if the job was closed by the
     * deadline or a cancellation in the meantime, in which case no attempt may be made.
     */
    public synchronized boolean start() {
        if (ABANDONED.contains(state)) return false;
        require(State.PENDING, State.IN_FLIGHT);
        state = State.IN_FLIGHT;
        attemptCount++;
        return true;
    }

    public synchronized boolean succeed() { return finish(State.SUCCEEDED, null); }

    public synchronized boolean noData(NoDataException e) { return finish(State.NO_DATA, e); }

    public synchronized boolean failPermanently(FetchException e) { return finish(State.PERMANENT_FAILURE, e); }

    public synchronized boolean exhaust(TransientFetchException e) { return finish(State.RETRIES_EXHAUSTED, e); }

    public synchronized boolean storeFailed(Exception e) { return finish(State.STORE_IO, e); }

    /** IN_FLIGHT back to PENDING, eligible again after {@code delayMillis}. */
    public synchronized boolean retryAfter(TransientFetchException e, long delayMillis) {
        if (ABANDONED.contains(state)) return false;
        require(State.IN_FLIGHT, State.PENDING);
        state = State.PENDING;
        lastError = e;
        nextEligibleNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0, delayMillis));
        return true;
    }

    /** Close an unfinished job because the run's deadline passed. False if it had already ended. */
    public synchronized boolean expire() { return abandon(State.DEADLINE_EXCEEDED); }

    /** Close an unfinished job because the run was cancelled. False if it had already ended. */
    public synchronized boolean cancel() { return abandon(State.CANCELLED); }

    private boolean finish(State to, Exception error) {
        if (ABANDONED.contains(state)) return false;
        require(State.IN_FLIGHT, to);
        state = to;
        if (error != null) lastError = error;
        return true;
    }

    private boolean abandon(State to) {
        if (state.isTerminal()) return false;
        state = to;
        return true;
    }

    private void require(State expected, State to) {
        if (state != expected) {
            throw new IllegalStateException(key + ": illegal transition " + state + " -> " + to);
        }
    }

    @Override
    public long getDelay(TimeUnit unit) {
        return unit.convert(nextEligibleNanos() - System.nanoTime(), TimeUnit.NANOSECONDS);
    }

    @Override
    public int compareTo(Delayed o) {
        if (o == this) return 0;
        if (o instanceof FetchJob other) {
            int c = Long.compare(nextEligibleNanos() - other.nextEligibleNanos(), 0);
            return c != 0 ? c : key.compareTo(other.key);
        }
        return Long.compare(getDelay(TimeUnit.NANOSECONDS), o.getDelay(TimeUnit.NANOSECONDS));
    }

    @Override
    public synchronized String toString() {
        return "FetchJob{" + key + ", " + state + ", attempts=" + attemptCount + "}";
    }
}

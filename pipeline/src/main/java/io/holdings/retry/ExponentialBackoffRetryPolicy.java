package io.holdings.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;
    private final long jitterMillis;
    private final Predicate<Exception> retryable;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this(maxAttempts, baseMillis, maxMillis, 0, e -> true);
    }

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis, long jitterMillis,
                                         Predicate<Exception> retryable) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(0, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
        this.jitterMillis = Math.max(0, jitterMillis);
        this.retryable = retryable == null ? e -> true : retryable;
    }

    public static ExponentialBackoffRetryPolicy of(int maxAttempts, Duration base, Duration max, Duration jitter,
                                                   Predicate<Exception> retryable) {
        return new ExponentialBackoffRetryPolicy(maxAttempts, base.toMillis(), max.toMillis(), jitter.toMillis(), retryable);
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt < maxAttempts && retryable.test(e);
    }

    /** base * 2^(attempt-1), capped at max, plus uniform jitter in [0, jitter]. */
    @Override
    public long backoffMillis(int attempt) {
        long delay = baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1)));
        delay = Math.min(delay, maxMillis);
        if (jitterMillis > 0) {
            delay += ThreadLocalRandom.current().nextLong(jitterMillis + 1);
        }
        return delay;
    }

    @Override
    public int maxAttempts() { return maxAttempts; }
}

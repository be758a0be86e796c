package io.holdings.retry;

/**
 * Decides whether a failed attempt is tried again and how long to wait first. Attempts are
 * numbered from 1.
 */
public interface RetryPolicy {
    boolean shouldRetry(int attempt, Exception e);

    long backoffMillis(int attempt);

    /** Upper bound on attempts, including the first. */
    int maxAttempts();
}

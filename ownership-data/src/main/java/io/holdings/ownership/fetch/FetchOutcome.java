package io.holdings.ownership.fetch;

import io.holdings.ownership.model.OwnershipSnapshot;

/**
 * Result of one gated attempt. On {@link Kind#SUCCESS} the job is left IN_FLIGHT so the caller can
 * commit the snapshot before marking it succeeded; every other kind has already moved the job.
 */
public record FetchOutcome(Kind kind, OwnershipSnapshot snapshot, FetchException error, long retryDelayMillis) {
    public enum Kind {
        SUCCESS,
        NO_DATA,
        /** Transient failure, job re-armed for another attempt after {@code retryDelayMillis}. */
        RETRY,
        RETRIES_EXHAUSTED,
        PERMANENT,
        /** Job was closed by the deadline or a cancellation; any result was dropped. */
        ABANDONED
    }

    static FetchOutcome success(OwnershipSnapshot s) { return new FetchOutcome(Kind.SUCCESS, s, null, 0); }

    static FetchOutcome of(Kind kind, FetchException e) { return new FetchOutcome(kind, null, e, 0); }

    static FetchOutcome retry(FetchException e, long delayMillis) {
        return new FetchOutcome(Kind.RETRY, null, e, delayMillis);
    }

    static FetchOutcome abandoned() { return new FetchOutcome(Kind.ABANDONED, null, null, 0); }
}

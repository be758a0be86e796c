package io.holdings.ownership.schedule;

/** Why a planned date was not stored. */
public enum FailureReason {
    PERMANENT_ERROR,
    RETRIES_EXHAUSTED,
    DEADLINE_EXCEEDED,
    CANCELLED,
    /** Local store failure; other securities are unaffected. */
    STORE_IO
}

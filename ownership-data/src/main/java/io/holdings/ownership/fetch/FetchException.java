package io.holdings.ownership.fetch;

import io.holdings.ownership.model.StoreKey;

/**
 * Failure of one attempt against a disclosure source. The subclass decides what the caller does
 * next: {@link NoDataException} and {@link PermanentFetchException} are final answers,
 * {@link TransientFetchException} may succeed on a later attempt.
 */
public abstract class FetchException extends Exception {
    private final StoreKey key;

    protected FetchException(StoreKey key, String message, Throwable cause) {
        super(key + ": " + message, cause);
        this.key = key;
    }

    public StoreKey key() { return key; }
}

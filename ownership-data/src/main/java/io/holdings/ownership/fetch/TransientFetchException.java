package io.holdings.ownership.fetch;

import io.holdings.ownership.model.StoreKey;

/** Timeouts, 5xx, throttling and other failures worth another attempt. */
public class TransientFetchException extends FetchException {
    public TransientFetchException(StoreKey key, String message, Throwable cause) {
        super(key, message, cause);
    }

    public TransientFetchException(StoreKey key, String message) {
        this(key, message, null);
    }
}

package io.holdings.ownership.fetch;

import io.holdings.ownership.model.StoreKey;

/** Unknown security, access denied, unusable payload. Retrying will not help. */
public class PermanentFetchException extends FetchException {
    public PermanentFetchException(StoreKey key, String message, Throwable cause) {
        super(key, message, cause);
    }

    public PermanentFetchException(StoreKey key, String message) {
        this(key, message, null);
    }
}

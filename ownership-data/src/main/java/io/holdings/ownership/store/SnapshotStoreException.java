package io.holdings.ownership.store;

import io.holdings.ownership.model.StoreKey;

/** Base of every error raised by a {@link SnapshotStore}. */
public abstract class SnapshotStoreException extends Exception {
    private final StoreKey key;

    protected SnapshotStoreException(StoreKey key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /** Key the failing operation addressed; null for security-wide operations. */
    public StoreKey key() { return key; }
}

package io.holdings.ownership.store;

import io.holdings.ownership.model.StoreKey;

/** A stored record exists but cannot be read back as a valid snapshot for its key. */
public class CorruptRecordException extends SnapshotStoreException {
    public CorruptRecordException(StoreKey key, String detail, Throwable cause) {
        super(key, "Corrupt record " + key + ": " + detail, cause);
    }
}

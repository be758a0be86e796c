package io.holdings.ownership.store;

import io.holdings.ownership.model.StoreKey;

import java.io.IOException;

/** Persistence-layer failure. Not retried by the store. */
public class StoreIoException extends SnapshotStoreException {
    public StoreIoException(StoreKey key, String operation, IOException cause) {
        super(key, operation + " failed" + (key == null ? "" : " for " + key) + ": " + cause.getMessage(), cause);
    }
}

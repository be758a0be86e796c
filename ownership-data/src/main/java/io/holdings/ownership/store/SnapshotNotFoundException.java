package io.holdings.ownership.store;

import io.holdings.ownership.model.StoreKey;

public class SnapshotNotFoundException extends SnapshotStoreException {
    public SnapshotNotFoundException(StoreKey key) {
        super(key, "No snapshot stored for " + key, null);
    }
}

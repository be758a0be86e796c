package io.holdings.ownership.store;

import io.holdings.ownership.model.OwnershipSnapshot;
import io.holdings.ownership.model.SecurityId;

import java.time.LocalDate;
import java.util.List;

/**
 * Durable store holding at most one snapshot per (security, date). Reads never touch the network.
 * Implementations must accept concurrent writers to distinct keys.
 */
public interface SnapshotStore {
    /**
     * Write or replace the snapshot under its key. Either the whole record becomes visible or the
     * previous state is left as it was; writing identical content again changes nothing.
     */
    void put(OwnershipSnapshot snapshot) throws StoreIoException;

    /** Whether a record exists for the key, without reading its body. */
    boolean exists(SecurityId security, LocalDate date) throws StoreIoException;

    /** Stored dates for the security, ascending, without duplicates; empty for an unknown security. */
    List<LocalDate> listDates(SecurityId security) throws StoreIoException;

    OwnershipSnapshot get(SecurityId security, LocalDate date)
            throws SnapshotNotFoundException, CorruptRecordException, StoreIoException;

    /** Securities with at least one stored snapshot, sorted. */
    List<SecurityId> listSecurities() throws StoreIoException;
}

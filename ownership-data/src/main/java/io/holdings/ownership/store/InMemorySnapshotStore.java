package io.holdings.ownership.store;

import io.holdings.ownership.model.OwnershipSnapshot;
import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.model.StoreKey;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Heap-backed store. Records are kept in their encoded form so reads decode and validate exactly
 * like the file store does.
 */
public class InMemorySnapshotStore implements SnapshotStore {
    private final ConcurrentSkipListMap<SecurityId, ConcurrentSkipListMap<LocalDate, byte[]>> records =
            new ConcurrentSkipListMap<>();

    @Override
    public void put(OwnershipSnapshot snapshot) throws StoreIoException {
        byte[] bytes;
        try {
            bytes = SnapshotCodec.encode(snapshot);
        } catch (IOException e) {
            throw new StoreIoException(snapshot.key(), "put", e);
        }
        records.computeIfAbsent(snapshot.security(), s -> new ConcurrentSkipListMap<>())
                .put(snapshot.date(), bytes);
    }

    @Override
    public boolean exists(SecurityId security, LocalDate date) {
        Map<LocalDate, byte[]> dates = records.get(security);
        return dates != null && dates.containsKey(date);
    }

    @Override
    public List<LocalDate> listDates(SecurityId security) {
        ConcurrentSkipListMap<LocalDate, byte[]> dates = records.get(security);
        return dates == null ? List.of() : List.copyOf(dates.keySet());
    }

    @Override
    public OwnershipSnapshot get(SecurityId security, LocalDate date)
            throws SnapshotNotFoundException, CorruptRecordException {
        StoreKey key = new StoreKey(security, date);
        Map<LocalDate, byte[]> dates = records.get(security);
        byte[] bytes = dates == null ? null : dates.get(date);
        if (bytes == null) throw new SnapshotNotFoundException(key);
        return SnapshotCodec.decode(key, bytes);
    }

    @Override
    public List<SecurityId> listSecurities() {
        List<SecurityId> out = new ArrayList<>();
        records.forEach((security, dates) -> {
            if (!dates.isEmpty()) out.add(security);
        });
        return out;
    }

    /** Raw stored bytes, for tests that compare records byte for byte. */
    byte[] rawRecord(SecurityId security, LocalDate date) {
        Map<LocalDate, byte[]> dates = records.get(security);
        byte[] bytes = dates == null ? null : dates.get(date);
        return bytes == null ? null : bytes.clone();
    }
}

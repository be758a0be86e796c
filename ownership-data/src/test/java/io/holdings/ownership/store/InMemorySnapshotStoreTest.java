package io.holdings.ownership.store;

import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.testing.Snapshots;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySnapshotStoreTest {
    private static final LocalDate D1 = LocalDate.of(2024, 1, 5);
    private static final LocalDate D2 = LocalDate.of(2024, 1, 12);
    private static final SecurityId TSMC = SecurityId.of("2330");

    @Test
    void identical_puts_store_identical_bytes() throws Exception {
        InMemorySnapshotStore store = new InMemorySnapshotStore();
        store.put(Snapshots.snapshot("2330", D1));
        byte[] first = store.rawRecord(TSMC, D1);
        store.put(Snapshots.snapshot("2330", D1));
        assertArrayEquals(first, store.rawRecord(TSMC, D1));
    }

    @Test
    void behaves_like_a_snapshot_store() throws Exception {
        InMemorySnapshotStore store = new InMemorySnapshotStore();
        store.put(Snapshots.snapshot("2330", D2));
        store.put(Snapshots.snapshot("2330", D1));
        store.put(Snapshots.snapshot("1301", D1));
        assertEquals(List.of(D1, D2), store.listDates(TSMC));
        assertEquals(List.of(), store.listDates(SecurityId.of("9999")));
        assertTrue(store.exists(TSMC, D2));
        assertEquals(List.of(SecurityId.of("1301"), TSMC), store.listSecurities());
        assertEquals(Snapshots.snapshot("2330", D2), store.get(TSMC, D2));
        assertThrows(SnapshotNotFoundException.class, () -> store.get(TSMC, LocalDate.of(2024, 1, 19)));
    }
}

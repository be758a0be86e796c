package io.holdings.ownership.series;

import io.holdings.ownership.model.Bracket;
import io.holdings.ownership.model.OwnershipSnapshot;
import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.resolve.DateResolver;
import io.holdings.ownership.resolve.NoDataAvailableException;
import io.holdings.ownership.store.FileSnapshotStore;
import io.holdings.ownership.testing.Snapshots;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OwnershipSeriesReaderTest {
    private static final SecurityId TSMC = SecurityId.of("2330");

    private Path root;
    private FileSnapshotStore store;
    private OwnershipSeriesReader reader;

    private static LocalDate jan(int day) { return LocalDate.of(2024, 1, day); }

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("series");
        store = new FileSnapshotStore(root);
        reader = new OwnershipSeriesReader(store, new DateResolver(store));
    }

    @AfterEach
    void tearDown() throws Exception {
        Snapshots.deleteRecursively(root);
    }

    @Test
    void reads_window_and_unions_bracket_ids_in_first_seen_order() throws Exception {
        store.put(Snapshots.snapshot("2330", jan(5)));
        store.put(new OwnershipSnapshot(TSMC, jan(12), 100,
                List.of(new Bracket("1-999", 3, 50), new Bracket("5,001-10,000", 1, 50))));

        OwnershipSeries series = reader.read(TSMC, jan(1), jan(31));
        assertEquals(List.of("1-999", "1,000-5,000", "1,000,001以上", "5,001-10,000"), series.bracketIds());
        assertEquals(2, series.snapshots().size());
        assertTrue(series.warnings().isEmpty(), series.warnings().toString());
        assertNull(series.value(OwnershipSeries.Table.HOLDERS, series.snapshots().get(1), "1,000-5,000"));
        assertEquals(50.0, series.value(OwnershipSeries.Table.PERCENT, series.snapshots().get(1), "1-999"));
    }

    @Test
    void corrupt_records_are_skipped_with_a_warning() throws Exception {
        store.put(Snapshots.snapshot("2330", jan(5)));
        store.put(Snapshots.snapshot("2330", jan(12)));
        Files.writeString(root.resolve("2330").resolve("2024-01-12.json"), "garbage");

        OwnershipSeries series = reader.read(TSMC, jan(5), jan(12));
        assertEquals(1, series.snapshots().size());
        assertEquals(jan(5), series.snapshots().get(0).date());
        assertTrue(series.warnings().stream().anyMatch(w -> w.startsWith("Skipped 2024-01-12")), series.warnings().toString());
    }

    @Test
    void nothing_stored_is_no_data() {
        assertThrows(NoDataAvailableException.class, () -> reader.read(TSMC, jan(1), jan(31)));
    }
}

package io.holdings.ownership.store;

import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.testing.Snapshots;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FileNoDataLedgerTest {
    private Path root;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("nodata-ledger");
    }

    @AfterEach
    void tearDown() throws Exception {
        Snapshots.deleteRecursively(root);
    }

    @Test
    void remembers_dates_across_instances_without_duplicates() throws Exception {
        SecurityId id = SecurityId.of("2330");
        LocalDate d = LocalDate.of(2024, 1, 5);
        FileNoDataLedger ledger = new FileNoDataLedger(root);
        assertEquals(Set.of(), ledger.knownEmpty(id));
        ledger.record(id, d);
        ledger.record(id, d);

        FileNoDataLedger reopened = new FileNoDataLedger(root);
        assertEquals(Set.of(d), reopened.knownEmpty(id));
        assertEquals(List.of("2024-01-05"), Files.readAllLines(root.resolve("2330").resolve(FileNoDataLedger.FILE_NAME)));
    }

    @Test
    void skips_garbage_lines() throws Exception {
        Path file = root.resolve("2330").resolve(FileNoDataLedger.FILE_NAME);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "2024-01-05\nnot-a-date\n\n2024-01-12\n");
        assertEquals(Set.of(LocalDate.of(2024, 1, 5), LocalDate.of(2024, 1, 12)),
                new FileNoDataLedger(root).knownEmpty(SecurityId.of("2330")));
    }
}

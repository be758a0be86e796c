package io.holdings.ownership.store;

import io.holdings.ownership.model.SecurityId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ledger kept next to the snapshots as {@code root/<security>/_nodata.txt}, one ISO date per line.
 * Appends for one security are serialized; different securities never share a file.
 */
public class FileNoDataLedger implements NoDataLedger {
    private static final Logger log = LoggerFactory.getLogger(FileNoDataLedger.class);
    static final String FILE_NAME = "_nodata.txt";

    private final Path root;
    private final ConcurrentHashMap<SecurityId, Object> locks = new ConcurrentHashMap<>();

    public FileNoDataLedger(Path root) {
        this.root = root;
    }

    Path ledgerPath(SecurityId security) {
        return root.resolve(security.value()).resolve(FILE_NAME);
    }

    @Override
    public void record(SecurityId security, LocalDate date) throws StoreIoException {
        Path file = ledgerPath(security);
        synchronized (lockFor(security)) {
            if (read(security, file).contains(date)) return;
            try {
                Files.createDirectories(file.getParent());
                try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                    w.write(date.toString());
                    w.write('\n');
                }
            } catch (IOException e) {
                throw new StoreIoException(null, "record no-data " + security + "@" + date, e);
            }
        }
    }

    @Override
    public Set<LocalDate> knownEmpty(SecurityId security) throws StoreIoException {
        synchronized (lockFor(security)) {
            return Set.copyOf(read(security, ledgerPath(security)));
        }
    }

    private Set<LocalDate> read(SecurityId security, Path file) throws StoreIoException {
        Set<LocalDate> out = new TreeSet<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (line.isBlank()) continue;
                try {
                    out.add(LocalDate.parse(line.trim()));
                } catch (DateTimeParseException e) {
                    log.warn("Skipping bad line in {}: '{}'", file, line);
                }
            }
        } catch (NoSuchFileException e) {
            return out;
        } catch (IOException e) {
            throw new StoreIoException(null, "read no-data ledger for " + security, e);
        }
        return out;
    }

    private Object lockFor(SecurityId security) {
        return locks.computeIfAbsent(security, s -> new Object());
    }
}

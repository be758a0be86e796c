package io.holdings.ownership.store;

import io.holdings.ownership.model.OwnershipSnapshot;
import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.model.StoreKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Snapshot store on the local filesystem:
 * <pre>
 * root/
 * ├── 2330/
 * │   ├── 2024-01-05.json
 * │   └── 2024-01-12.json
 * └── 2317/
 *     └── 2024-01-05.json
 * </pre>
 * Records are written to a temp file in the target directory and moved into place atomically,
 * so readers see either the old record or the new one. Dates are listed from file names alone.
 */
public class FileSnapshotStore implements SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(FileSnapshotStore.class);
    private static final String SUFFIX = ".json";
    private static final Pattern RECORD_NAME = Pattern.compile("\\d{4}-\\d{2}-\\d{2}\\.json");

    private final Path root;

    public FileSnapshotStore(Path root) throws IOException {
        this.root = root;
        Files.createDirectories(root);
    }

    public Path root() { return root; }

    Path securityDir(SecurityId security) { return root.resolve(security.value()); }

    Path recordPath(SecurityId security, LocalDate date) { return securityDir(security).resolve(date + SUFFIX); }

    @Override
    public void put(OwnershipSnapshot snapshot) throws StoreIoException {
        StoreKey key = snapshot.key();
        Path dir = securityDir(snapshot.security());
        Path target = recordPath(snapshot.security(), snapshot.date());
        Path tmp = null;
        try {
            byte[] bytes = SnapshotCodec.encode(snapshot);
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, ".tmp-", ".part");
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) ch.write(buf);
                ch.force(true);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
            log.debug("Stored {}", key);
        } catch (IOException e) {
            throw new StoreIoException(key, "put", e);
        } finally {
            if (tmp != null) discard(tmp);
        }
    }

    @Override
    public boolean exists(SecurityId security, LocalDate date) {
        return Files.isRegularFile(recordPath(security, date));
    }

    @Override
    public List<LocalDate> listDates(SecurityId security) throws StoreIoException {
        Path dir = securityDir(security);
        if (!Files.isDirectory(dir)) return List.of();
        TreeSet<LocalDate> dates = new TreeSet<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path p : entries) {
                String name = p.getFileName().toString();
                if (!RECORD_NAME.matcher(name).matches()) continue;
                try {
                    dates.add(LocalDate.parse(name.substring(0, name.length() - SUFFIX.length())));
                } catch (DateTimeParseException e) {
                    log.warn("Ignoring record with impossible date: {}", p);
                }
            }
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new StoreIoException(null, "listDates(" + security + ")", e);
        }
        return List.copyOf(dates);
    }

    @Override
    public OwnershipSnapshot get(SecurityId security, LocalDate date)
            throws SnapshotNotFoundException, CorruptRecordException, StoreIoException {
        StoreKey key = new StoreKey(security, date);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(recordPath(security, date));
        } catch (NoSuchFileException e) {
            throw new SnapshotNotFoundException(key);
        } catch (IOException e) {
            throw new StoreIoException(key, "get", e);
        }
        return SnapshotCodec.decode(key, bytes);
    }

    @Override
    public List<SecurityId> listSecurities() throws StoreIoException {
        List<SecurityId> out = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path p : entries) {
                SecurityId id;
                try {
                    id = SecurityId.of(p.getFileName().toString());
                } catch (IllegalArgumentException e) {
                    continue; // not one of ours
                }
                if (!listDates(id).isEmpty()) out.add(id);
            }
        } catch (IOException e) {
            throw new StoreIoException(null, "listSecurities", e);
        }
        out.sort(null);
        return out;
    }

    private static void discard(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", tmp, e.toString());
        }
    }
}

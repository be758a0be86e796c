package io.holdings.ownership.testing;

import io.holdings.ownership.model.Bracket;
import io.holdings.ownership.model.OwnershipSnapshot;
import io.holdings.ownership.model.SecurityId;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/** Test data and temp-dir helpers. */
public final class Snapshots {
    private Snapshots() {}

    public static OwnershipSnapshot snapshot(String security, LocalDate date) {
        return snapshot(security, date, 1);
    }

    /** Three-tier snapshot whose numbers vary with {@code seed}. */
    public static OwnershipSnapshot snapshot(String security, LocalDate date, int seed) {
        List<Bracket> brackets = List.of(
                new Bracket("1-999", 1000L + seed, 200_000L + seed),
                new Bracket("1,000-5,000", 300L + seed, 600_000L),
                new Bracket("1,000,001以上", 5, 9_000_000L));
        long total = brackets.stream().mapToLong(Bracket::shareCount).sum();
        return new OwnershipSnapshot(SecurityId.of(security), date, total, brackets);
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) return;
        try (Stream<Path> s = Files.walk(root)) {
            for (Path p : s.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}

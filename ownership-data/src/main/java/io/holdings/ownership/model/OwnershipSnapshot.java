package io.holdings.ownership.model;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One security's ownership distribution as disclosed for one date. Immutable; a correction is a
 * new instance stored under the same key.
 *
 * <p>Invariants: {@code totalShares > 0}; brackets non-empty with unique ids; the shares held
 * across brackets never exceed {@code totalShares} (they usually equal it, but provider rounding
 * can leave a small shortfall).
 */
public record OwnershipSnapshot(SecurityId security, LocalDate date, long totalShares, List<Bracket> brackets) {
    public OwnershipSnapshot {
        Objects.requireNonNull(security, "security");
        Objects.requireNonNull(date, "date");
        if (totalShares <= 0) throw new IllegalArgumentException("totalShares must be > 0 for " + security + "@" + date);
        if (brackets == null || brackets.isEmpty()) {
            throw new IllegalArgumentException("no brackets for " + security + "@" + date);
        }
        brackets = List.copyOf(brackets);
        Set<String> ids = new HashSet<>();
        long sum = 0;
        for (Bracket b : brackets) {
            if (!ids.add(b.bracketId())) {
                throw new IllegalArgumentException("duplicate bracket '" + b.bracketId() + "' for " + security + "@" + date);
            }
            sum = Math.addExact(sum, b.shareCount());
        }
        if (sum > totalShares) {
            throw new IllegalArgumentException("bracket shares " + sum + " exceed total " + totalShares + " for " + security + "@" + date);
        }
    }

    public StoreKey key() { return new StoreKey(security, date); }

    public long totalHolders() {
        long n = 0;
        for (Bracket b : brackets) n += b.holderCount();
        return n;
    }

    /** Share of {@code totalShares} held by the given bracket, in percent. */
    public double percentOfTotal(Bracket b) {
        return 100.0 * b.shareCount() / totalShares;
    }
}

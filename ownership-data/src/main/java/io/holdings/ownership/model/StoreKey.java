package io.holdings.ownership.model;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/** Primary key of a stored snapshot. */
public record StoreKey(SecurityId security, LocalDate date) implements Comparable<StoreKey> {
    private static final Comparator<StoreKey> ORDER =
            Comparator.comparing(StoreKey::security).thenComparing(StoreKey::date);

    public StoreKey {
        Objects.requireNonNull(security, "security");
        Objects.requireNonNull(date, "date");
    }

    public static StoreKey of(String security, LocalDate date) {
        return new StoreKey(SecurityId.of(security), date);
    }

    @Override
    public int compareTo(StoreKey o) { return ORDER.compare(this, o); }

    @Override
    public String toString() { return security + "@" + date; }
}

package io.holdings.ownership.schedule;

import io.holdings.ownership.model.SecurityId;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Outcome of one scheduler run, per security. Every planned date ends up in exactly one of
 * {@code fetched}, {@code noData} or {@code failed}.
 */
public final class IngestionReport {
    private final Map<SecurityId, SecurityReport> securities;
    private final boolean deadlineExceeded;
    private final boolean cancelled;
    private final Duration elapsed;

    private IngestionReport(Map<SecurityId, SecurityReport> securities, boolean deadlineExceeded, boolean cancelled,
                            Duration elapsed) {
        this.securities = Collections.unmodifiableMap(securities);
        this.deadlineExceeded = deadlineExceeded;
        this.cancelled = cancelled;
        this.elapsed = elapsed;
    }

    public Map<SecurityId, SecurityReport> securities() { return securities; }

    public SecurityReport forSecurity(SecurityId id) {
        SecurityReport r = securities.get(id);
        return r == null ? SecurityReport.EMPTY : r;
    }

    public boolean deadlineExceeded() { return deadlineExceeded; }
    public boolean cancelled() { return cancelled; }
    public Duration elapsed() { return elapsed; }

    public int totalFetched() { return securities.values().stream().mapToInt(r -> r.fetched().size()).sum(); }
    public int totalFailed() { return securities.values().stream().mapToInt(r -> r.failed().size()).sum(); }
    public int totalNoData() { return securities.values().stream().mapToInt(r -> r.noData().size()).sum(); }
    public int totalSkippedExisting() { return securities.values().stream().mapToInt(SecurityReport::skippedExisting).sum(); }

    public boolean hasFailures() { return totalFailed() > 0; }

    @Override
    public String toString() {
        return "IngestionReport{securities=" + securities.size() + ", fetched=" + totalFetched()
                + ", noData=" + totalNoData() + ", failed=" + totalFailed()
                + ", skippedExisting=" + totalSkippedExisting()
                + (deadlineExceeded ? ", DEADLINE_EXCEEDED" : "") + (cancelled ? ", CANCELLED" : "")
                + ", elapsed=" + elapsed + "}";
    }

    /** A date that was planned but not stored. */
    public record Failure(FailureReason reason, String detail) {}

    public record SecurityReport(SortedSet<LocalDate> fetched, SortedMap<LocalDate, Failure> failed,
                                 SortedSet<LocalDate> noData, int skippedExisting, int skippedKnownEmpty) {
        static final SecurityReport EMPTY =
                new SecurityReport(new TreeSet<>(), new TreeMap<>(), new TreeSet<>(), 0, 0);

        public SecurityReport {
            fetched = Collections.unmodifiableSortedSet(new TreeSet<>(fetched));
            failed = Collections.unmodifiableSortedMap(new TreeMap<>(failed));
            noData = Collections.unmodifiableSortedSet(new TreeSet<>(noData));
        }
    }

    static Builder builder() { return new Builder(); }

    /** Accumulates results; not thread-safe, the scheduler fills it from one thread. */
    static final class Builder {
        private final Map<SecurityId, Acc> acc = new LinkedHashMap<>();

        Builder security(SecurityId id) {
            acc.computeIfAbsent(id, k -> new Acc());
            return this;
        }

        Builder fetched(SecurityId id, LocalDate d) { acc(id).fetched.add(d); return this; }
        Builder noData(SecurityId id, LocalDate d) { acc(id).noData.add(d); return this; }
        Builder failed(SecurityId id, LocalDate d, FailureReason reason, String detail) {
            acc(id).failed.put(d, new Failure(reason, detail));
            return this;
        }
        Builder skippedExisting(SecurityId id) { acc(id).skippedExisting++; return this; }
        Builder skippedKnownEmpty(SecurityId id) { acc(id).skippedKnownEmpty++; return this; }

        IngestionReport build(boolean deadlineExceeded, boolean cancelled, Duration elapsed) {
            Map<SecurityId, SecurityReport> out = new LinkedHashMap<>();
            acc.forEach((id, a) -> out.put(id,
                    new SecurityReport(a.fetched, a.failed, a.noData, a.skippedExisting, a.skippedKnownEmpty)));
            return new IngestionReport(out, deadlineExceeded, cancelled, elapsed);
        }

        private Acc acc(SecurityId id) { return acc.computeIfAbsent(id, k -> new Acc()); }

        private static final class Acc {
            final SortedSet<LocalDate> fetched = new TreeSet<>();
            final SortedMap<LocalDate, Failure> failed = new TreeMap<>();
            final SortedSet<LocalDate> noData = new TreeSet<>();
            int skippedExisting;
            int skippedKnownEmpty;
        }
    }
}

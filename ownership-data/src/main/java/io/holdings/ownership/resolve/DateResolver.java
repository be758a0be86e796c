package io.holdings.ownership.resolve;

import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.store.SnapshotStore;
import io.holdings.ownership.store.StoreIoException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps arbitrary dates onto dates actually present in a {@link SnapshotStore}.
 *
 * <p>Each security's listing is read from the store once per resolver and kept, so a report that
 * resolves many dates costs one {@code listDates} call and a binary search per date. Create a new
 * resolver (or call {@link #invalidate}) to see dates stored later. Never touches the network.
 */
public class DateResolver {
    private final SnapshotStore store;
    private final Map<SecurityId, List<LocalDate>> listings = new ConcurrentHashMap<>();

    public DateResolver(SnapshotStore store) {
        this.store = store;
    }

    public LocalDate resolve(SecurityId security, LocalDate target, ResolveDirection direction)
            throws ResolutionException, StoreIoException {
        return resolve(security, target, direction, Long.MAX_VALUE);
    }

    /**
     * @param maxDistanceDays largest accepted distance between {@code target} and the result
     * @throws NoDataAvailableException nothing stored, or nothing on the requested side
     * @throws OutOfToleranceException the best candidate is more than {@code maxDistanceDays} away
     */
    public LocalDate resolve(SecurityId security, LocalDate target, ResolveDirection direction, long maxDistanceDays)
            throws ResolutionException, StoreIoException {
        return resolveIn(security, dates(security), target, direction, maxDistanceDays);
    }

    /**
     * Snap {@code [start, end]} onto stored dates. The start prefers the first date on or after
     * {@code start} and falls back to the last one before it; the end prefers the last date on or
     * before {@code end} and falls back to the first one after it. If the window holds no stored
     * date and the two bounds cross, both collapse onto the stored date nearest {@code start}.
     */
    public ResolvedWindow resolveWindow(SecurityId security, LocalDate start, LocalDate end)
            throws NoDataAvailableException, StoreIoException {
        if (start.isAfter(end)) throw new IllegalArgumentException("start " + start + " is after end " + end);
        List<LocalDate> dates = dates(security);
        if (dates.isEmpty()) throw new NoDataAvailableException(security, start, ResolveDirection.NEAREST);

        LocalDate from = ceiling(dates, start);
        boolean startFallback = from == null;
        if (startFallback) from = floor(dates, start);

        LocalDate to = floor(dates, end);
        boolean endFallback = to == null;
        if (endFallback) to = ceiling(dates, end);

        if (from.isAfter(to)) {
            LocalDate nearest = nearest(dates, start);
            from = nearest;
            to = nearest;
            startFallback = true;
            endFallback = true;
        }
        int lo = Collections.binarySearch(dates, from);
        int hi = Collections.binarySearch(dates, to);
        return new ResolvedWindow(from, to, startFallback, endFallback, dates.subList(lo, hi + 1));
    }

    /** Cached ascending listing for the security. */
    public List<LocalDate> dates(SecurityId security) throws StoreIoException {
        List<LocalDate> cached = listings.get(security);
        if (cached != null) return cached;
        List<LocalDate> loaded = store.listDates(security);
        List<LocalDate> prev = listings.putIfAbsent(security, loaded);
        return prev != null ? prev : loaded;
    }

    public void invalidate(SecurityId security) {
        listings.remove(security);
    }

    /**
     * Resolve against a listing the caller already holds.
     *
     * @param sortedDates ascending, without duplicates
     */
    public static LocalDate resolveIn(SecurityId security, List<LocalDate> sortedDates, LocalDate target,
                                      ResolveDirection direction, long maxDistanceDays) throws ResolutionException {
        if (maxDistanceDays < 0) throw new IllegalArgumentException("maxDistanceDays must be >= 0: " + maxDistanceDays);
        if (sortedDates.isEmpty()) throw new NoDataAvailableException(security, target, direction);
        LocalDate found;
        switch (direction) {
            case ON_OR_BEFORE -> found = floor(sortedDates, target);
            case ON_OR_AFTER -> found = ceiling(sortedDates, target);
            default -> found = nearest(sortedDates, target);
        }
        if (found == null) throw new NoDataAvailableException(security, target, direction);
        long distance = Math.abs(ChronoUnit.DAYS.between(target, found));
        if (distance > maxDistanceDays) {
            throw new OutOfToleranceException(security, target, found, distance, maxDistanceDays);
        }
        return found;
    }

    static LocalDate floor(List<LocalDate> dates, LocalDate target) {
        int i = Collections.binarySearch(dates, target);
        if (i >= 0) return dates.get(i);
        int ip = -i - 1;
        return ip == 0 ? null : dates.get(ip - 1);
    }

    static LocalDate ceiling(List<LocalDate> dates, LocalDate target) {
        int i = Collections.binarySearch(dates, target);
        if (i >= 0) return dates.get(i);
        int ip = -i - 1;
        return ip == dates.size() ? null : dates.get(ip);
    }

    /** Ties go to the earlier date. */
    static LocalDate nearest(List<LocalDate> dates, LocalDate target) {
        LocalDate before = floor(dates, target);
        LocalDate after = ceiling(dates, target);
        if (before == null) return after;
        if (after == null) return before;
        long db = ChronoUnit.DAYS.between(before, target);
        long da = ChronoUnit.DAYS.between(target, after);
        return da < db ? after : before;
    }
}

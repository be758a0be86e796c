package io.holdings.ownership.resolve;

import java.time.LocalDate;
import java.util.List;

/**
 * A requested date range snapped onto stored dates. A fallback flag is set when a bound had to be
 * taken from outside the requested range.
 */
public record ResolvedWindow(LocalDate start, LocalDate end, boolean startFallback, boolean endFallback,
                             List<LocalDate> dates) {
    public ResolvedWindow {
        dates = List.copyOf(dates);
    }

    public boolean usedFallback() { return startFallback || endFallback; }
}

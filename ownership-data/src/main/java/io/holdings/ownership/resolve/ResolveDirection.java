package io.holdings.ownership.resolve;

import java.util.Locale;

public enum ResolveDirection {
    /** Closest stored date either side; ties go to the earlier date. */
    NEAREST,
    ON_OR_BEFORE,
    ON_OR_AFTER;

    /** Accepts {@code nearest}, {@code on-or-before}, {@code before}, {@code on_or_after}, ... */
    public static ResolveDirection parse(String s) {
        String n = s.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (n) {
            case "BEFORE": return ON_OR_BEFORE;
            case "AFTER": return ON_OR_AFTER;
            default: return valueOf(n);
        }
    }
}

package io.holdings.ownership.series;

import io.holdings.ownership.model.Bracket;
import io.holdings.ownership.model.OwnershipSnapshot;
import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.resolve.ResolvedWindow;

import java.util.List;
import java.util.Locale;

/**
 * Stored snapshots of one security over a resolved window, pivoted as dates x bracket ids.
 * Bracket columns keep the order in which the provider lists them.
 */
public record OwnershipSeries(SecurityId security, ResolvedWindow window, List<String> bracketIds,
                              List<OwnershipSnapshot> snapshots, List<String> warnings) {
    public enum Table {
        HOLDERS, SHARES, PERCENT;

        public static Table parse(String s) { return valueOf(s.trim().toUpperCase(Locale.ROOT)); }
    }

    public OwnershipSeries {
        bracketIds = List.copyOf(bracketIds);
        snapshots = List.copyOf(snapshots);
        warnings = List.copyOf(warnings);
    }

    /** Cell value, or null when the snapshot has no such bracket. */
    public Number value(Table table, OwnershipSnapshot snapshot, String bracketId) {
        for (Bracket b : snapshot.brackets()) {
            if (!b.bracketId().equals(bracketId)) continue;
            switch (table) {
                case HOLDERS: return b.holderCount();
                case SHARES: return b.shareCount();
                default: return snapshot.percentOfTotal(b);
            }
        }
        return null;
    }
}

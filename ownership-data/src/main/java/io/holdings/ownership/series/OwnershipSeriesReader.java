package io.holdings.ownership.series;

import io.holdings.ownership.model.Bracket;
import io.holdings.ownership.model.OwnershipSnapshot;
import io.holdings.ownership.model.SecurityId;
import io.holdings.ownership.resolve.DateResolver;
import io.holdings.ownership.resolve.NoDataAvailableException;
import io.holdings.ownership.resolve.ResolvedWindow;
import io.holdings.ownership.store.CorruptRecordException;
import io.holdings.ownership.store.SnapshotNotFoundException;
import io.holdings.ownership.store.SnapshotStore;
import io.holdings.ownership.store.StoreIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Local read path for reports: resolves a date window and loads the stored snapshots in it.
 * Records that cannot be read are left out and listed as warnings.
 */
public class OwnershipSeriesReader {
    private static final Logger log = LoggerFactory.getLogger(OwnershipSeriesReader.class);

    private final SnapshotStore store;
    private final DateResolver resolver;

    public OwnershipSeriesReader(SnapshotStore store, DateResolver resolver) {
        this.store = store;
        this.resolver = resolver;
    }

    public OwnershipSeries read(SecurityId security, LocalDate start, LocalDate end)
            throws NoDataAvailableException, StoreIoException {
        ResolvedWindow window = resolver.resolveWindow(security, start, end);
        List<String> warnings = new ArrayList<>();
        if (window.startFallback()) {
            warnings.add("No stored date on or after " + start + "; starting at " + window.start());
        }
        if (window.endFallback()) {
            warnings.add("No stored date on or before " + end + "; ending at " + window.end());
        }
        List<OwnershipSnapshot> snapshots = new ArrayList<>();
        Set<String> bracketIds = new LinkedHashSet<>();
        for (LocalDate d : window.dates()) {
            try {
                OwnershipSnapshot s = store.get(security, d);
                snapshots.add(s);
                for (Bracket b : s.brackets()) bracketIds.add(b.bracketId());
            } catch (CorruptRecordException | SnapshotNotFoundException e) {
                log.warn("Skipping {}@{}: {}", security, d, e.getMessage());
                warnings.add("Skipped " + d + ": " + e.getMessage());
            }
        }
        return new OwnershipSeries(security, window, new ArrayList<>(bracketIds), snapshots, warnings);
    }
}

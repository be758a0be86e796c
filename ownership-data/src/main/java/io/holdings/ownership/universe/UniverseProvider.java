package io.holdings.ownership.universe;

import io.holdings.ownership.model.SecurityId;

import java.io.IOException;
import java.util.Set;

/**
 * Supplies the securities a run should ingest, non-equity instruments already excluded. Read once
 * per run; the result may be stale.
 */
public interface UniverseProvider {
    /** Eligible securities in provider order. */
    Set<SecurityId> listEligibleSecurities() throws IOException, InterruptedException;
}

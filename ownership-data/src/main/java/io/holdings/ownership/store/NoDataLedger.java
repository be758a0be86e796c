package io.holdings.ownership.store;

import io.holdings.ownership.model.SecurityId;

import java.time.LocalDate;
import java.util.Set;

/**
 * Dates the source confirmed to have no disclosure for a security. Planning skips them so a
 * repeated run does not ask the source again.
 */
public interface NoDataLedger {
    void record(SecurityId security, LocalDate date) throws StoreIoException;

    Set<LocalDate> knownEmpty(SecurityId security) throws StoreIoException;
}

package io.holdings.ownership.store;

import io.holdings.ownership.model.SecurityId;

import java.time.LocalDate;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;

public class InMemoryNoDataLedger implements NoDataLedger {
    private final ConcurrentHashMap<SecurityId, ConcurrentSkipListSet<LocalDate>> dates = new ConcurrentHashMap<>();

    @Override
    public void record(SecurityId security, LocalDate date) {
        dates.computeIfAbsent(security, s -> new ConcurrentSkipListSet<>()).add(date);
    }

    @Override
    public Set<LocalDate> knownEmpty(SecurityId security) {
        Set<LocalDate> s = dates.get(security);
        return s == null ? Set.of() : Set.copyOf(s);
    }
}

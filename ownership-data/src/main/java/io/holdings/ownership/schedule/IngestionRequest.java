package io.holdings.ownership.schedule;

import io.holdings.ownership.model.SecurityId;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * What one scheduler run should bring up to date. With {@code force} set, dates already stored
 * or known to be empty are fetched again.
 */
public record IngestionRequest(List<SecurityId> securities, LocalDate start, LocalDate endInclusive,
                               PublicationCalendar calendar, boolean force) {
    public IngestionRequest {
        Objects.requireNonNull(securities, "securities");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(endInclusive, "endInclusive");
        Objects.requireNonNull(calendar, "calendar");
        if (start.isAfter(endInclusive)) {
            throw new IllegalArgumentException("start " + start + " is after end " + endInclusive);
        }
        securities = List.copyOf(new LinkedHashSet<>(securities));
    }

    public static IngestionRequest of(List<SecurityId> securities, LocalDate start, LocalDate endInclusive,
                                      PublicationCalendar calendar) {
        return new IngestionRequest(securities, start, endInclusive, calendar, false);
    }
}

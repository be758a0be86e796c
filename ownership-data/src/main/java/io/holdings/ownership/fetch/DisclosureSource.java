package io.holdings.ownership.fetch;

import io.holdings.ownership.model.OwnershipSnapshot;
import io.holdings.ownership.model.SecurityId;

import java.time.LocalDate;

/**
 * One remote provider of ownership disclosures. A call is a single attempt: implementations do
 * not retry, throttle or cache, and must map every provider failure onto one of the
 * {@link FetchException} subclasses.
 */
public interface DisclosureSource {
    OwnershipSnapshot fetch(SecurityId security, LocalDate date) throws FetchException, InterruptedException;

    /** Short label for logs. */
    default String name() { return getClass().getSimpleName(); }
}

package io.holdings.ownership.universe;

import io.holdings.ownership.model.SecurityId;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** Fixed list of securities, e.g. from the command line. */
public class StaticUniverseProvider implements UniverseProvider {
    private final Set<SecurityId> securities;

    public StaticUniverseProvider(Collection<SecurityId> securities) {
        this.securities = Collections.unmodifiableSet(new LinkedHashSet<>(securities));
    }

    public static StaticUniverseProvider of(String... ids) {
        Set<SecurityId> out = new LinkedHashSet<>();
        for (String id : ids) out.add(SecurityId.of(id));
        return new StaticUniverseProvider(out);
    }

    @Override
    public Set<SecurityId> listEligibleSecurities() { return securities; }
}

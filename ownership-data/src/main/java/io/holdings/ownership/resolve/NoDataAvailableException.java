package io.holdings.ownership.resolve;

import io.holdings.ownership.model.SecurityId;

import java.time.LocalDate;

/** Nothing stored for the security, or nothing on the requested side of the target. */
public class NoDataAvailableException extends ResolutionException {
    public NoDataAvailableException(SecurityId security, LocalDate target, ResolveDirection direction) {
        super(security, target, "No stored date for " + security + " " + describe(direction) + " " + target);
    }

    private static String describe(ResolveDirection d) {
        switch (d) {
            case ON_OR_BEFORE: return "on or before";
            case ON_OR_AFTER: return "on or after";
            default: return "near";
        }
    }
}

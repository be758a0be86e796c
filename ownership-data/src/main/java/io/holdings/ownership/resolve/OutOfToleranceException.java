package io.holdings.ownership.resolve;

import io.holdings.ownership.model.SecurityId;

import java.time.LocalDate;

/** The best stored date is further from the target than the caller allows. */
public class OutOfToleranceException extends ResolutionException {
    private final LocalDate candidate;
    private final long distanceDays;
    private final long maxDistanceDays;

    public OutOfToleranceException(SecurityId security, LocalDate target, LocalDate candidate, long distanceDays,
                                   long maxDistanceDays) {
        super(security, target, "Closest stored date for " + security + " is " + candidate + ", " + distanceDays
                + " days from " + target + " (allowed " + maxDistanceDays + ")");
        this.candidate = candidate;
        this.distanceDays = distanceDays;
        this.maxDistanceDays = maxDistanceDays;
    }

    public LocalDate candidate() { return candidate; }
    public long distanceDays() { return distanceDays; }
    public long maxDistanceDays() { return maxDistanceDays; }
}

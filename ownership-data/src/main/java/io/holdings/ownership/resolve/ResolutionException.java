package io.holdings.ownership.resolve;

import io.holdings.ownership.model.SecurityId;

import java.time.LocalDate;

/** Base of the resolver's errors. Always surfaced to the caller. */
public abstract class ResolutionException extends Exception {
    private final SecurityId security;
    private final LocalDate target;

    protected ResolutionException(SecurityId security, LocalDate target, String message) {
        super(message);
        this.security = security;
        this.target = target;
    }

    public SecurityId security() { return security; }
    public LocalDate target() { return target; }
}

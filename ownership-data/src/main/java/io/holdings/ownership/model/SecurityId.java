package io.holdings.ownership.model;

import java.util.regex.Pattern;

/**
 * Opaque identifier of a listed security, e.g. {@code 2330}. Doubles as a directory name in
 * file-backed stores, so it is restricted to a safe single path segment.
 */
public record SecurityId(String value) implements Comparable<SecurityId> {
    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9._=^-]+");

    public SecurityId {
        if (value == null) throw new IllegalArgumentException("security id is null");
        value = value.trim();
        if (value.isEmpty()) throw new IllegalArgumentException("security id is empty");
        if (!ALLOWED.matcher(value).matches() || value.equals(".") || value.equals("..")) {
            throw new IllegalArgumentException("security id has unsupported characters: '" + value + "'");
        }
    }

    public static SecurityId of(String value) { return new SecurityId(value); }

    @Override
    public int compareTo(SecurityId o) { return value.compareTo(o.value); }

    @Override
    public String toString() { return value; }
}

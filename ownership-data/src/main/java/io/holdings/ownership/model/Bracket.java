package io.holdings.ownership.model;

/**
 * One tier of the ownership-size scale within a snapshot. The id is the provider's label and is
 * carried through untouched.
 */
public record Bracket(String bracketId, long holderCount, long shareCount) {
    public Bracket {
        if (bracketId == null || bracketId.isBlank()) throw new IllegalArgumentException("bracket id is blank");
        if (holderCount < 0) throw new IllegalArgumentException("negative holder count in bracket " + bracketId);
        if (shareCount < 0) throw new IllegalArgumentException("negative share count in bracket " + bracketId);
        if (holderCount == 0 && shareCount != 0) {
            throw new IllegalArgumentException("bracket " + bracketId + " has shares but no holders");
        }
    }
}

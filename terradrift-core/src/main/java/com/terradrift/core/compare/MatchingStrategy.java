package com.terradrift.core.compare;

import java.util.Locale;

/**
 * How list elements are paired when comparing two lists as multisets.
 */
public enum MatchingStrategy {
    /**
     * Left-to-right first-fit matching. Each element of the left list takes the first
     * still-unmatched equal element of the right list. Element equality is an equivalence
     * relation, so first-fit never forecloses a pairing and the result agrees with
     * {@link #BIPARTITE}; it is the cheaper of the two.
     */
    GREEDY,
    /**
     * Perfect bipartite matching via augmenting paths. Lists are equal exactly when every
     * element can be paired with a distinct equal element on the other side.
     */
    BIPARTITE;

    /**
     * Parses a strategy name case-insensitively.
     *
     * @param name strategy name, e.g. "greedy"
     * @return strategy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static MatchingStrategy fromString(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}

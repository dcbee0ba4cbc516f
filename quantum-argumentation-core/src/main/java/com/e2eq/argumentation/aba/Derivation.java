package com.e2eq.argumentation.aba;

import java.util.List;
import java.util.SortedSet;

/**
 * Minimal assumption supports of an atom, smallest first.
 *
 * @param truncated the derivation depth ceiling cut at least one branch, so supports may be missing
 */
public record Derivation(String atom, List<SortedSet<String>> supports, boolean truncated) {
    public Derivation {
        supports = List.copyOf(supports);
    }

    public boolean derivable() {
        return !supports.isEmpty();
    }
}

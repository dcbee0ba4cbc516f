package com.e2eq.argumentation.aba;

import java.util.*;

/**
 * Frozen copy of the part of an ABA framework an explanation depends on.
 */
public record AbaSnapshot(SortedSet<String> assumptions, Map<String, String> contraries, List<Rule> rules) {
    public AbaSnapshot {
        assumptions = Collections.unmodifiableSortedSet(new TreeSet<>(assumptions));
        contraries = Collections.unmodifiableMap(new LinkedHashMap<>(contraries));
        rules = List.copyOf(rules);
    }
}

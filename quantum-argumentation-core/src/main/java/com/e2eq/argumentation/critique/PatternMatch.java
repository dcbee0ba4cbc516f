package com.e2eq.argumentation.critique;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One occurrence of a {@link PatternKind} in a graph.
 *
 * @param kind    the pattern
 * @param nodes   unit ids involved
 * @param edges   relation ids involved, possibly empty
 * @param message human readable summary
 */
public record PatternMatch(PatternKind kind,
                           List<String> nodes,
                           List<String> edges,
                           String message) implements Comparable<PatternMatch> {

    private static final Comparator<List<String>> IDS = (a, b) -> {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    };

    private static final Comparator<PatternMatch> ORDER = Comparator
            .comparing(PatternMatch::kind)
            .thenComparing(PatternMatch::nodes, IDS)
            .thenComparing(PatternMatch::edges, IDS);

    public PatternMatch {
        Objects.requireNonNull(kind, "kind");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        message = message == null ? "" : message;
    }

    public PatternAction action() {
        return kind.action();
    }

    /** Pattern order, then node ids, then relation ids. */
    @Override
    public int compareTo(PatternMatch other) {
        return ORDER.compare(this, other);
    }
}

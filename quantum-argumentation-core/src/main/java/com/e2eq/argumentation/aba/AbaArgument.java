package com.e2eq.argumentation.aba;

import java.util.*;

/**
 * A derivation of {@code claim} from the assumptions in {@code support}.
 * Its id, {@code claim:{a,b}}, is the argument id used in the translated framework.
 */
public record AbaArgument(String claim, SortedSet<String> support) implements Comparable<AbaArgument> {

    public AbaArgument {
        Objects.requireNonNull(claim, "claim");
        support = Collections.unmodifiableSortedSet(new TreeSet<>(support));
    }

    public String id() {
        return claim + ":{" + String.join(",", support) + "}";
    }

    @Override
    public int compareTo(AbaArgument other) {
        int c = claim.compareTo(other.claim);
        return c != 0 ? c : SUPPORT_ORDER.compare(support, other.support);
    }

    @Override
    public String toString() {
        return id();
    }

    /** Smaller supports first, then element-wise. */
    static final Comparator<SortedSet<String>> SUPPORT_ORDER = (a, b) -> {
        int c = Integer.compare(a.size(), b.size());
        if (c != 0) return c;
        Iterator<String> x = a.iterator();
        Iterator<String> y = b.iterator();
        while (x.hasNext()) {
            c = x.next().compareTo(y.next());
            if (c != 0) return c;
        }
        return 0;
    };
}

package com.e2eq.argumentation.dung;

import java.util.*;

/**
 * Total assignment of {@link Label}s to the arguments of a framework. Only
 * {@link DungSemantics#labelingFromExtension(Extension)} creates labelings from extensions.
 */
public record Labeling(SortedMap<String, Label> labels) {

    public Labeling {
        labels = Collections.unmodifiableSortedMap(new TreeMap<>(labels));
    }

    public Label label(String argument) {
        Label l = labels.get(argument);
        if (l == null) {
            throw new IllegalArgumentException("Unknown argument: " + argument);
        }
        return l;
    }

    public SortedSet<String> in() { return withLabel(Label.IN); }
    public SortedSet<String> out() { return withLabel(Label.OUT); }
    public SortedSet<String> undec() { return withLabel(Label.UNDEC); }

    public Extension toExtension() {
        return new Extension(in());
    }

    private SortedSet<String> withLabel(Label wanted) {
        SortedSet<String> out = new TreeSet<>();
        labels.forEach((arg, l) -> {
            if (l == wanted) out.add(arg);
        });
        return Collections.unmodifiableSortedSet(out);
    }
}

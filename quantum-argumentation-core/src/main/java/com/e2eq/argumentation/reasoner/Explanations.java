package com.e2eq.argumentation.reasoner;

import com.e2eq.argumentation.credibility.UnitBreakdown;
import com.e2eq.argumentation.dung.Semantics;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * @param semantics   semantics the label reasons refer to
 * @param labels      reasons for the first labeling under {@code semantics}; empty when it has none
 * @param credibility per unit score breakdown; empty unless a credibility task ran
 */
public record Explanations(Semantics semantics,
                           SortedMap<String, LabelExplanation> labels,
                           SortedMap<String, UnitBreakdown> credibility) {
    public Explanations {
        labels = Collections.unmodifiableSortedMap(new TreeMap<>(labels));
        credibility = Collections.unmodifiableSortedMap(new TreeMap<>(credibility));
    }
}

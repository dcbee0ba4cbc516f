package com.e2eq.argumentation.reasoner;

import com.e2eq.argumentation.dung.Label;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Why an argument carries its label: its attackers and their labels.
 */
public record LabelExplanation(String argument, Label label, SortedMap<String, Label> attackers, String reason) {
    public LabelExplanation {
        attackers = Collections.unmodifiableSortedMap(new TreeMap<>(attackers));
    }
}

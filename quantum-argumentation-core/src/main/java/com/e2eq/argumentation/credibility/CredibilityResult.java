package com.e2eq.argumentation.credibility;

import java.util.*;

/**
 * Outcome of a credibility propagation run.
 *
 * @param scores            final score per unit, in {@code [-1,1]}
 * @param evidence          evidence support E per unit
 * @param gates             per relation id, whether its gate was open in the last update
 * @param warrantScores     score of each warrant unit as read by the last update
 * @param warrantActivation per warrant unit, whether it was above the gate threshold in the last update
 * @param breakdowns        per unit explanation of the final score
 * @param iterations        number of updates performed
 * @param converged         false when the iteration ceiling was reached first
 * @param history           score snapshots from score(0) on, empty unless history recording is enabled
 */
public record CredibilityResult(SortedMap<String, Double> scores,
                                SortedMap<String, Double> evidence,
                                Map<String, Boolean> gates,
                                SortedMap<String, Double> warrantScores,
                                SortedMap<String, Boolean> warrantActivation,
                                SortedMap<String, UnitBreakdown> breakdowns,
                                int iterations,
                                boolean converged,
                                List<Map<String, Double>> history) {

    public CredibilityResult {
        scores = Collections.unmodifiableSortedMap(new TreeMap<>(scores));
        evidence = Collections.unmodifiableSortedMap(new TreeMap<>(evidence));
        gates = Collections.unmodifiableMap(new LinkedHashMap<>(gates));
        warrantScores = Collections.unmodifiableSortedMap(new TreeMap<>(warrantScores));
        warrantActivation = Collections.unmodifiableSortedMap(new TreeMap<>(warrantActivation));
        breakdowns = Collections.unmodifiableSortedMap(new TreeMap<>(breakdowns));
        history = List.copyOf(history);
    }

    public double score(String unitId) {
        Double s = scores.get(unitId);
        if (s == null) {
            throw new IllegalArgumentException("Unknown unit: " + unitId);
        }
        return s;
    }

    public boolean gateOpen(String relationId) {
        Boolean open = gates.get(relationId);
        if (open == null) {
            throw new IllegalArgumentException("Unknown relation: " + relationId);
        }
        return open;
    }
}

package com.e2eq.argumentation.credibility;

import com.e2eq.argumentation.core.ArgumentGraph;
import com.e2eq.argumentation.core.GateMode;
import com.e2eq.argumentation.core.Relation;

import java.util.*;

/**
 * Reports how close each warrant gate is to flipping.
 */
public final class WarrantFragility {
    private WarrantFragility() {}

    /**
     * @param gateScore        weakest warrant score for AND gates, strongest for OR gates
     * @param criticalWarrants warrants whose score equals the gate score
     * @param margin           {@code gateScore - threshold}; positive while the gate is open
     */
    public record RelationFragility(String relationId,
                                    String dst,
                                    GateMode gateMode,
                                    boolean open,
                                    double gateScore,
                                    Map<String, Double> warrantScores,
                                    List<String> criticalWarrants,
                                    double margin) {
        public RelationFragility {
            warrantScores = Collections.unmodifiableMap(new LinkedHashMap<>(warrantScores));
            criticalWarrants = List.copyOf(criticalWarrants);
        }
    }

    /**
     * Analyzes every gated relation, in relation order, against the warrant scores the last
     * update of {@code result} read.
     */
    public static List<RelationFragility> analyze(ArgumentGraph graph, CredibilityResult result, double threshold) {
        List<RelationFragility> out = new ArrayList<>();
        for (Relation r : graph.relations()) {
            if (!r.gated()) continue;
            Map<String, Double> scores = new LinkedHashMap<>();
            for (String w : r.warrantIds()) {
                scores.put(w, result.warrantScores().get(w));
            }
            double gateScore = r.gateMode() == GateMode.AND
                    ? Collections.min(scores.values())
                    : Collections.max(scores.values());
            List<String> critical = new ArrayList<>();
            scores.forEach((w, s) -> {
                if (s == gateScore) critical.add(w);
            });
            out.add(new RelationFragility(r.id(), r.dst(), r.gateMode(), result.gateOpen(r.id()), gateScore,
                    scores, critical, gateScore - threshold));
        }
        return out;
    }
}

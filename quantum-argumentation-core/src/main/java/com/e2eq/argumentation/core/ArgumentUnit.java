package com.e2eq.argumentation.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A claim or warrant in an argument graph. Units are immutable; reasoning results are
 * written to separate score maps and never back onto the unit.
 *
 * @param id              unique id within the graph
 * @param text            content, opaque to the reasoning core
 * @param type            content classification
 * @param score           manual score, required when {@code axiom} is set
 * @param axiom           holds {@code score} fixed during propagation
 * @param ignoreInfluence receives evidence and influence but transmits none
 * @param evidence        pre-scored evidence strengths supplied by ingestion
 */
public record ArgumentUnit(String id,
                           String text,
                           UnitType type,
                           Optional<Double> score,
                           boolean axiom,
                           boolean ignoreInfluence,
                           List<Double> evidence) {

    public ArgumentUnit {
        Objects.requireNonNull(id, "id");
        text = text == null ? "" : text;
        type = type == null ? UnitType.OTHER : type;
        score = score == null ? Optional.empty() : score;
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public static ArgumentUnit claim(String id, String text) {
        return new ArgumentUnit(id, text, UnitType.OTHER, Optional.empty(), false, false, List.of());
    }

    public static ArgumentUnit axiom(String id, String text, double score) {
        return new ArgumentUnit(id, text, UnitType.OTHER, Optional.of(score), true, false, List.of());
    }

    public ArgumentUnit withEvidence(Double... values) {
        return new ArgumentUnit(id, text, type, score, axiom, ignoreInfluence, List.of(values));
    }

    public ArgumentUnit withType(UnitType newType) {
        return new ArgumentUnit(id, text, newType, score, axiom, ignoreInfluence, evidence);
    }

    public ArgumentUnit ignoringInfluence() {
        return new ArgumentUnit(id, text, type, score, axiom, true, evidence);
    }

    /**
     * Mean of the evidence strengths clamped to {@code [0,1]}, or 0 when there is none.
     */
    public double evidenceSupport() {
        if (evidence.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : evidence) {
            sum += Math.max(0.0, Math.min(1.0, value));
        }
        return sum / evidence.size();
    }
}

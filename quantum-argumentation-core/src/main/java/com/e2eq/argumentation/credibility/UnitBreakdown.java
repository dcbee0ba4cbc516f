package com.e2eq.argumentation.credibility;

import java.util.List;

/**
 * Explains a final score as {@code tanh(evidenceTerm + propagatedTerm)}. Axioms report their
 * fixed score with a zero propagated term and no edges.
 */
public record UnitBreakdown(String unitId,
                            boolean axiom,
                            double evidence,
                            double evidenceTerm,
                            double propagatedTerm,
                            double score,
                            List<EdgeContribution> edges) {
    public UnitBreakdown {
        edges = List.copyOf(edges);
    }
}

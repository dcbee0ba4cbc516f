package com.e2eq.argumentation.aba;

import com.e2eq.argumentation.dung.Semantics;

import java.util.List;
import java.util.Optional;

/**
 * Dispute trees for a goal, one per candidate support in support order.
 *
 * @param converged false when the depth ceiling cut at least one search
 */
public record DisputeResult(String goal, Semantics semantics, List<DisputeTree> trees, boolean converged) {
    public DisputeResult {
        trees = List.copyOf(trees);
    }

    public boolean won() {
        return trees.stream().anyMatch(t -> t.outcome() == DisputeOutcome.WON);
    }

    public Optional<DisputeTree> winningTree() {
        return trees.stream().filter(t -> t.outcome() == DisputeOutcome.WON).findFirst();
    }
}

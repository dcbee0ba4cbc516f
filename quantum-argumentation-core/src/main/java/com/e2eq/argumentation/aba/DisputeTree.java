package com.e2eq.argumentation.aba;

import java.util.*;

/**
 * A dispute tree for one candidate support of a goal. Owns a snapshot of the framework fragment
 * it was built from, so it stays valid if the framework is changed afterwards.
 *
 * @param defences assumptions the proponent committed to
 * @param culprits assumptions the proponent counter-attacked
 */
public record DisputeTree(String goal,
                          DisputeOutcome outcome,
                          DisputeNode root,
                          SortedSet<String> defences,
                          SortedSet<String> culprits,
                          AbaSnapshot snapshot) {

    public DisputeTree {
        defences = Collections.unmodifiableSortedSet(new TreeSet<>(defences));
        culprits = Collections.unmodifiableSortedSet(new TreeSet<>(culprits));
    }

    /**
     * Every opponent move is answered and no defence is also a culprit.
     */
    public boolean admissible() {
        if (!Collections.disjoint(defences, culprits)) return false;
        Deque<DisputeNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            DisputeNode n = pending.pop();
            if (n.move() == DisputeMove.OPPONENT
                    && n.annotation() != MoveAnnotation.COUNTERED
                    && n.annotation() != MoveAnnotation.FILTERED) {
                return false;
            }
            n.children().forEach(pending::push);
        }
        return true;
    }
}

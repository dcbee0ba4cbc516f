package com.e2eq.argumentation.aba;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One move of a dispute tree.
 *
 * @param target for opponent moves the proponent assumption attacked; for counter-attacks the
 *               culprit assumption of the opponent argument
 */
public record DisputeNode(DisputeMove move,
                          AbaArgument argument,
                          Optional<String> target,
                          MoveAnnotation annotation,
                          List<DisputeNode> children) {

    public DisputeNode {
        Objects.requireNonNull(move, "move");
        Objects.requireNonNull(argument, "argument");
        target = target == null ? Optional.empty() : target;
        children = children == null ? List.of() : List.copyOf(children);
    }

    public boolean proponent() {
        return move == DisputeMove.PROPONENT;
    }

    public int depth() {
        int d = 0;
        for (DisputeNode c : children) d = Math.max(d, c.depth());
        return d + 1;
    }
}

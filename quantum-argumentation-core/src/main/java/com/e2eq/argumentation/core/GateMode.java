package com.e2eq.argumentation.core;

import java.util.function.DoublePredicate;
import java.util.stream.DoubleStream;

/**
 * How the warrants referenced by a relation combine into a single open/closed gate.
 */
public enum GateMode {
    /** Every referenced warrant must be active. */
    AND,
    /** At least one referenced warrant must be active. */
    OR;

    public boolean evaluate(DoubleStream warrantScores, DoublePredicate active) {
        return this == AND ? warrantScores.allMatch(active) : warrantScores.anyMatch(active);
    }
}

package com.e2eq.argumentation.aba;

/**
 * How a node of a dispute tree was played.
 */
public enum MoveAnnotation {
    /** Proponent argument for the goal. */
    ROOT,
    /** Proponent argument attacking a culprit of the opponent move above it. */
    COUNTER_ATTACK,
    /** Opponent move answered by the proponent child below it. */
    COUNTERED,
    /** Opponent move whose support contains an assumption the proponent already counter-attacked. */
    FILTERED,
    /** Opponent move the proponent could not answer. */
    UNANSWERED
}

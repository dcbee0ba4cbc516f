package com.e2eq.argumentation.critique;

/**
 * What {@link PatternDetector#applyGateActions} does with a match.
 */
public enum PatternAction {
    /** Closes the gate of every relation in the match. */
    DISABLE_EDGE,
    /** Reported only. */
    FLAG_NODE,
    /** Reported only. */
    FLAG_EDGE
}

package com.e2eq.argumentation.aba;

public enum DisputeOutcome {
    WON,
    LOST,
    /** The depth ceiling was hit before the dispute was settled. */
    UNDECIDED
}

package com.e2eq.argumentation.critique;

import java.util.Locale;

/**
 * The structural reasoning patterns {@link PatternDetector} recognizes.
 */
public enum PatternKind {
    CIRCULAR_REASONING("Circular Reasoning", "Structural",
            "A claim ultimately supports itself through a support cycle.", PatternAction.DISABLE_EDGE),
    SELF_ATTACK("Self-Attack", "Structural",
            "A unit attacks itself, contradicting its own claim.", PatternAction.DISABLE_EDGE),
    UNSUPPORTED_CONCLUSION("Unsupported Conclusion", "Structural",
            "A claim has no incoming support relations.", PatternAction.FLAG_NODE),
    REDUNDANCY("Redundancy", "Structural",
            "Several equivalent supports lead to the same conclusion.", PatternAction.FLAG_NODE),
    CONTRADICTION("Contradiction", "Structural",
            "One source both supports and attacks the same target.", PatternAction.FLAG_EDGE),
    UNSTATED_WARRANT("Unstated Warrant", "Substructural",
            "A relation has no explicit warrants gating its inference.", PatternAction.DISABLE_EDGE);

    private final String label;
    private final String category;
    private final String description;
    private final PatternAction action;

    PatternKind(String label, String category, String description, PatternAction action) {
        this.label = label;
        this.category = category;
        this.description = description;
        this.action = action;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String label() {
        return label;
    }

    public String category() {
        return category;
    }

    public String description() {
        return description;
    }

    public PatternAction action() {
        return action;
    }
}

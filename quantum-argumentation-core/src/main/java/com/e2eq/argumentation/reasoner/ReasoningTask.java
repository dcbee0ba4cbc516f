package com.e2eq.argumentation.reasoner;

import java.util.Locale;

/**
 * Task identifiers accepted by {@link Reasoner#run}. ABA tasks run against an ABA framework,
 * every other task against an argument graph.
 */
public enum ReasoningTask {
    GROUNDED_EXTENSION,
    COMPLETE_EXTENSIONS,
    PREFERRED_EXTENSIONS,
    STABLE_EXTENSIONS,
    GROUNDED_LABELING,
    BUNDLE_EXTENSIONS,
    CREDIBILITY,
    WARRANT_FRAGILITY,
    DIAGNOSTICS,
    PATTERNS,
    ABA_EXTENSIONS(true),
    DISPUTE_TREES(true);

    private final boolean aba;

    ReasoningTask() {
        this(false);
    }

    ReasoningTask(boolean aba) {
        this.aba = aba;
    }

    public boolean aba() {
        return aba;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ReasoningTask fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Task must not be blank");
        }
        try {
            return ReasoningTask.valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported task: " + key, e);
        }
    }
}

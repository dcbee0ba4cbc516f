package com.e2eq.argumentation.exceptions;

import java.util.List;

/**
 * Thrown when an argument graph or an ABA framework violates a structural invariant.
 * <p>
 * Raised at the point reasoning is invoked (never on intermediate builder mutations)
 * for dangling relation, warrant or contrary references, axioms without a manual score,
 * undefined ABA atoms and circular rules that the framework was not configured to allow.
 * All violations found in one validation pass are reported together.
 * </p>
 */
public class StructuralException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public StructuralException(String message) {
        super(message);
        this.violations = List.of(message);
    }

    public StructuralException(List<String> violations) {
        super(buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    private static String buildMessage(List<String> violations) {
        if (violations.size() == 1) {
            return violations.get(0);
        }
        return String.format("%d structural violations: %s", violations.size(), String.join("; ", violations));
    }

    /**
     * The individual violations, in the order they were detected.
     */
    public List<String> getViolations() {
        return violations;
    }
}

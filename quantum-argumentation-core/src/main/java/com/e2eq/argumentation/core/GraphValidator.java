package com.e2eq.argumentation.core;

import com.e2eq.argumentation.exceptions.StructuralException;

import java.util.*;

/**
 * Validator for argument graph consistency: reference integrity, axiom configuration and
 * bundle membership. Runs at reasoning time; collects every violation before failing.
 */
public final class GraphValidator {
    private GraphValidator() {}

    public static void validate(ArgumentGraph graph) {
        if (graph == null) {
            throw new StructuralException("Argument graph must not be null");
        }
        List<String> violations = new ArrayList<>();
        Map<String, ArgumentUnit> units = graph.units();

        for (ArgumentUnit u : units.values()) {
            if (u.axiom()) {
                check(u.score().isPresent(), "Axiom '" + u.id() + "' has no manual score", violations);
            }
            u.score().ifPresent(s -> check(inUnitRange(s), "Score " + s + " of unit '" + u.id() + "' is outside [0,1]", violations));
            for (double ev : u.evidence()) {
                check(Double.isFinite(ev), "Non-finite evidence value on unit '" + u.id() + "'", violations);
            }
        }

        for (Relation r : graph.relations()) {
            check(units.containsKey(r.src()), "Unknown unit '" + r.src() + "' as source of relation " + r.id(), violations);
            check(units.containsKey(r.dst()), "Unknown unit '" + r.dst() + "' as destination of relation " + r.id(), violations);
            for (String w : r.warrantIds()) {
                check(units.containsKey(w), "Unknown warrant '" + w + "' on relation " + r.id(), violations);
            }
            r.weight().ifPresent(w -> check(Double.isFinite(w), "Non-finite weight on relation " + r.id(), violations));
        }

        Map<String, String> owner = new HashMap<>();
        for (ArgumentBundle b : graph.bundles().values()) {
            check(b.unitIds().size() >= 2, "Argument bundle '" + b.id() + "' needs at least two units", violations);
            for (String unitId : b.unitIds()) {
                check(units.containsKey(unitId), "Unknown unit '" + unitId + "' in argument bundle '" + b.id() + "'", violations);
                String previous = owner.putIfAbsent(unitId, b.id());
                check(previous == null || previous.equals(b.id()),
                        "Unit '" + unitId + "' is assigned to bundles '" + previous + "' and '" + b.id() + "'", violations);
            }
        }

        if (!violations.isEmpty()) {
            throw new StructuralException(violations);
        }
    }

    private static boolean inUnitRange(double value) {
        return value >= 0.0 && value <= 1.0;
    }

    private static void check(boolean cond, String msg, List<String> violations) {
        if (!cond) violations.add(msg);
    }
}

package com.e2eq.argumentation.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A directed, typed edge between two units. Several relations may join the same pair.
 * A relation with warrants only transmits influence while its warrant gate is open; a disabled
 * relation never transmits influence, whatever its warrants. Disabling does not remove the
 * attack from the abstract framework.
 */
public record Relation(String id,
                       String src,
                       String dst,
                       RelationKind kind,
                       Optional<Double> weight,
                       List<String> warrantIds,
                       GateMode gateMode,
                       boolean disabled) {

    public Relation {
        Objects.requireNonNull(src, "src");
        Objects.requireNonNull(dst, "dst");
        Objects.requireNonNull(kind, "kind");
        weight = weight == null ? Optional.empty() : weight;
        warrantIds = warrantIds == null ? List.of() : List.copyOf(warrantIds);
        gateMode = gateMode == null ? GateMode.OR : gateMode;
    }

    public Relation(String id, String src, String dst, RelationKind kind, Optional<Double> weight,
                    List<String> warrantIds, GateMode gateMode) {
        this(id, src, dst, kind, weight, warrantIds, gateMode, false);
    }

    public Relation(String src, String dst, RelationKind kind) {
        this(null, src, dst, kind, Optional.empty(), List.of(), GateMode.OR);
    }

    Relation withId(String newId) {
        return new Relation(newId, src, dst, kind, weight, warrantIds, gateMode, disabled);
    }

    /** A copy whose gate is permanently closed. */
    public Relation disable() {
        return new Relation(id, src, dst, kind, weight, warrantIds, gateMode, true);
    }

    /** A copy that requires every warrant to be active. */
    public Relation restrict() {
        return new Relation(id, src, dst, kind, weight, warrantIds, GateMode.AND, disabled);
    }

    /** |weight|, with an absent weight counting as 1. */
    public double magnitude() {
        return weight.map(Math::abs).orElse(1.0);
    }

    /** +magnitude for support, -magnitude for every attacking kind. */
    public double signedWeight() {
        return kind.sign() * magnitude();
    }

    public boolean gated() {
        return !warrantIds.isEmpty();
    }
}

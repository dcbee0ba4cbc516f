package com.e2eq.argumentation.core;

import java.util.List;
import java.util.Objects;

/**
 * A group of units treated as one higher-level argument node.
 *
 * @param id       bundle id, used as the argument id of the bundle framework
 * @param unitIds  member units in declaration order
 */
public record ArgumentBundle(String id, List<String> unitIds) {
    public ArgumentBundle {
        Objects.requireNonNull(id, "id");
        unitIds = unitIds == null ? List.of() : List.copyOf(unitIds);
    }

    public boolean contains(String unitId) {
        return unitIds.contains(unitId);
    }
}

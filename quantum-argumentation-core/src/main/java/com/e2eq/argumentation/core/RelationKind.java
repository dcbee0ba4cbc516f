package com.e2eq.argumentation.core;

import java.util.Locale;

/**
 * The closed set of relation kinds. Every kind other than {@link #SUPPORT} projects to an
 * attack edge of the abstract framework and carries a negative sign during propagation.
 */
public enum RelationKind {
    SUPPORT,
    ATTACK,
    UNDERCUT,
    REBUT;

    public boolean isAttack() {
        return this != SUPPORT;
    }

    public double sign() {
        return this == SUPPORT ? 1.0 : -1.0;
    }

    public static RelationKind fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Relation kind must not be null");
        }
        try {
            return RelationKind.valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown relation kind '" + key + "'", e);
        }
    }
}

package com.e2eq.argumentation.core;

import java.util.Locale;

/**
 * Coarse classification of an argument unit's content. Opaque to every reasoning engine.
 */
public enum UnitType {
    FACT,
    VALUE,
    POLICY,
    OTHER;

    public static UnitType fromKey(String key) {
        if (key == null || key.isBlank()) {
            return OTHER;
        }
        try {
            return UnitType.valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown unit type '" + key + "'", e);
        }
    }
}

package com.e2eq.argumentation.dung;

import java.util.Locale;

/**
 * Extension-based acceptance semantics.
 */
public enum Semantics {
    GROUNDED,
    COMPLETE,
    PREFERRED,
    STABLE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Semantics fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Semantics must not be blank");
        }
        try {
            return Semantics.valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported semantics: " + key, e);
        }
    }
}

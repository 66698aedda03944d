package com.blueprint.core.model;

import java.util.Locale;

/**
 * Relative size of an idea's scope.
 */
public enum ScopeSize {
    SMALL,
    MEDIUM,
    LARGE;

    /**
     * Lenient parse; returns null for blank or unknown values so callers can derive a size instead.
     */
    public static ScopeSize from(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}

package com.blueprint.core.model;

import java.util.Locale;

/**
 * Impact of a risk factor should it materialise.
 */
public enum RiskImpact {
    LOW,
    MEDIUM,
    HIGH;

    public static RiskImpact from(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}

package com.blueprint.core.model;

import java.util.Locale;

/**
 * Answer shape expected by a clarifying question.
 */
public enum QuestionType {
    OPEN,
    MULTIPLE_CHOICE,
    YES_NO;

    /**
     * Lenient parse of generator output ("open", "multiple_choice", "yes-no", ...).
     * Unknown or blank values fall back to {@link #OPEN}.
     */
    public static QuestionType from(String raw) {
        if (raw == null || raw.isBlank()) {
            return OPEN;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (QuestionType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return OPEN;
    }
}

package com.blueprint.core.error;

/**
 * Shape and size checks shared by the services' entry points.
 */
public final class Inputs {

    private Inputs() {}

    public static String requireIdeaId(String ideaId, int maxLength) {
        if (ideaId == null || ideaId.isBlank()) {
            throw new ValidationException("ideaId", "is required");
        }
        String trimmed = ideaId.trim();
        if (trimmed.length() > maxLength) {
            throw new ValidationException("ideaId", "must not exceed " + maxLength + " characters");
        }
        return trimmed;
    }

    /**
     * Returns {@code value} trimmed, or throws when it is blank or its trimmed length
     * falls outside {@code [minLength, maxLength]}.
     */
    public static String requireText(String field, String value, int minLength, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "is required");
        }
        String trimmed = value.trim();
        if (trimmed.length() < minLength) {
            throw new ValidationException(field, "must be at least " + minLength + " characters");
        }
        if (trimmed.length() > maxLength) {
            throw new ValidationException(field, "must not exceed " + maxLength + " characters");
        }
        return trimmed;
    }
}

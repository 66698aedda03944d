package com.blueprint.core.error;

/**
 * Thrown when caller input has the wrong shape or size. Recoverable by correcting the input.
 */
public class ValidationException extends BlueprintException {

    private final String field;

    public ValidationException(String message) {
        this(null, message);
    }

    public ValidationException(String field, String message) {
        super(field != null ? field + " " + message : message);
        this.field = field;
    }

    /** Name of the offending input field; null when the error is not tied to one field. */
    public String field() {
        return field;
    }

    @Override
    public String code() {
        return "VALIDATION_ERROR";
    }
}

package com.blueprint.core.error;

/**
 * Thrown when an idea, session or task is unknown.
 */
public class NotFoundException extends BlueprintException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException clarificationSession(String ideaId) {
        return new NotFoundException("Clarification session not found for idea " + ideaId);
    }

    public static NotFoundException breakdownSession(String ideaId) {
        return new NotFoundException("No breakdown session found for idea " + ideaId);
    }

    @Override
    public String code() {
        return "NOT_FOUND";
    }
}

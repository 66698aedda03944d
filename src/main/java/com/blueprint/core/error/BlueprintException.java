package com.blueprint.core.error;

/**
 * Base of the error taxonomy raised by the clarification and breakdown services.
 * <p>
 * Each subtype carries a stable {@link #code()} and whether the caller may retry
 * the same request unchanged.
 */
public abstract class BlueprintException extends RuntimeException {

    protected BlueprintException(String message) {
        super(message);
    }

    protected BlueprintException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String code();

    public boolean retryable() {
        return false;
    }
}

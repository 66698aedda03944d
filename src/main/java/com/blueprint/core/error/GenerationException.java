package com.blueprint.core.error;

/**
 * Thrown when the content generator fails or returns a structurally invalid payload.
 * Surfaced as a retryable server-side failure; nothing in this codebase retries it.
 */
public class GenerationException extends BlueprintException {

    private final String operation;

    public GenerationException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public GenerationException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /** The generator operation that failed, e.g. "generate-questions". */
    public String operation() {
        return operation;
    }

    @Override
    public String code() {
        return "GENERATION_ERROR";
    }

    @Override
    public boolean retryable() {
        return true;
    }
}

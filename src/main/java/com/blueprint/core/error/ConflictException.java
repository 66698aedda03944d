package com.blueprint.core.error;

/**
 * Thrown when a write finds the stored session already replaced by another writer.
 */
public class ConflictException extends BlueprintException {

    public ConflictException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "CONFLICT";
    }

    @Override
    public boolean retryable() {
        return true;
    }
}

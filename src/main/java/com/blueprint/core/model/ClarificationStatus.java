package com.blueprint.core.model;

/**
 * Lifecycle status of a clarification session.
 */
public enum ClarificationStatus {
    CLARIFYING,     // Questions generated, answers being collected
    COMPLETE        // Terminal; the session no longer accepts answers
}

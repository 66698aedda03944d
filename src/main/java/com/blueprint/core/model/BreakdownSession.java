package com.blueprint.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * The composed result of one breakdown run for an idea.
 * <p>
 * Never patched once stored: a new breakdown for the same idea replaces it.
 *
 * @param id               unique session id (e.g. "bd_...")
 * @param ideaId           the idea this breakdown belongs to
 * @param analysis         stage 1 output
 * @param tasks            stage 2 output
 * @param dependencies     stage 3 output
 * @param timeline         stage 4 output
 * @param status           always COMPLETED for stored sessions
 * @param confidence       weighted confidence over all stages
 * @param processingTimeMs wall-clock time the pipeline took
 * @param createdAt        when the run started
 * @param updatedAt        when the run finished
 */
public record BreakdownSession(
    String id,
    String ideaId,
    IdeaAnalysis analysis,
    TaskDecomposition tasks,
    DependencyGraph dependencies,
    Timeline timeline,
    BreakdownStatus status,
    double confidence,
    long processingTimeMs,
    Instant createdAt,
    Instant updatedAt
) implements Serializable {
}

package com.blueprint.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Caller-supplied hints for a breakdown.
 *
 * @param complexity    expected complexity ("simple", "medium", "complex"); nullable
 * @param teamSize      people working on the plan; null means the configured default
 * @param timelineWeeks desired duration in weeks; passed to the generator as a hint, nullable
 * @param constraints   free-form constraints passed to the generator
 */
public record BreakdownOptions(
    String complexity,
    Integer teamSize,
    Integer timelineWeeks,
    List<String> constraints
) implements Serializable {

    public BreakdownOptions {
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
    }

    public static BreakdownOptions defaults() {
        return new BreakdownOptions(null, null, null, List.of());
    }

    public static BreakdownOptions withTeamSize(int teamSize) {
        return new BreakdownOptions(null, teamSize, null, List.of());
    }
}

package com.blueprint.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dated schedule for a broken-down idea.
 *
 * @param startDate          when work starts
 * @param endDate            {@code startDate + totalWeeks * 7 days}
 * @param totalWeeks         whole weeks needed by the team, at least 1
 * @param phases             contiguous phases in order
 * @param milestones         one milestone per deliverable, in deliverable order
 * @param criticalPath       copied from the dependency graph
 * @param resourceAllocation people per resource pool; always contains "default"
 */
public record Timeline(
    Instant startDate,
    Instant endDate,
    int totalWeeks,
    List<Phase> phases,
    List<Milestone> milestones,
    List<String> criticalPath,
    Map<String, Integer> resourceAllocation
) implements Serializable {

    public Timeline {
        phases = phases != null ? List.copyOf(phases) : List.of();
        milestones = milestones != null ? List.copyOf(milestones) : List.of();
        criticalPath = criticalPath != null ? List.copyOf(criticalPath) : List.of();
        resourceAllocation = resourceAllocation != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(resourceAllocation))
                : Map.of();
    }

    public record Phase(
        String name,
        Instant startDate,
        Instant endDate,
        List<String> tasks,
        List<String> deliverables
    ) implements Serializable {

        public Phase {
            tasks = tasks != null ? List.copyOf(tasks) : List.of();
            deliverables = deliverables != null ? List.copyOf(deliverables) : List.of();
        }
    }

    public record Milestone(
        String id,
        String title,
        Instant date,
        List<String> dependencies
    ) implements Serializable {

        public Milestone {
            dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        }
    }
}

package com.blueprint.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * An atomic unit of work belonging to a deliverable.
 *
 * @param id             stable identifier within its decomposition (e.g. "t_3")
 * @param title          short task name
 * @param description    what the task should accomplish
 * @param estimatedHours effort estimate in hours
 * @param complexity     complexity from 1 (trivial) to 10 (hard)
 * @param requiredSkills skills needed to carry out the task
 * @param dependencies   ids of tasks in the same decomposition that must complete first
 * @param deliverableId  title of the deliverable the task belongs to
 */
public record Task(
    String id,
    String title,
    String description,
    double estimatedHours,
    int complexity,
    List<String> requiredSkills,
    List<String> dependencies,
    String deliverableId
) implements Serializable {

    public Task {
        requiredSkills = requiredSkills != null ? List.copyOf(requiredSkills) : List.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    public Task withDependencies(List<String> newDependencies) {
        return new Task(id, title, description, estimatedHours, complexity,
                requiredSkills, newDependencies, deliverableId);
    }
}

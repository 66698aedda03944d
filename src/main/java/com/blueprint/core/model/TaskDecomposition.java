package com.blueprint.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Flat set of tasks produced from an idea analysis, in creation order.
 *
 * @param tasks               tasks across all deliverables, ordered by deliverable then position
 * @param totalEstimatedHours sum of the task estimates
 * @param confidence          confidence in [0,1] for the decomposition
 */
public record TaskDecomposition(
    List<Task> tasks,
    double totalEstimatedHours,
    double confidence
) implements Serializable {

    public TaskDecomposition {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }
}

package com.blueprint.core.breakdown;

import com.blueprint.core.model.Task;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Restores the dependency invariants of a task list: every dependency names a task of
 * the same list, no task depends on itself, and no dependency is listed twice.
 * Offending references are dropped; everything else is kept in order.
 */
public final class DependencyRepair {

    private DependencyRepair() {}

    /**
     * @param tasks        the tasks with their dependencies rewritten
     * @param droppedCount number of references removed
     */
    public record Result(List<Task> tasks, int droppedCount) {

        public Result {
            tasks = List.copyOf(tasks);
        }
    }

    public static Result repair(List<Task> tasks) {
        Set<String> ids = new HashSet<>();
        for (Task task : tasks) {
            ids.add(task.id());
        }

        List<Task> repaired = new ArrayList<>(tasks.size());
        int dropped = 0;
        for (Task task : tasks) {
            Set<String> kept = new LinkedHashSet<>();
            for (String dependency : task.dependencies()) {
                boolean valid = dependency != null
                        && ids.contains(dependency)
                        && !dependency.equals(task.id());
                if (!valid || !kept.add(dependency)) {
                    dropped++;
                }
            }
            repaired.add(kept.size() == task.dependencies().size()
                    ? task
                    : task.withDependencies(List.copyOf(kept)));
        }
        return new Result(repaired, dropped);
    }
}

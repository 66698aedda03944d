package com.blueprint.core.breakdown;

import com.blueprint.core.error.GenerationException;
import com.blueprint.core.generation.ContentGenerator;
import com.blueprint.core.generation.TaskDraft;
import com.blueprint.core.metrics.BlueprintMetrics;
import com.blueprint.core.model.IdeaAnalysis;
import com.blueprint.core.model.Task;
import com.blueprint.core.model.TaskDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stage 2 of a breakdown: asks the generator for the tasks of every deliverable and
 * flattens them into one {@link TaskDecomposition}.
 * <p>
 * Tasks get ids {@code t_1, t_2, ...} in deliverable order. Draft dependencies may name
 * a draft's local id, an assigned id or a task title; they are resolved to assigned ids
 * and then passed through {@link DependencyRepair}.
 */
@Service
public class TaskDecomposer {

    private static final Logger log = LoggerFactory.getLogger(TaskDecomposer.class);

    static final String OPERATION = "decompose-tasks";
    static final String DEFAULT_SKILL = "General";
    private static final int DEFAULT_COMPLEXITY = 5;

    private final ContentGenerator contentGenerator;
    private final BreakdownProperties properties;
    private final BlueprintMetrics metrics;

    public TaskDecomposer(ContentGenerator contentGenerator, BreakdownProperties properties,
                          BlueprintMetrics metrics) {
        this.contentGenerator = contentGenerator;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * @throws GenerationException if the generator fails or returns a task without a title
     */
    public TaskDecomposition decompose(IdeaAnalysis analysis) {
        List<Task> tasks = new ArrayList<>();
        Set<String> assignedIds = new HashSet<>();
        Map<String, String> idsByTitle = new HashMap<>();

        for (IdeaAnalysis.Deliverable deliverable : analysis.deliverables()) {
            List<TaskDraft> drafts = contentGenerator.generateTasks(deliverable);
            if (drafts == null) {
                throw new GenerationException(OPERATION,
                        "Generator returned no tasks for deliverable '" + deliverable.title() + "'");
            }
            if (drafts.isEmpty()) {
                String id = nextId(tasks);
                log.info("No tasks generated for '{}', using a single task", deliverable.title());
                tasks.add(new Task(id, "Complete " + deliverable.title(), deliverable.description(),
                        deliverable.estimatedHours(), analysis.complexity().score(),
                        List.of(DEFAULT_SKILL), List.of(), deliverable.title()));
                assignedIds.add(id);
                continue;
            }
            tasks.addAll(fromDrafts(deliverable, drafts, tasks.size(), assignedIds, idsByTitle));
        }

        DependencyRepair.Result repaired = DependencyRepair.repair(tasks);
        if (repaired.droppedCount() > 0) {
            log.warn("Dropped {} invalid task dependencies", repaired.droppedCount());
        }
        metrics.recordRepairedDependencies(repaired.droppedCount());

        double totalHours = repaired.tasks().stream().mapToDouble(Task::estimatedHours).sum();
        double confidence = Math.min(1.0, analysis.overallConfidence() * properties.getTaskConfidenceMultiplier());
        log.info("Decomposed {} deliverables into {} tasks ({}h)",
                analysis.deliverables().size(), repaired.tasks().size(), totalHours);
        return new TaskDecomposition(repaired.tasks(), totalHours, confidence);
    }

    private List<Task> fromDrafts(IdeaAnalysis.Deliverable deliverable, List<TaskDraft> drafts, int offset,
                                  Set<String> assignedIds, Map<String, String> idsByTitle) {
        double claimed = 0;
        int missing = 0;
        for (int i = 0; i < drafts.size(); i++) {
            TaskDraft draft = drafts.get(i);
            if (draft == null || draft.title() == null || draft.title().isBlank()) {
                throw new GenerationException(OPERATION,
                        "Task " + (i + 1) + " of deliverable '" + deliverable.title() + "' has no title");
            }
            if (hasEstimate(draft)) {
                claimed += draft.estimatedHours();
            } else {
                missing++;
            }
        }
        double share = missing > 0 ? (deliverable.estimatedHours() - claimed) / missing : 0;
        if (missing > 0 && share <= 0) {
            share = deliverable.estimatedHours() / drafts.size();
        }

        // Ids first, so references to later drafts resolve too.
        List<String> ids = new ArrayList<>(drafts.size());
        Map<String, String> localIds = new HashMap<>();
        for (int i = 0; i < drafts.size(); i++) {
            String id = "t_" + (offset + i + 1);
            ids.add(id);
            TaskDraft draft = drafts.get(i);
            if (draft.id() != null && !draft.id().isBlank()) {
                localIds.putIfAbsent(draft.id().trim(), id);
            }
            idsByTitle.putIfAbsent(draft.title().trim(), id);
            assignedIds.add(id);
        }

        List<Task> tasks = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            TaskDraft draft = drafts.get(i);
            List<String> dependencies = new ArrayList<>();
            if (draft.dependencies() != null) {
                for (String ref : draft.dependencies()) {
                    if (ref != null && !ref.isBlank()) {
                        dependencies.add(resolve(ref.trim(), localIds, assignedIds, idsByTitle));
                    }
                }
            }
            int complexity = draft.complexity() != null
                    ? Math.max(1, Math.min(10, draft.complexity()))
                    : DEFAULT_COMPLEXITY;
            tasks.add(new Task(
                    ids.get(i),
                    draft.title().trim(),
                    draft.description() != null ? draft.description().trim() : "",
                    hasEstimate(draft) ? draft.estimatedHours() : share,
                    complexity,
                    skills(draft.requiredSkills()),
                    dependencies,
                    deliverable.title()));
        }
        return tasks;
    }

    private static String resolve(String ref, Map<String, String> localIds, Set<String> assignedIds,
                                  Map<String, String> idsByTitle) {
        String local = localIds.get(ref);
        if (local != null) {
            return local;
        }
        if (assignedIds.contains(ref)) {
            return ref;
        }
        String byTitle = idsByTitle.get(ref);
        return byTitle != null ? byTitle : ref;
    }

    private static boolean hasEstimate(TaskDraft draft) {
        Double hours = draft.estimatedHours();
        return hours != null && !hours.isNaN() && !hours.isInfinite() && hours > 0;
    }

    private static List<String> skills(List<String> raw) {
        List<String> skills = raw == null ? List.of() : raw.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
        return skills.isEmpty() ? List.of(DEFAULT_SKILL) : skills;
    }

    private static String nextId(List<Task> tasks) {
        return "t_" + (tasks.size() + 1);
    }
}

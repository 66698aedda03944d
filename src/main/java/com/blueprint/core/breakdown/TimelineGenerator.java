package com.blueprint.core.breakdown;

import com.blueprint.core.error.ValidationException;
import com.blueprint.core.model.BreakdownOptions;
import com.blueprint.core.model.DependencyGraph;
import com.blueprint.core.model.IdeaAnalysis;
import com.blueprint.core.model.Task;
import com.blueprint.core.model.TaskDecomposition;
import com.blueprint.core.model.Timeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stage 4 of a breakdown: lays the tasks out over three dated phases and places one
 * milestone at the end of the phase each deliverable is assigned to.
 */
@Service
public class TimelineGenerator {

    private static final Logger log = LoggerFactory.getLogger(TimelineGenerator.class);

    static final String PLANNING = "Planning & Design";
    static final String DEVELOPMENT = "Development";
    static final String TESTING = "Testing & Deployment";
    static final String DEFAULT_POOL = "default";

    private static final double EPSILON = 1e-9;

    private final TimelineProperties properties;
    private final BreakdownProperties breakdownProperties;
    private final Clock clock;

    public TimelineGenerator(TimelineProperties properties, BreakdownProperties breakdownProperties, Clock clock) {
        this.properties = properties;
        this.breakdownProperties = breakdownProperties;
        this.clock = clock;
    }

    /**
     * @throws ValidationException if there are no tasks or the team size is not positive
     */
    public Timeline generateTimeline(IdeaAnalysis analysis, TaskDecomposition tasks, DependencyGraph graph,
                                     BreakdownOptions options) {
        int teamSize = options != null && options.teamSize() != null
                ? options.teamSize()
                : breakdownProperties.getDefaultTeamSize();
        if (teamSize <= 0) {
            throw new ValidationException("teamSize", "must be positive");
        }
        if (tasks == null || tasks.tasks().isEmpty()) {
            throw new ValidationException("tasks", "must not be empty");
        }

        double totalHours = tasks.tasks().stream().mapToDouble(Task::estimatedHours).sum();
        int totalWeeks = (int) Math.max(1, Math.ceil(totalHours / ((double) properties.getHoursPerWeek() * teamSize) - EPSILON));
        int totalDays = totalWeeks * 7;

        Instant start = clock.instant();
        Instant end = start.plus(Duration.ofDays(totalDays));

        int planningEnd = clamp((int) Math.round(totalDays * properties.getPlanningEndRatio()), 1, totalDays - 2);
        int developmentEnd = clamp((int) Math.round(totalDays * properties.getDevelopmentEndRatio()),
                planningEnd + 1, totalDays - 1);
        Instant[] boundaries = {
                start,
                start.plus(Duration.ofDays(planningEnd)),
                start.plus(Duration.ofDays(developmentEnd)),
                end
        };

        List<String> taskIds = tasks.tasks().stream().map(Task::id).toList();
        int n = taskIds.size();
        int planningCount = Math.min(n, (int) Math.ceil(n * properties.getPlanningTaskRatio() - EPSILON));
        int developmentCount = Math.min(n,
                Math.max(planningCount, (int) Math.ceil(n * properties.getDevelopmentTaskRatio() - EPSILON)));
        List<List<String>> phaseTasks = List.of(
                taskIds.subList(0, planningCount),
                taskIds.subList(planningCount, developmentCount),
                taskIds.subList(developmentCount, n));

        List<IdeaAnalysis.Deliverable> deliverables = new ArrayList<>(
                analysis != null ? analysis.deliverables() : List.of());
        deliverables.sort(Comparator.comparingInt(IdeaAnalysis.Deliverable::priority));
        List<List<String>> phaseDeliverables = List.of(new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
        for (int i = 0; i < deliverables.size(); i++) {
            phaseDeliverables.get(Math.min(i, 2)).add(deliverables.get(i).title());
        }

        String[] names = {PLANNING, DEVELOPMENT, TESTING};
        List<Timeline.Phase> phases = new ArrayList<>(3);
        for (int p = 0; p < 3; p++) {
            phases.add(new Timeline.Phase(names[p], boundaries[p], boundaries[p + 1],
                    phaseTasks.get(p), phaseDeliverables.get(p)));
        }

        List<Timeline.Milestone> milestones = milestones(deliverables, boundaries);

        Map<String, Integer> resourceAllocation = new LinkedHashMap<>();
        resourceAllocation.put(DEFAULT_POOL, teamSize);

        List<String> criticalPath = graph != null ? graph.criticalPath() : List.of();
        log.info("Generated timeline: {}h over {} weeks for a team of {}, {} milestones",
                totalHours, totalWeeks, teamSize, milestones.size());
        return new Timeline(start, end, totalWeeks, phases, milestones, criticalPath, resourceAllocation);
    }

    private static List<Timeline.Milestone> milestones(List<IdeaAnalysis.Deliverable> deliverables,
                                                       Instant[] boundaries) {
        Map<String, String> milestoneIds = new HashMap<>();
        for (int i = 0; i < deliverables.size(); i++) {
            milestoneIds.put(deliverables.get(i).title(), "m_" + (i + 1));
        }
        List<Timeline.Milestone> milestones = new ArrayList<>(deliverables.size());
        for (int i = 0; i < deliverables.size(); i++) {
            IdeaAnalysis.Deliverable deliverable = deliverables.get(i);
            String id = "m_" + (i + 1);
            List<String> dependencies = deliverable.dependsOn().stream()
                    .map(milestoneIds::get)
                    .filter(dep -> dep != null && !dep.equals(id))
                    .distinct()
                    .toList();
            milestones.add(new Timeline.Milestone(id, deliverable.title() + " complete",
                    boundaries[Math.min(i, 2) + 1], dependencies));
        }
        return milestones;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}

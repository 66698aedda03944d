package com.blueprint.core.export;

import com.blueprint.core.model.BreakdownSession;
import com.blueprint.core.model.IdeaAnalysis;
import com.blueprint.core.model.Task;
import com.blueprint.core.model.Timeline;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders a breakdown as a Markdown project blueprint: summary, deliverables, task
 * checklist, roadmap table, milestones and critical path.
 */
@Component
public class MarkdownExporter implements BlueprintExporter {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    @Override
    public ExportFormat format() {
        return ExportFormat.MARKDOWN;
    }

    @Override
    public String render(BreakdownSession session, String ideaSummary) {
        IdeaAnalysis analysis = session.analysis();
        List<Task> tasks = session.tasks().tasks();
        Timeline timeline = session.timeline();
        Map<String, Task> tasksById = tasks.stream()
                .collect(Collectors.toMap(Task::id, Function.identity(), (a, b) -> a));

        var sb = new StringBuilder();
        sb.append("# Project Blueprint: ").append(title(session.ideaId(), ideaSummary)).append("\n\n");

        if (ideaSummary != null && !ideaSummary.isBlank()) {
            sb.append("## Summary\n").append(ideaSummary.trim()).append("\n\n");
        }

        sb.append("## Overview\n");
        if (analysis.complexity() != null) {
            sb.append("- Complexity: ").append(analysis.complexity().score()).append("/10 (")
                    .append(lower(analysis.complexity().level())).append(")\n");
        }
        if (analysis.scope() != null) {
            sb.append("- Scope: ").append(lower(analysis.scope().size()))
                    .append(", team of ").append(analysis.scope().teamSize()).append("\n");
        }
        sb.append("- Duration: ").append(timeline.totalWeeks()).append(" week(s), ")
                .append(date(timeline.startDate())).append(" to ").append(date(timeline.endDate())).append("\n");
        sb.append("- Effort: ").append(hours(session.tasks().totalEstimatedHours())).append(" across ")
                .append(tasks.size()).append(" tasks\n");
        sb.append("- Confidence: ").append(percent(session.confidence())).append("\n\n");

        if (!analysis.objectives().isEmpty()) {
            sb.append("## Objectives\n");
            for (IdeaAnalysis.Objective objective : analysis.objectives()) {
                sb.append("- **").append(objective.title()).append("**");
                if (objective.description() != null && !objective.description().isBlank()) {
                    sb.append(": ").append(objective.description());
                }
                sb.append("\n");
            }
            sb.append("\n");
        }

        sb.append("## Deliverables\n");
        int index = 0;
        for (IdeaAnalysis.Deliverable deliverable : analysis.deliverables()) {
            sb.append(++index).append(". **").append(deliverable.title()).append("**: ")
                    .append(deliverable.description() == null || deliverable.description().isBlank()
                            ? "No description" : deliverable.description())
                    .append(" (").append(hours(deliverable.estimatedHours())).append(" estimated)\n");
        }
        sb.append("\n");

        sb.append("## Tasks\n");
        for (Task task : tasks) {
            sb.append("- [ ] `").append(task.id()).append("` ").append(task.title())
                    .append(" (").append(hours(task.estimatedHours())).append(", ").append(task.deliverableId()).append(")");
            if (!task.dependencies().isEmpty()) {
                sb.append(" after ").append(String.join(", ", task.dependencies()));
            }
            sb.append("\n");
        }
        sb.append("\n");

        sb.append("## Roadmap\n");
        sb.append("| Phase | Start | End | Tasks | Key deliverables |\n");
        sb.append("|-------|-------|-----|-------|------------------|\n");
        for (Timeline.Phase phase : timeline.phases()) {
            sb.append("| ").append(phase.name())
                    .append(" | ").append(date(phase.startDate()))
                    .append(" | ").append(date(phase.endDate()))
                    .append(" | ").append(String.join(", ", phase.tasks()))
                    .append(" | ").append(String.join(", ", phase.deliverables()))
                    .append(" |\n");
        }
        sb.append("\n");

        if (!timeline.milestones().isEmpty()) {
            sb.append("## Milestones\n");
            for (Timeline.Milestone milestone : timeline.milestones()) {
                sb.append("- ").append(date(milestone.date())).append(" ").append(milestone.title()).append("\n");
            }
            sb.append("\n");
        }

        if (!timeline.criticalPath().isEmpty()) {
            sb.append("## Critical Path\n");
            sb.append(timeline.criticalPath().stream()
                    .map(id -> tasksById.containsKey(id) ? tasksById.get(id).title() + " (" + id + ")" : id)
                    .collect(Collectors.joining(" -> "))).append("\n\n");
        }

        if (!analysis.riskFactors().isEmpty()) {
            sb.append("## Risks\n");
            for (IdeaAnalysis.RiskFactor risk : analysis.riskFactors()) {
                sb.append("- ").append(risk.factor()).append(" (impact ").append(lower(risk.impact()))
                        .append(", probability ").append(percent(risk.probability())).append(")\n");
            }
            sb.append("\n");
        }

        if (!analysis.successCriteria().isEmpty()) {
            sb.append("## Success Criteria\n");
            analysis.successCriteria().forEach(c -> sb.append("- ").append(c).append("\n"));
            sb.append("\n");
        }

        return sb.toString();
    }

    private static String title(String ideaId, String ideaSummary) {
        if (ideaSummary == null || ideaSummary.isBlank()) {
            return ideaId;
        }
        String firstLine = ideaSummary.strip().lines().findFirst().orElse(ideaId);
        return firstLine.length() > 80 ? firstLine.substring(0, 77) + "..." : firstLine;
    }

    static String hours(double hours) {
        if (hours == Math.rint(hours)) {
            return (long) hours + "h";
        }
        return String.format(Locale.ROOT, "%.1fh", hours);
    }

    private static String percent(double ratio) {
        return Math.round(ratio * 100) + "%";
    }

    private static String date(Instant instant) {
        return instant != null ? DATE.format(instant) : "-";
    }

    private static String lower(Enum<?> value) {
        return value != null ? value.name().toLowerCase(Locale.ROOT).replace('_', ' ') : "unknown";
    }
}

package com.blueprint.core.breakdown;

import com.blueprint.core.error.GenerationException;
import com.blueprint.core.generation.AnalysisDraft;
import com.blueprint.core.generation.ContentGenerator;
import com.blueprint.core.model.BreakdownOptions;
import com.blueprint.core.model.ComplexityLevel;
import com.blueprint.core.model.IdeaAnalysis;
import com.blueprint.core.model.RiskImpact;
import com.blueprint.core.model.ScopeSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Stage 1 of a breakdown: turns the idea and its clarification answers into a
 * validated {@link IdeaAnalysis}.
 * <p>
 * Missing optional fields are filled with neutral defaults and numbers are clamped
 * into range. A payload without usable deliverables is rejected.
 */
@Service
public class IdeaAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(IdeaAnalyzer.class);

    static final String OPERATION = "analyze-idea";

    private static final int DEFAULT_COMPLEXITY = 5;
    private static final double DEFAULT_CONFIDENCE = 0.7;
    private static final double DEFAULT_RISK_PROBABILITY = 0.5;
    private static final double SMALL_SCOPE_MAX_HOURS = 160;
    private static final double MEDIUM_SCOPE_MAX_HOURS = 640;

    private final ContentGenerator contentGenerator;
    private final BreakdownProperties breakdownProperties;
    private final TimelineProperties timelineProperties;

    public IdeaAnalyzer(ContentGenerator contentGenerator, BreakdownProperties breakdownProperties,
                        TimelineProperties timelineProperties) {
        this.contentGenerator = contentGenerator;
        this.breakdownProperties = breakdownProperties;
        this.timelineProperties = timelineProperties;
    }

    /**
     * @throws GenerationException if the generator fails, returns no deliverables, or returns
     *                             a deliverable without a unique title or a positive estimate
     */
    public IdeaAnalysis analyze(String ideaText, Map<String, String> answers, BreakdownOptions options) {
        BreakdownOptions opts = options != null ? options : BreakdownOptions.defaults();
        AnalysisDraft draft = contentGenerator.analyzeIdea(ideaText, answers != null ? answers : Map.of(), opts);
        if (draft == null) {
            throw new GenerationException(OPERATION, "Generator returned no analysis");
        }

        List<IdeaAnalysis.Deliverable> deliverables = normalizeDeliverables(draft.deliverables());
        double totalHours = deliverables.stream().mapToDouble(IdeaAnalysis.Deliverable::estimatedHours).sum();

        IdeaAnalysis.Complexity complexity = normalizeComplexity(draft.complexity());
        IdeaAnalysis.Scope scope = normalizeScope(draft.scope(), opts, totalHours);

        Double rawConfidence = finite(draft.overallConfidence());
        double overallConfidence = rawConfidence != null
                ? clamp(rawConfidence, 0, 1)
                : deliverables.stream().mapToDouble(IdeaAnalysis.Deliverable::confidence).average()
                        .orElse(DEFAULT_CONFIDENCE);

        var analysis = new IdeaAnalysis(
                normalizeObjectives(draft.objectives()),
                deliverables,
                complexity,
                scope,
                normalizeRisks(draft.riskFactors()),
                nonBlank(draft.successCriteria()),
                overallConfidence);

        log.info("Analyzed idea: {} deliverables, {}h, complexity {} ({}), team of {}",
                deliverables.size(), totalHours, complexity.score(), complexity.level(), scope.teamSize());
        return analysis;
    }

    private List<IdeaAnalysis.Deliverable> normalizeDeliverables(List<AnalysisDraft.DeliverableDraft> drafts) {
        if (drafts == null || drafts.isEmpty()) {
            throw new GenerationException(OPERATION, "Analysis contains no deliverables");
        }
        List<IdeaAnalysis.Deliverable> deliverables = new ArrayList<>(drafts.size());
        Set<String> titles = new HashSet<>();
        for (int i = 0; i < drafts.size(); i++) {
            AnalysisDraft.DeliverableDraft d = drafts.get(i);
            if (d == null || d.title() == null || d.title().isBlank()) {
                throw new GenerationException(OPERATION, "Deliverable " + (i + 1) + " has no title");
            }
            String title = d.title().trim();
            if (!titles.add(title)) {
                throw new GenerationException(OPERATION, "Duplicate deliverable title '" + title + "'");
            }
            Double hours = finite(d.estimatedHours());
            if (hours == null || hours <= 0) {
                throw new GenerationException(OPERATION,
                        "Deliverable '" + title + "' has no positive hour estimate");
            }
            int priority = d.priority() != null && d.priority() > 0 ? d.priority() : i + 1;
            Double confidence = finite(d.confidence());
            deliverables.add(new IdeaAnalysis.Deliverable(
                    title,
                    d.description() != null ? d.description().trim() : "",
                    priority,
                    hours,
                    confidence != null ? clamp(confidence, 0, 1) : DEFAULT_CONFIDENCE,
                    nonBlank(d.dependsOn())));
        }
        deliverables.sort(Comparator.comparingInt(IdeaAnalysis.Deliverable::priority));
        return deliverables;
    }

    private IdeaAnalysis.Complexity normalizeComplexity(AnalysisDraft.ComplexityDraft draft) {
        Double raw = draft != null ? finite(draft.score()) : null;
        int score = raw != null ? (int) clamp(Math.round(raw), 1, 10) : DEFAULT_COMPLEXITY;
        return new IdeaAnalysis.Complexity(score, draft != null ? nonBlank(draft.factors()) : List.of(),
                levelFor(score));
    }

    static ComplexityLevel levelFor(int score) {
        if (score <= 3) {
            return ComplexityLevel.SIMPLE;
        }
        if (score <= 7) {
            return ComplexityLevel.MEDIUM;
        }
        return ComplexityLevel.COMPLEX;
    }

    private IdeaAnalysis.Scope normalizeScope(AnalysisDraft.ScopeDraft draft, BreakdownOptions options,
                                              double totalHours) {
        int teamSize;
        if (options.teamSize() != null && options.teamSize() > 0) {
            teamSize = options.teamSize();
        } else if (draft != null && draft.teamSize() != null && draft.teamSize() > 0) {
            teamSize = draft.teamSize();
        } else {
            teamSize = breakdownProperties.getDefaultTeamSize();
        }

        ScopeSize size = draft != null ? ScopeSize.from(draft.size()) : null;
        if (size == null) {
            size = totalHours <= SMALL_SCOPE_MAX_HOURS ? ScopeSize.SMALL
                    : totalHours <= MEDIUM_SCOPE_MAX_HOURS ? ScopeSize.MEDIUM
                    : ScopeSize.LARGE;
        }

        int weeks;
        if (draft != null && draft.estimatedWeeks() != null && draft.estimatedWeeks() > 0) {
            weeks = draft.estimatedWeeks();
        } else {
            weeks = (int) Math.max(1, Math.ceil(totalHours / ((double) timelineProperties.getHoursPerWeek() * teamSize)));
        }
        return new IdeaAnalysis.Scope(size, weeks, teamSize);
    }

    private static List<IdeaAnalysis.Objective> normalizeObjectives(List<AnalysisDraft.ObjectiveDraft> drafts) {
        if (drafts == null) {
            return List.of();
        }
        return drafts.stream()
                .filter(Objects::nonNull)
                .filter(o -> o.title() != null && !o.title().isBlank())
                .map(o -> {
                    Double confidence = finite(o.confidence());
                    return new IdeaAnalysis.Objective(o.title().trim(),
                            o.description() != null ? o.description().trim() : "",
                            confidence != null ? clamp(confidence, 0, 1) : DEFAULT_CONFIDENCE);
                })
                .toList();
    }

    private static List<IdeaAnalysis.RiskFactor> normalizeRisks(List<AnalysisDraft.RiskDraft> drafts) {
        if (drafts == null) {
            return List.of();
        }
        return drafts.stream()
                .filter(Objects::nonNull)
                .filter(r -> r.factor() != null && !r.factor().isBlank())
                .map(r -> {
                    Double probability = finite(r.probability());
                    return new IdeaAnalysis.RiskFactor(r.factor().trim(), RiskImpact.from(r.impact()),
                            probability != null ? clamp(probability, 0, 1) : DEFAULT_RISK_PROBABILITY);
                })
                .toList();
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
    }

    private static Double finite(Double value) {
        return value == null || value.isNaN() || value.isInfinite() ? null : value;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}

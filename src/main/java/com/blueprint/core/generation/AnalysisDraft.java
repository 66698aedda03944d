package com.blueprint.core.generation;

import java.util.List;

/**
 * Idea analysis as returned by the generator. Any field may be missing; the idea
 * analyzer validates and normalizes it into an {@link com.blueprint.core.model.IdeaAnalysis}.
 */
public record AnalysisDraft(
    List<ObjectiveDraft> objectives,
    List<DeliverableDraft> deliverables,
    ComplexityDraft complexity,
    ScopeDraft scope,
    List<RiskDraft> riskFactors,
    List<String> successCriteria,
    Double overallConfidence
) {

    public record ObjectiveDraft(String title, String description, Double confidence) {}

    public record DeliverableDraft(
        String title,
        String description,
        Integer priority,
        Double estimatedHours,
        Double confidence,
        List<String> dependsOn
    ) {}

    public record ComplexityDraft(Double score, List<String> factors, String level) {}

    public record ScopeDraft(String size, Integer estimatedWeeks, Integer teamSize) {}

    public record RiskDraft(String factor, String impact, Double probability) {}
}

package com.blueprint.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Structured analysis of an idea: what it aims at, what it delivers, how hard it is.
 * <p>
 * Produced once per breakdown request by the idea analyzer after normalization,
 * so every field is populated and within range.
 *
 * @param objectives        high-level goals
 * @param deliverables      major outputs, ordered by priority
 * @param complexity        clamped complexity score and its level
 * @param scope             size, duration and team estimate
 * @param riskFactors       risks identified for the idea
 * @param successCriteria   how success will be judged
 * @param overallConfidence confidence in [0,1] for the analysis as a whole
 */
public record IdeaAnalysis(
    List<Objective> objectives,
    List<Deliverable> deliverables,
    Complexity complexity,
    Scope scope,
    List<RiskFactor> riskFactors,
    List<String> successCriteria,
    double overallConfidence
) implements Serializable {

    public IdeaAnalysis {
        objectives = objectives != null ? List.copyOf(objectives) : List.of();
        deliverables = deliverables != null ? List.copyOf(deliverables) : List.of();
        riskFactors = riskFactors != null ? List.copyOf(riskFactors) : List.of();
        successCriteria = successCriteria != null ? List.copyOf(successCriteria) : List.of();
    }

    public record Objective(String title, String description, double confidence) implements Serializable {}

    /**
     * A major grouping of work.
     *
     * @param title          unique title; tasks refer back to it as their deliverable id
     * @param description    what the deliverable contains
     * @param priority       1 is most important
     * @param estimatedHours effort estimate, always positive
     * @param confidence     confidence in [0,1] for this deliverable
     * @param dependsOn      titles of deliverables that must be finished first
     */
    public record Deliverable(
        String title,
        String description,
        int priority,
        double estimatedHours,
        double confidence,
        List<String> dependsOn
    ) implements Serializable {

        public Deliverable {
            dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        }
    }

    public record Complexity(int score, List<String> factors, ComplexityLevel level) implements Serializable {

        public Complexity {
            factors = factors != null ? List.copyOf(factors) : List.of();
        }
    }

    public record Scope(ScopeSize size, int estimatedWeeks, int teamSize) implements Serializable {}

    public record RiskFactor(String factor, RiskImpact impact, double probability) implements Serializable {}

    public double totalDeliverableHours() {
        return deliverables.stream().mapToDouble(Deliverable::estimatedHours).sum();
    }
}

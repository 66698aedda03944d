package com.blueprint.core.confidence;

import com.blueprint.core.model.DependencyGraph;
import com.blueprint.core.model.IdeaAnalysis;
import com.blueprint.core.model.TaskDecomposition;
import com.blueprint.core.model.Timeline;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Confidence scores shared by the clarifier and the breakdown pipeline. Pure; no side effects.
 */
@Service
public class ConfidenceCalculator {

    private static final double ANALYSIS_WEIGHT = 0.3;
    private static final double TASKS_WEIGHT = 0.3;
    private static final double DEPENDENCIES_WEIGHT = 0.2;
    private static final double TIMELINE_WEIGHT = 0.2;

    // Graph construction is deterministic; the timeline rests on estimates.
    private static final double DEPENDENCIES_CONFIDENCE = 0.8;
    private static final double TIMELINE_CONFIDENCE = 0.7;

    private final ConfidenceProperties properties;

    public ConfidenceCalculator(ConfidenceProperties properties) {
        this.properties = properties;
    }

    /**
     * {@code min(max, base + answered/total * increment)}, or the default confidence when
     * there are no questions. {@code answeredCount} is clamped to {@code [0, totalQuestions]}.
     * The result is rounded to six decimals so that {@code 0.3 + 0.6} compares equal to {@code 0.9}.
     */
    public double calculate(int answeredCount, int totalQuestions) {
        if (totalQuestions <= 0) {
            return properties.getDefaultConfidence();
        }
        int answered = Math.max(0, Math.min(answeredCount, totalQuestions));
        double ratio = (double) answered / totalQuestions;
        double confidence = Math.min(properties.getMaxConfidence(),
                properties.getBaseConfidence() + ratio * properties.getIncrementPerAnswer());
        return Math.round(confidence * 1_000_000) / 1_000_000.0;
    }

    public double calculateFromAnswers(Map<String, String> answers, int totalQuestions) {
        int answered = answers == null ? 0 : answers.size();
        return calculate(answered, totalQuestions);
    }

    /**
     * Weighted confidence over the four breakdown stages, rounded to two decimals.
     * Missing stages contribute nothing.
     */
    public double calculateOverall(IdeaAnalysis analysis, TaskDecomposition tasks,
                                   DependencyGraph dependencies, Timeline timeline) {
        double confidence = 0;
        if (analysis != null) {
            confidence += analysis.overallConfidence() * ANALYSIS_WEIGHT;
        }
        if (tasks != null) {
            confidence += tasks.confidence() * TASKS_WEIGHT;
        }
        if (dependencies != null) {
            confidence += DEPENDENCIES_CONFIDENCE * DEPENDENCIES_WEIGHT;
        }
        if (timeline != null) {
            confidence += TIMELINE_CONFIDENCE * TIMELINE_WEIGHT;
        }
        return Math.round(confidence * 100) / 100.0;
    }

    public double maxConfidence() {
        return properties.getMaxConfidence();
    }
}

package com.blueprint.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for clarification and breakdown.
 */
@Service
public class BlueprintMetrics {

    private final MeterRegistry registry;

    public BlueprintMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBreakdownDuration(long ms) {
        Timer.builder("blueprint.breakdown.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStageDuration(String stage, long ms) {
        Timer.builder("blueprint.breakdown.stage.duration")
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordBreakdownResult(String status) {
        Counter.builder("blueprint.breakdowns.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordTaskCount(int taskCount) {
        DistributionSummary.builder("blueprint.breakdown.task_count")
                .description("Tasks per completed breakdown")
                .register(registry)
                .record(taskCount);
    }

    public void recordClarificationStarted() {
        Counter.builder("blueprint.clarifications.started")
                .register(registry)
                .increment();
    }

    public void recordAnswerSubmitted() {
        Counter.builder("blueprint.clarifications.answers")
                .register(registry)
                .increment();
    }

    public void recordClarificationCompleted() {
        Counter.builder("blueprint.clarifications.completed")
                .register(registry)
                .increment();
    }

    /**
     * Records a content generator call that failed or returned an unusable payload.
     *
     * @param operation generator operation, e.g. "analyze-idea"
     */
    public void recordGenerationFailure(String operation) {
        Counter.builder("blueprint.generation.failures")
                .description("Content generation calls that failed")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    /**
     * Records task dependencies dropped by the dependency repair rule.
     */
    public void recordRepairedDependencies(int dropped) {
        if (dropped <= 0) {
            return;
        }
        Counter.builder("blueprint.tasks.repaired_dependencies")
                .description("Dangling, self or duplicate task dependencies dropped during decomposition")
                .register(registry)
                .increment(dropped);
    }

    public void recordBrokenCycleEdges(int removed) {
        if (removed <= 0) {
            return;
        }
        Counter.builder("blueprint.graph.broken_cycle_edges")
                .description("Dependency edges removed to break cycles")
                .register(registry)
                .increment(removed);
    }
}

package com.blueprint.core.breakdown;

import com.blueprint.core.confidence.ConfidenceCalculator;
import com.blueprint.core.error.Inputs;
import com.blueprint.core.error.ValidationException;
import com.blueprint.core.events.BlueprintEvent;
import com.blueprint.core.events.EventBus;
import com.blueprint.core.generation.ContentGenerator;
import com.blueprint.core.logging.MdcContext;
import com.blueprint.core.metrics.BlueprintMetrics;
import com.blueprint.core.model.BreakdownOptions;
import com.blueprint.core.model.BreakdownSession;
import com.blueprint.core.model.BreakdownStatus;
import com.blueprint.core.model.DependencyGraph;
import com.blueprint.core.model.IdeaAnalysis;
import com.blueprint.core.model.TaskDecomposition;
import com.blueprint.core.model.Timeline;
import com.blueprint.core.persistence.BreakdownSessionRepository;
import com.blueprint.core.persistence.KeyedLocks;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runs the breakdown pipeline for an idea: analysis, task decomposition, dependency
 * graph and timeline, in that order.
 * <p>
 * Runs for the same idea are serialized. The composed {@link BreakdownSession} is stored
 * in one write once every stage has succeeded, replacing any earlier breakdown of the
 * idea; a failed or cancelled run stores nothing.
 */
@Service
public class BreakdownEngine {

    private static final Logger log = LoggerFactory.getLogger(BreakdownEngine.class);

    private final IdeaAnalyzer ideaAnalyzer;
    private final TaskDecomposer taskDecomposer;
    private final DependencyGraphBuilder graphBuilder;
    private final TimelineGenerator timelineGenerator;
    private final ConfidenceCalculator confidenceCalculator;
    private final ContentGenerator contentGenerator;
    private final BreakdownSessionRepository repository;
    private final BreakdownProperties properties;
    private final EventBus eventBus;
    private final BlueprintMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final KeyedLocks locks = new KeyedLocks();
    private final AtomicBoolean initialized = new AtomicBoolean(false);

    public BreakdownEngine(IdeaAnalyzer ideaAnalyzer,
                           TaskDecomposer taskDecomposer,
                           DependencyGraphBuilder graphBuilder,
                           TimelineGenerator timelineGenerator,
                           ConfidenceCalculator confidenceCalculator,
                           ContentGenerator contentGenerator,
                           BreakdownSessionRepository repository,
                           BreakdownProperties properties,
                           EventBus eventBus,
                           BlueprintMetrics metrics,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this.ideaAnalyzer = ideaAnalyzer;
        this.taskDecomposer = taskDecomposer;
        this.graphBuilder = graphBuilder;
        this.timelineGenerator = timelineGenerator;
        this.confidenceCalculator = confidenceCalculator;
        this.contentGenerator = contentGenerator;
        this.repository = repository;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Checks the collaborators once. Later calls do nothing.
     */
    public void initialize() {
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        if (!contentGenerator.isAvailable()) {
            log.warn("Content generator is not configured; breakdowns will fail until it is");
        }
        log.info("Breakdown engine initialized ({} stored breakdowns)", repository.count());
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    /**
     * Runs the full pipeline and stores the result.
     *
     * @param ideaId        the idea to break down
     * @param refinedIdea   idea text, usually the refined idea of a completed clarification
     * @param userResponses clarification answers keyed by question id; may be null
     * @param options       caller hints; may be null
     * @throws ValidationException   if the input has the wrong shape or size
     * @throws CancellationException if the calling thread is interrupted between stages
     */
    public BreakdownSession startBreakdown(String ideaId, String refinedIdea, Map<String, String> userResponses,
                                           BreakdownOptions options) {
        initialize();
        String id = Inputs.requireIdeaId(ideaId, properties.getMaxIdeaIdLength());
        if (refinedIdea == null || refinedIdea.isBlank()) {
            throw new ValidationException("refinedIdea", "is required");
        }
        Map<String, String> responses = userResponses != null ? userResponses : Map.of();
        int responsesSize = serializedSize(responses);
        if (responsesSize > properties.getMaxUserResponsesSize()) {
            throw new ValidationException("userResponses", "must not exceed "
                    + properties.getMaxUserResponsesSize() + " characters when serialized (was " + responsesSize + ")");
        }
        BreakdownOptions opts = options != null ? options : BreakdownOptions.defaults();
        if (opts.teamSize() != null && opts.teamSize() <= 0) {
            throw new ValidationException("teamSize", "must be positive");
        }

        String idea = refinedIdea.trim();
        return locks.withLock(id, () -> run(id, idea, responses, opts));
    }

    public Optional<BreakdownSession> getBreakdownSession(String ideaId) {
        if (ideaId == null || ideaId.isBlank()) {
            return Optional.empty();
        }
        return repository.get(ideaId.trim());
    }

    private BreakdownSession run(String ideaId, String idea, Map<String, String> responses, BreakdownOptions options) {
        MdcContext.setIdea(ideaId);
        Instant startedAt = clock.instant();
        long start = System.currentTimeMillis();
        try {
            log.info("Starting breakdown for idea {} ({} responses)", ideaId, responses.size());
            publish("breakdown.started", ideaId, Map.of("responses", responses.size()));

            IdeaAnalysis analysis = runStage(BreakdownStage.ANALYSIS, ideaId,
                    () -> ideaAnalyzer.analyze(idea, responses, options));
            TaskDecomposition tasks = runStage(BreakdownStage.DECOMPOSITION, ideaId,
                    () -> taskDecomposer.decompose(analysis));
            DependencyGraph graph = runStage(BreakdownStage.DEPENDENCIES, ideaId,
                    () -> graphBuilder.build(tasks.tasks()));
            Timeline timeline = runStage(BreakdownStage.TIMELINE, ideaId,
                    () -> timelineGenerator.generateTimeline(analysis, tasks, graph, options));
            checkInterrupted(ideaId);

            double confidence = confidenceCalculator.calculateOverall(analysis, tasks, graph, timeline);
            long elapsed = System.currentTimeMillis() - start;
            var session = new BreakdownSession("bd_" + UUID.randomUUID(), ideaId, analysis, tasks, graph,
                    timeline, BreakdownStatus.COMPLETED, confidence, elapsed, startedAt, clock.instant());
            repository.upsert(session);

            metrics.recordBreakdownDuration(elapsed);
            metrics.recordBreakdownResult(BreakdownStatus.COMPLETED.name());
            metrics.recordTaskCount(tasks.tasks().size());
            log.info("Breakdown {} for idea {} completed in {}ms: {} tasks, {} weeks, confidence {}",
                    session.id(), ideaId, elapsed, tasks.tasks().size(), timeline.totalWeeks(), confidence);
            publish("breakdown.completed", ideaId, Map.of(
                    "sessionId", session.id(),
                    "tasks", tasks.tasks().size(),
                    "confidence", confidence));
            return session;
        } catch (RuntimeException e) {
            log.error("Breakdown for idea {} failed: {}", ideaId, e.getMessage());
            metrics.recordBreakdownResult(BreakdownStatus.FAILED.name());
            publish("breakdown.failed", ideaId, Map.of(
                    "error", e.getClass().getSimpleName(),
                    "message", String.valueOf(e.getMessage())));
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private <T> T runStage(BreakdownStage stage, String ideaId, Supplier<T> work) {
        checkInterrupted(ideaId);
        MdcContext.setStage(ideaId, stage.label());
        long start = System.currentTimeMillis();
        try {
            log.info("Stage {} started", stage.label());
            T result = work.get();
            long elapsed = System.currentTimeMillis() - start;
            metrics.recordStageDuration(stage.label(), elapsed);
            publish("breakdown.stage", ideaId, Map.of(
                    "stage", stage.label(),
                    "status", stage.status().name(),
                    "durationMs", elapsed));
            return result;
        } finally {
            MdcContext.clearStage();
        }
    }

    private static void checkInterrupted(String ideaId) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Breakdown for idea " + ideaId + " was cancelled");
        }
    }

    private int serializedSize(Map<String, String> responses) {
        try {
            return objectMapper.writeValueAsString(responses).length();
        } catch (JsonProcessingException e) {
            throw new ValidationException("userResponses", "cannot be serialized: " + e.getOriginalMessage());
        }
    }

    private void publish(String eventType, String ideaId, Map<String, Object> payload) {
        eventBus.publish(new BlueprintEvent(eventType, ideaId, payload, clock.instant()));
    }
}

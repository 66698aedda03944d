package com.blueprint.core.clarifier;

import com.blueprint.core.confidence.ConfidenceCalculator;
import com.blueprint.core.error.ConflictException;
import com.blueprint.core.error.GenerationException;
import com.blueprint.core.error.Inputs;
import com.blueprint.core.error.NotFoundException;
import com.blueprint.core.error.ValidationException;
import com.blueprint.core.events.BlueprintEvent;
import com.blueprint.core.events.EventBus;
import com.blueprint.core.generation.ContentGenerator;
import com.blueprint.core.generation.QuestionDraft;
import com.blueprint.core.logging.MdcContext;
import com.blueprint.core.metrics.BlueprintMetrics;
import com.blueprint.core.model.ClarificationSession;
import com.blueprint.core.model.ClarificationStatus;
import com.blueprint.core.model.Question;
import com.blueprint.core.model.QuestionType;
import com.blueprint.core.persistence.ClarificationSessionRepository;
import com.blueprint.core.persistence.KeyedLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Runs the clarification dialogue for an idea: generates questions, records answers
 * and decides when the idea is understood well enough to break down.
 * <p>
 * Calls for the same idea are serialized. Each change is written with a
 * compare-and-swap against the snapshot it was derived from.
 */
@Service
public class ClarifierAgent {

    private static final Logger log = LoggerFactory.getLogger(ClarifierAgent.class);

    private final ContentGenerator contentGenerator;
    private final ClarificationSessionRepository repository;
    private final ConfidenceCalculator confidenceCalculator;
    private final ClarifierProperties properties;
    private final EventBus eventBus;
    private final BlueprintMetrics metrics;
    private final Clock clock;
    private final KeyedLocks locks = new KeyedLocks();

    public ClarifierAgent(ContentGenerator contentGenerator,
                          ClarificationSessionRepository repository,
                          ConfidenceCalculator confidenceCalculator,
                          ClarifierProperties properties,
                          EventBus eventBus,
                          BlueprintMetrics metrics,
                          Clock clock) {
        this.contentGenerator = contentGenerator;
        this.repository = repository;
        this.confidenceCalculator = confidenceCalculator;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Opens a clarification session for an idea, or returns the existing one unchanged.
     *
     * @throws ValidationException if the id is blank or the idea text is out of bounds
     * @throws GenerationException if the generator fails or returns unusable questions
     */
    public ClarificationSession startClarification(String ideaId, String ideaText) {
        String id = Inputs.requireIdeaId(ideaId, properties.getMaxIdeaIdLength());
        String text = Inputs.requireText("ideaText", ideaText,
                properties.getMinIdeaLength(), properties.getMaxIdeaLength());

        return inSession(id, () -> {
            Optional<ClarificationSession> existing = repository.get(id);
            if (existing.isPresent()) {
                log.info("Clarification session for idea {} already exists, returning it", id);
                return existing.get();
            }

            List<Question> questions = toQuestions(contentGenerator.generateQuestions(text));
            Instant now = clock.instant();
            var session = new ClarificationSession(id, text, questions, Map.of(),
                    ClarificationStatus.CLARIFYING, confidenceCalculator.calculate(0, questions.size()),
                    null, now, now);
            repository.upsert(session);

            log.info("Started clarification for idea {} with {} questions", id, questions.size());
            metrics.recordClarificationStarted();
            publish("clarification.started", id, Map.of("questions", questions.size()));
            return session;
        });
    }

    /**
     * Records an answer, replacing any earlier answer to the same question.
     * Resubmitting the stored answer returns the session unchanged.
     *
     * @throws NotFoundException   if the idea has no session
     * @throws ValidationException if the question is unknown, the answer is blank or too long,
     *                             or the session is already complete
     * @throws ConflictException   if the session was replaced while the answer was applied
     */
    public ClarificationSession submitAnswer(String ideaId, String questionId, String answer) {
        String id = Inputs.requireIdeaId(ideaId, properties.getMaxIdeaIdLength());
        if (questionId == null || questionId.isBlank()) {
            throw new ValidationException("questionId", "is required");
        }
        String trimmedAnswer = Inputs.requireText("answer", answer, 1, properties.getMaxAnswerLength());

        return inSession(id, () -> {
            ClarificationSession session = repository.get(id)
                    .orElseThrow(() -> NotFoundException.clarificationSession(id));
            if (!session.hasQuestion(questionId)) {
                throw new ValidationException("questionId", "'" + questionId + "' is not a question of idea " + id);
            }
            if (trimmedAnswer.equals(session.answers().get(questionId))) {
                log.debug("Answer to {} unchanged, nothing to record", questionId);
                return session;
            }
            if (session.isComplete()) {
                throw new ValidationException("Clarification for idea " + id + " is already complete");
            }

            int answered = session.answers().containsKey(questionId)
                    ? session.answers().size()
                    : session.answers().size() + 1;
            double confidence = confidenceCalculator.calculate(answered, session.questions().size());
            ClarificationStatus status = confidence >= properties.getCompletionThreshold()
                    ? ClarificationStatus.COMPLETE
                    : ClarificationStatus.CLARIFYING;

            ClarificationSession updated = session.withAnswer(questionId, trimmedAnswer, confidence,
                    status, clock.instant());
            store(session, updated);

            log.info("Recorded answer to {} for idea {} ({}/{} answered, confidence {})",
                    questionId, id, answered, session.questions().size(), confidence);
            metrics.recordAnswerSubmitted();
            publish("clarification.answered", id, Map.of(
                    "questionId", questionId,
                    "confidence", confidence,
                    "status", status.name()));
            if (updated.isComplete()) {
                metrics.recordClarificationCompleted();
                publish("clarification.completed", id, Map.of("confidence", confidence));
            }
            return updated;
        });
    }

    /**
     * Completes the session on request: the generator folds the answers into a refined idea
     * and confidence is raised to the maximum. A session that is already complete is
     * returned as is.
     *
     * @throws NotFoundException   if the idea has no session
     * @throws ValidationException if required questions are still unanswered
     * @throws GenerationException if the refined idea cannot be generated
     */
    public ClarificationSession completeClarification(String ideaId) {
        String id = Inputs.requireIdeaId(ideaId, properties.getMaxIdeaIdLength());

        return inSession(id, () -> {
            ClarificationSession session = repository.get(id)
                    .orElseThrow(() -> NotFoundException.clarificationSession(id));
            if (session.isComplete()) {
                return session;
            }
            List<Question> unanswered = session.unansweredRequired();
            if (!unanswered.isEmpty()) {
                throw new ValidationException(unanswered.size() + " required question(s) still unanswered: "
                        + unanswered.stream().map(Question::id).toList());
            }

            String refinedIdea = contentGenerator.refineIdea(session);
            double confidence = Math.max(session.confidence(), confidenceCalculator.maxConfidence());
            ClarificationSession updated = session.completed(refinedIdea, confidence, clock.instant());
            store(session, updated);

            log.info("Completed clarification for idea {}", id);
            metrics.recordClarificationCompleted();
            publish("clarification.completed", id, Map.of("confidence", confidence));
            return updated;
        });
    }

    public Optional<ClarificationSession> getSession(String ideaId) {
        if (ideaId == null || ideaId.isBlank()) {
            return Optional.empty();
        }
        return repository.get(ideaId.trim());
    }

    private List<Question> toQuestions(List<QuestionDraft> drafts) {
        if (drafts == null) {
            throw new GenerationException("generate-questions", "Generator returned no questions");
        }
        if (drafts.size() < properties.getMinQuestions() || drafts.size() > properties.getMaxQuestions()) {
            throw new GenerationException("generate-questions", "Generator returned " + drafts.size()
                    + " questions, expected between " + properties.getMinQuestions()
                    + " and " + properties.getMaxQuestions());
        }
        Set<String> ids = new HashSet<>();
        for (QuestionDraft draft : drafts) {
            if (draft != null && draft.id() != null && !draft.id().isBlank() && !ids.add(draft.id().trim())) {
                throw new GenerationException("generate-questions", "Duplicate question id " + draft.id().trim());
            }
        }

        List<Question> questions = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            QuestionDraft draft = drafts.get(i);
            if (draft == null || draft.question() == null || draft.question().isBlank()) {
                throw new GenerationException("generate-questions", "Question " + (i + 1) + " has no text");
            }
            String qid = draft.id() == null || draft.id().isBlank() ? defaultId(i + 1, ids) : draft.id().trim();
            questions.add(new Question(qid, draft.question().trim(), QuestionType.from(draft.type()),
                    options(draft.options()), draft.required() == null || draft.required(), false));
        }
        return questions;
    }

    /** q_n for the draft's position, or the next free q_n when an explicit id already took it. */
    private static String defaultId(int position, Set<String> taken) {
        int n = position;
        while (!taken.add("q_" + n)) {
            n++;
        }
        return "q_" + n;
    }

    private static List<String> options(List<String> raw) {
        return raw == null ? List.of() : raw.stream()
                .filter(o -> o != null && !o.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
    }

    private void store(ClarificationSession expected, ClarificationSession updated) {
        if (!repository.replace(expected, updated)) {
            throw new ConflictException("Clarification session for idea " + expected.ideaId()
                    + " was modified concurrently");
        }
    }

    private <T> T inSession(String ideaId, Supplier<T> action) {
        return locks.withLock(ideaId, () -> {
            MdcContext.setIdea(ideaId);
            try {
                return action.get();
            } finally {
                MdcContext.clear();
            }
        });
    }

    private void publish(String eventType, String ideaId, Map<String, Object> payload) {
        eventBus.publish(new BlueprintEvent(eventType, ideaId, payload, clock.instant()));
    }
}

package com.blueprint.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the question/answer exchange that refines an idea before breakdown.
 * <p>
 * Instances are immutable; every mutation produces a new snapshot which the
 * clarifier stores in place of the previous one.
 *
 * @param ideaId      unique key of the idea being clarified
 * @param ideaText    the original idea text
 * @param questions   ordered questions, with {@code answered} kept in sync with {@code answers}
 * @param answers     answers keyed by question id, in submission order
 * @param status      lifecycle status
 * @param confidence  confidence in [0,1] that the idea is understood
 * @param refinedIdea idea text rewritten with the answers; null until explicit completion
 * @param createdAt   when the session was created
 * @param updatedAt   when the session last changed
 */
public record ClarificationSession(
    String ideaId,
    String ideaText,
    List<Question> questions,
    Map<String, String> answers,
    ClarificationStatus status,
    double confidence,
    String refinedIdea,
    Instant createdAt,
    Instant updatedAt
) implements Serializable {

    public ClarificationSession {
        questions = questions != null ? List.copyOf(questions) : List.of();
        answers = answers != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(answers))
                : Map.of();
    }

    public boolean isComplete() {
        return status == ClarificationStatus.COMPLETE;
    }

    public boolean hasQuestion(String questionId) {
        return questions.stream().anyMatch(q -> q.id().equals(questionId));
    }

    /**
     * The refined idea when one was generated; otherwise the original idea followed by
     * the answered questions.
     */
    public String refinedIdeaOrSummary() {
        if (refinedIdea != null && !refinedIdea.isBlank()) {
            return refinedIdea;
        }
        if (answers.isEmpty()) {
            return ideaText;
        }
        var sb = new StringBuilder(ideaText).append("\n\nAdditional Details:");
        for (Question q : questions) {
            String answer = answers.get(q.id());
            if (answer != null) {
                sb.append("\nQ: ").append(q.text()).append("\nA: ").append(answer);
            }
        }
        return sb.toString();
    }

    public List<Question> unansweredRequired() {
        return questions.stream()
                .filter(Question::required)
                .filter(q -> !answers.containsKey(q.id()))
                .toList();
    }

    /**
     * Returns a copy with {@code answer} recorded for {@code questionId}, replacing any
     * previous answer to the same question.
     */
    public ClarificationSession withAnswer(String questionId, String answer, double newConfidence,
                                           ClarificationStatus newStatus, Instant now) {
        var newAnswers = new LinkedHashMap<>(answers);
        newAnswers.put(questionId, answer);
        var newQuestions = questions.stream()
                .map(q -> q.withAnswered(newAnswers.containsKey(q.id())))
                .toList();
        return new ClarificationSession(ideaId, ideaText, newQuestions, newAnswers,
                newStatus, newConfidence, refinedIdea, createdAt, now);
    }

    public ClarificationSession completed(String newRefinedIdea, double newConfidence, Instant now) {
        return new ClarificationSession(ideaId, ideaText, questions, answers,
                ClarificationStatus.COMPLETE, newConfidence, newRefinedIdea, createdAt, now);
    }
}

package com.blueprint.core.generation;

import com.blueprint.core.model.BreakdownOptions;
import com.blueprint.core.model.ClarificationSession;
import com.blueprint.core.model.IdeaAnalysis;

import java.util.List;
import java.util.Map;

/**
 * Produces the natural-language content the clarifier and the breakdown pipeline structure.
 * <p>
 * Implementations may be slow and rate limited. They do not retry; every failure,
 * including an unusable reply, surfaces as a
 * {@link com.blueprint.core.error.GenerationException}.
 */
public interface ContentGenerator {

    /** Clarifying questions for a raw idea. */
    List<QuestionDraft> generateQuestions(String ideaText);

    /** Candidate analysis fields for an idea and its clarification answers. */
    AnalysisDraft analyzeIdea(String ideaText, Map<String, String> answers, BreakdownOptions options);

    /** Candidate tasks for one deliverable. */
    List<TaskDraft> generateTasks(IdeaAnalysis.Deliverable deliverable);

    /** The idea rewritten with the session's answers folded in. */
    String refineIdea(ClarificationSession session);

    /** Whether the generator is configured well enough to be called. */
    default boolean isAvailable() {
        return true;
    }
}

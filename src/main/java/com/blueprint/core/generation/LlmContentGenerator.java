package com.blueprint.core.generation;

import com.blueprint.core.error.GenerationException;
import com.blueprint.core.llm.LlmProperties;
import com.blueprint.core.llm.LlmService;
import com.blueprint.core.metrics.BlueprintMetrics;
import com.blueprint.core.model.BreakdownOptions;
import com.blueprint.core.model.ClarificationSession;
import com.blueprint.core.model.IdeaAnalysis;
import com.blueprint.core.model.Question;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link ContentGenerator} backed by the configured chat model.
 * <p>
 * Every call is a single structured LLM request; errors from the model client or
 * from parsing the reply are reported as {@link GenerationException} tagged with
 * the operation name.
 */
@Component
public class LlmContentGenerator implements ContentGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmContentGenerator.class);

    static final String GENERATE_QUESTIONS = "generate-questions";
    static final String ANALYZE_IDEA = "analyze-idea";
    static final String DECOMPOSE_TASKS = "decompose-tasks";
    static final String REFINE_IDEA = "refine-idea";

    private static final String QUESTIONS_SYSTEM_PROMPT = """
            You are a helpful project clarifier. Before a project idea is broken down into a plan,
            you ask the questions whose answers most change that plan.

            Ask about:
            1. Target audience
            2. Core features
            3. Timeline
            4. Budget constraints
            5. Technical preferences

            ## Rules

            1. Ask 3-7 questions; skip anything already obvious from the idea
            2. Use type "open", "multiple_choice" or "yes_no"
            3. Provide options for multiple_choice questions
            4. Mark a question required=true when the plan depends on its answer
            5. Give each question a short snake_case id

            Respond with valid JSON matching the schema provided.
            """;

    private static final String ANALYZE_SYSTEM_PROMPT = """
            You are an expert project manager and technical architect. Analyze the project idea
            and the user's clarification answers and describe:

            - objectives: the goals of the project
            - deliverables: 2-6 major outputs, each with a unique title, a description,
              a priority (1 = most important), estimatedHours and a confidence between 0 and 1;
              list in dependsOn the titles of deliverables that must be finished first
            - complexity: a score from 1 to 10 with the factors driving it
            - scope: size (small, medium, large), estimatedWeeks and teamSize
            - riskFactors: factor, impact (low, medium, high) and probability between 0 and 1
            - successCriteria: measurable outcomes
            - overallConfidence: between 0 and 1

            Respond with valid JSON matching the schema provided.
            """;

    private static final String DECOMPOSE_SYSTEM_PROMPT = """
            You are an expert project manager. Break the deliverable into 2-8 specific,
            actionable tasks whose estimatedHours add up to roughly the deliverable's estimate.

            For each task provide a short id (e.g. "a", "b"), a clear title, a description,
            estimatedHours, complexity (1-10), requiredSkills and dependencies listing the ids
            of tasks in this list that must be finished first. Never list a task as its own
            dependency.

            Respond with valid JSON matching the schema provided.
            """;

    private static final String REFINE_SYSTEM_PROMPT = """
            You rewrite a raw project idea into a clear, complete description by folding in
            the answers the user gave to clarifying questions. Keep every concrete detail from
            the answers. Reply with the refined description only, as plain text.
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;
    private final BlueprintMetrics metrics;

    public LlmContentGenerator(LlmService llmService, LlmProperties llmProperties, BlueprintMetrics metrics) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
        this.metrics = metrics;
    }

    @Override
    public List<QuestionDraft> generateQuestions(String ideaText) {
        String userPrompt = "Project Idea: " + ideaText;
        QuestionDraft.Batch batch = invoke(GENERATE_QUESTIONS,
                () -> llmService.structuredCall(QUESTIONS_SYSTEM_PROMPT, userPrompt, QuestionDraft.Batch.class));
        if (batch == null || batch.questions() == null) {
            throw failure(GENERATE_QUESTIONS, "Generator returned no questions array");
        }
        return batch.questions();
    }

    @Override
    public AnalysisDraft analyzeIdea(String ideaText, Map<String, String> answers, BreakdownOptions options) {
        String userPrompt = buildAnalysisPrompt(ideaText, answers, options);
        AnalysisDraft draft = invoke(ANALYZE_IDEA,
                () -> llmService.structuredCall(ANALYZE_SYSTEM_PROMPT, userPrompt, AnalysisDraft.class));
        if (draft == null) {
            throw failure(ANALYZE_IDEA, "Generator returned no analysis");
        }
        return draft;
    }

    @Override
    public List<TaskDraft> generateTasks(IdeaAnalysis.Deliverable deliverable) {
        String userPrompt = String.format("""
                Deliverable: %s
                Description: %s
                Priority: %d
                Estimated Hours: %.1f
                """,
                deliverable.title(), deliverable.description(),
                deliverable.priority(), deliverable.estimatedHours());
        TaskDraft.Batch batch = invoke(DECOMPOSE_TASKS,
                () -> llmService.structuredCall(DECOMPOSE_SYSTEM_PROMPT, userPrompt, TaskDraft.Batch.class));
        if (batch == null || batch.tasks() == null) {
            throw failure(DECOMPOSE_TASKS, "Generator returned no tasks array for deliverable " + deliverable.title());
        }
        return batch.tasks();
    }

    @Override
    public String refineIdea(ClarificationSession session) {
        String userPrompt = "Original Idea:\n" + session.ideaText()
                + "\n\nClarifications:\n" + formatAnswers(session);
        String refined = invoke(REFINE_IDEA, () -> llmService.textCall(REFINE_SYSTEM_PROMPT, userPrompt));
        if (refined == null || refined.isBlank()) {
            throw failure(REFINE_IDEA, "Generator returned an empty refined idea");
        }
        return refined;
    }

    @Override
    public boolean isAvailable() {
        return llmProperties.hasApiKey();
    }

    private <T> T invoke(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (GenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Content generation '{}' failed: {}", operation, e.getMessage());
            metrics.recordGenerationFailure(operation);
            throw new GenerationException(operation, "Content generation failed during " + operation
                    + ": " + e.getMessage(), e);
        }
    }

    private GenerationException failure(String operation, String message) {
        log.error("Content generation '{}' returned an unusable payload: {}", operation, message);
        metrics.recordGenerationFailure(operation);
        return new GenerationException(operation, message);
    }

    private static String buildAnalysisPrompt(String ideaText, Map<String, String> answers, BreakdownOptions options) {
        var sb = new StringBuilder();
        sb.append("Refined Idea:\n").append(ideaText).append("\n\n");
        if (answers != null && !answers.isEmpty()) {
            sb.append("User Responses:\n");
            answers.forEach((key, value) -> sb.append("- ").append(key).append(": ").append(value).append('\n'));
            sb.append('\n');
        }
        if (options != null) {
            sb.append("Options:\n");
            if (options.complexity() != null) {
                sb.append("- Expected complexity: ").append(options.complexity()).append('\n');
            }
            if (options.teamSize() != null) {
                sb.append("- Team size: ").append(options.teamSize()).append('\n');
            }
            if (options.timelineWeeks() != null) {
                sb.append("- Desired timeline (weeks): ").append(options.timelineWeeks()).append('\n');
            }
            if (!options.constraints().isEmpty()) {
                sb.append("- Constraints: ").append(String.join("; ", options.constraints())).append('\n');
            }
        }
        return sb.toString();
    }

    private static String formatAnswers(ClarificationSession session) {
        Map<String, String> questionText = session.questions().stream()
                .collect(Collectors.toMap(Question::id, Question::text, (a, b) -> a));
        return session.answers().entrySet().stream()
                .map(e -> "Q: " + questionText.getOrDefault(e.getKey(), "Unknown question")
                        + "\nA: " + e.getValue())
                .collect(Collectors.joining("\n\n"));
    }
}

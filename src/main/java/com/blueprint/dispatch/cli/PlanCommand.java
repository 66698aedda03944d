package com.blueprint.dispatch.cli;

import com.blueprint.core.breakdown.BreakdownEngine;
import com.blueprint.core.clarifier.ClarifierAgent;
import com.blueprint.core.error.BlueprintException;
import com.blueprint.core.error.ValidationException;
import com.blueprint.core.export.ExportFormat;
import com.blueprint.core.export.ExportService;
import com.blueprint.core.model.BreakdownOptions;
import com.blueprint.core.model.BreakdownSession;
import com.blueprint.core.model.ClarificationSession;
import com.blueprint.core.model.Question;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * CLI command: blueprint plan "&lt;idea&gt;"
 * <p>
 * Asks the clarifying questions on the terminal, then breaks the clarified idea down
 * and prints the plan. An empty line skips a question.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Clarify an idea and break it down into a plan")
@Component
public class PlanCommand implements Runnable {

    @Parameters(index = "0", description = "The project idea, in plain language")
    private String idea;

    @Option(names = {"--id"}, description = "Idea id; generated when omitted")
    private String ideaId;

    @Option(names = {"--team-size", "-t"}, description = "People working on the plan")
    private Integer teamSize;

    @Option(names = {"--weeks", "-w"}, description = "Desired duration in weeks")
    private Integer timelineWeeks;

    @Option(names = {"--constraint", "-c"}, description = "A constraint to respect; repeatable")
    private List<String> constraints;

    @Option(names = {"--skip-questions"}, description = "Break the idea down without clarifying it first")
    private boolean skipQuestions;

    @Option(names = {"--format", "-f"}, description = "Also print the plan as a document: markdown or json")
    private String format;

    private final ClarifierAgent clarifierAgent;
    private final BreakdownEngine breakdownEngine;
    private final ExportService exportService;
    private InputStream input = System.in;

    public PlanCommand(ClarifierAgent clarifierAgent, BreakdownEngine breakdownEngine, ExportService exportService) {
        this.clarifierAgent = clarifierAgent;
        this.breakdownEngine = breakdownEngine;
        this.exportService = exportService;
    }

    void setInput(InputStream input) {
        this.input = input;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        String id = ideaId != null && !ideaId.isBlank() ? ideaId : "idea-" + UUID.randomUUID().toString().substring(0, 8);
        var options = new BreakdownOptions(null, teamSize, timelineWeeks, constraints);

        try {
            ExportFormat exportFormat = format != null ? ExportFormat.from(format) : null;
            String planInput = idea;
            ClarificationSession session = null;
            if (!skipQuestions) {
                session = clarify(id);
                planInput = session.refinedIdeaOrSummary();
            }

            ConsoleOutput.info("Breaking down idea " + id + "...");
            BreakdownSession breakdown = breakdownEngine.startBreakdown(id, planInput,
                    session != null ? session.answers() : null, options);
            ConsoleOutput.breakdown(breakdown);
            if (exportFormat != null) {
                System.out.println();
                System.out.println(exportService.render(breakdown, planInput, exportFormat).content());
            }
            ConsoleOutput.success("Plan ready.");
        } catch (BlueprintException e) {
            ConsoleOutput.error(e.getMessage() + (e.retryable() ? " (retryable)" : ""));
        }
    }

    private ClarificationSession clarify(String id) {
        ConsoleOutput.info("Generating clarifying questions...");
        ClarificationSession session = clarifierAgent.startClarification(id, idea);
        var reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));

        int number = 0;
        for (Question question : session.questions()) {
            number++;
            if (session.isComplete()) {
                break;
            }
            if (question.answered()) {
                continue;
            }
            ConsoleOutput.question(number, question);
            System.out.print("  > ");
            String answer = readLine(reader);
            if (answer == null) {
                break;
            }
            if (answer.isBlank()) {
                continue;
            }
            session = clarifierAgent.submitAnswer(id, question.id(), answer);
        }

        if (!session.isComplete()) {
            try {
                session = clarifierAgent.completeClarification(id);
            } catch (ValidationException e) {
                ConsoleOutput.warn("Continuing without a refined idea: " + e.getMessage());
                return session;
            }
        }
        ConsoleOutput.success(String.format("Clarified (confidence %.0f%%)", session.confidence() * 100));
        return session;
    }

    private static String readLine(BufferedReader reader) {
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read answer from input", e);
        }
    }
}

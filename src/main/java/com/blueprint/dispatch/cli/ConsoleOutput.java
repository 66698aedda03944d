package com.blueprint.dispatch.cli;

import com.blueprint.core.model.BreakdownSession;
import com.blueprint.core.model.Question;
import com.blueprint.core.model.Task;
import com.blueprint.core.model.Timeline;
import picocli.CommandLine;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * ANSI-colored terminal output utilities for the Blueprint CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) BLUEPRINT v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [BLUEPRINT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void question(int number, Question question) {
        String marker = question.required() ? "" : " @|faint (optional)|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(blue) Q" + number + ".|@ " + question.text() + marker));
        for (String option : question.options()) {
            System.out.println("     - " + option);
        }
    }

    public static void breakdown(BreakdownSession session) {
        var analysis = session.analysis();
        var timeline = session.timeline();

        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Plan " + session.id() + "|@"));
        System.out.println(String.format("  Complexity: %d/10 (%s) | Scope: %s | Team: %d",
                analysis.complexity().score(), analysis.complexity().level(),
                analysis.scope().size(), analysis.scope().teamSize()));
        System.out.println(String.format("  %d tasks, %.1f hours, %d weeks (%s to %s)",
                session.tasks().tasks().size(), session.tasks().totalEstimatedHours(), timeline.totalWeeks(),
                DATE.format(timeline.startDate()), DATE.format(timeline.endDate())));

        System.out.println();
        System.out.println("DELIVERABLES:");
        for (var d : analysis.deliverables()) {
            System.out.printf("  P%d  %-40s %6.1fh%n", d.priority(), d.title(), d.estimatedHours());
            for (Task t : session.tasks().tasks()) {
                if (d.title().equals(t.deliverableId())) {
                    String deps = t.dependencies().isEmpty() ? "" : " <- " + String.join(", ", t.dependencies());
                    System.out.printf("      %-5s %s (%.1fh)%s%n", t.id(), t.title(), t.estimatedHours(), deps);
                }
            }
        }

        System.out.println();
        System.out.println("PHASES:");
        for (Timeline.Phase phase : timeline.phases()) {
            System.out.printf("  %-22s %s → %s  %d tasks%n", phase.name(),
                    DATE.format(phase.startDate()), DATE.format(phase.endDate()), phase.tasks().size());
        }

        System.out.println();
        System.out.println("MILESTONES:");
        for (Timeline.Milestone m : timeline.milestones()) {
            System.out.printf("  %-4s %s  %s%n", m.id(), DATE.format(m.date()), m.title());
        }

        if (!timeline.criticalPath().isEmpty()) {
            System.out.println();
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(yellow) Critical path:|@ " + String.join(" → ", timeline.criticalPath())));
        }
        System.out.println(RULE);
        System.out.println(String.format("Confidence: %.0f%% | Processed in %s",
                session.confidence() * 100, formatDuration(session.processingTimeMs())));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}

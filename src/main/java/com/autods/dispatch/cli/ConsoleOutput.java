package com.autods.dispatch.cli;

import com.autods.core.events.RunEvent;
import com.autods.core.model.ModelMetrics;
import com.autods.core.model.RunOutcome;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the autods CLI.
 * <p>
 * Progress goes to stdout; errors go to stderr.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AUTODS v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AUTODS]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * Prints a bare path with no decoration so it can be consumed by scripts.
     */
    public static void path(Path path) {
        System.out.println(path);
    }

    public static void event(RunEvent event) {
        String prefix = switch (event.eventType()) {
            case RunEvent.RUN_CREATED -> "@|fg(cyan) [RUN]|@";
            case RunEvent.ITERATION_COMPLETED -> "@|fg(blue) [ITERATION " + event.iteration() + "]|@";
            case RunEvent.REPLAN_STARTED -> "@|bold,fg(yellow) [REPLAN]|@";
            case RunEvent.RUN_COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + describe(event)));
    }

    public static void outcome(RunOutcome outcome) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run Summary|@"));
        System.out.println("  Run:        " + outcome.runId());
        System.out.println("  Target:     " + outcome.target());
        System.out.println("  Iterations: " + outcome.iterations() + " (replans: " + outcome.replans() + ")");
        if (outcome.evaluation() != null) {
            ModelMetrics best = outcome.evaluation().bestMetrics();
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  Best model: @|bold " + best.model() + "|@"
                    + String.format(Locale.ROOT, " (balanced_accuracy %.3f, f1_macro %.3f)",
                            best.balancedAccuracy(), best.f1Macro())));
        }
        if (outcome.reflection() != null) {
            String status = outcome.reflection().status().label();
            String color = outcome.reflection().issues().isEmpty() ? "fg(green)" : "fg(yellow)";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  Reflection: @|" + color + " " + status + "|@"));
            for (String issue : outcome.reflection().issues()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(yellow) -|@ " + issue));
            }
        }
    }

    private static String describe(RunEvent event) {
        var payload = event.payload();
        return switch (event.eventType()) {
            case RunEvent.RUN_CREATED -> event.runId() + " on " + payload.get("data");
            case RunEvent.ITERATION_COMPLETED -> "best " + payload.get("bestModel")
                    + String.format(Locale.ROOT, " balanced_accuracy=%.3f f1_macro=%.3f",
                            ((Number) payload.get("balancedAccuracy")).doubleValue(),
                            ((Number) payload.get("f1Macro")).doubleValue())
                    + " (" + payload.get("status") + ")";
            case RunEvent.REPLAN_STARTED -> "attempt " + payload.get("attempt");
            case RunEvent.RUN_COMPLETED -> Boolean.TRUE.equals(payload.get("budgetExhausted"))
                    ? "replan budget reached" : "done";
            default -> String.valueOf(payload);
        };
    }
}

package com.mendwatch.dispatch.cli;

import com.mendwatch.core.errors.ErrorStats;
import com.mendwatch.core.events.MendwatchEvent;
import com.mendwatch.core.model.DetectedError;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for Mendwatch CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) MENDWATCH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MENDWATCH]|@ " + message));
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

    public static void detectedError(DetectedError error) {
        String color = switch (error.severity()) {
            case CRITICAL, HIGH -> "fg(red)";
            case MEDIUM -> "fg(yellow)";
            case LOW -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + error.severity() + "|@ " + error.filePath() + ":" + error.lineNumber()
                + " @|bold " + error.errorType() + "|@ " + error.message()));
    }

    public static void event(MendwatchEvent event) {
        String color = event.eventType().endsWith("failed") || event.eventType().endsWith("error")
                ? "fg(red)" : event.eventType().startsWith("error.") ? "fg(yellow)" : "fg(blue)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|" + color + " [" + event.eventType() + "]|@ " + event.source() + " " + event.payload()));
    }

    public static void stats(ErrorStats stats) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Errors|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Total: " + stats.total() + ", @|fg(green) " + stats.resolved() + " resolved|@, @|fg(red) "
                + stats.unresolved() + " unresolved|@"));
        counts("By type", stats.byType());
        counts("By file", stats.byFile());
    }

    public static void counts(String title, Map<String, Integer> counts) {
        if (counts.isEmpty()) {
            return;
        }
        System.out.println("  " + title + ":");
        counts.forEach((key, count) -> System.out.println("    " + key + ": " + count));
    }
}

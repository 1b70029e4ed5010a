package com.parallax.dispatch.cli;

import com.parallax.core.ledger.ItemRecord;
import com.parallax.core.model.ItemStatus;
import com.parallax.core.model.SessionMetrics;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Parallax CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PARALLAX v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PARALLAX]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void level(int levelNumber, List<Integer> items, List<String> texts) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [LEVEL " + levelNumber + "]|@ " +
                items.size() + " item" + (items.size() != 1 ? "s" : "")));
        for (int index : items) {
            System.out.printf("  %d. %s%n", index + 1, texts.get(index));
        }
    }

    public static void itemOutcome(ItemRecord item, String text) {
        String color = switch (item.status()) {
            case ACCEPTED -> "fg(green)";
            case SKIPPED -> "fg(yellow)";
            default -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + item.status() + "|@ " + (item.index() + 1) + ". " + text +
                " (" + item.attempts() + " attempt" + (item.attempts() != 1 ? "s" : "") + ")"));
        if (item.status() != ItemStatus.ACCEPTED) {
            for (String reason : item.reasons()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "    @|fg(red) -|@ " + reason));
            }
        }
    }

    public static void metrics(SessionMetrics m) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Session Metrics|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Items: @|fg(green) " + m.itemsAccepted() + " accepted|@, @|fg(red) " +
                m.itemsFailed() + " failed|@, " + m.itemsSkipped() + " skipped of " + m.itemsTotal()));
        System.out.println("  Levels: " + m.levelsExecuted() + " | Attempts: " + m.totalAttempts());
        if (m.conflictsDetected() > 0) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  Conflicts: " + m.conflictsDetected() + " detected, @|fg(green) " +
                    m.conflictsResolved() + " resolved|@"));
        }
        System.out.println("  Duration: " + formatDuration(m.totalDurationMs()));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}

package com.jiracdc.dispatch.cli;

import com.jiracdc.core.model.Operation;
import com.jiracdc.core.model.OperationStatus;
import com.jiracdc.core.model.SyncCounters;
import com.jiracdc.core.model.SyncResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the jiracdc CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) JIRA CDC v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [JIRACDC]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void issueResult(SyncResult result) {
        if (!result.success()) {
            error(result.issueKey() + ": " + result.errorMessage());
            return;
        }
        String symbol = switch (result.operationType()) {
            case CREATE -> "@|fg(green) +|@";
            case UPDATE -> "@|fg(yellow) ~|@";
            case DELETE -> "@|fg(red) -|@";
            case UNCHANGED -> "@|fg(white) =|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + symbol + " " + result.issueKey()
                        + (result.commitHash() != null ? " (" + shortHash(result.commitHash()) + ")" : "")));
    }

    public static void event(String eventType, String data) {
        String prefix = switch (eventType) {
            case "operation.created", "operation.started" -> "@|fg(cyan) [OPERATION]|@";
            case "task.started", "task.completed" -> "@|fg(blue) [TASK]|@";
            case "task.failed" -> "@|fg(red) [TASK]|@";
            case "operation.progress" -> "@|fg(white) [PROGRESS]|@";
            case "operation.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "operation.failed" -> "@|fg(red),bold [FAILED]|@";
            case "operation.cancelled" -> "@|fg(yellow),bold [CANCELLED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    public static void operation(Operation op) {
        System.out.println();
        System.out.println("OPERATION " + op.id());
        System.out.println("Kind: " + op.kind() + " | Project: " + op.config().projectKey());
        status(op.status().name(), op.status());

        var p = op.progress();
        info("Progress: %d/%d steps (%d%%) %s".formatted(
                p.completedSteps(), p.totalSteps(), p.percent(), p.lastMessage() != null ? p.lastMessage() : ""));

        if (!op.tasks().isEmpty()) {
            System.out.println();
            System.out.printf("  %-8s %-20s %-10s %s%n", "TASK", "NAME", "STATUS", "DEPENDS ON");
            System.out.println("  " + "-".repeat(56));
            for (var t : op.tasks()) {
                System.out.printf("  %-8s %-20s %-10s %s%n", t.id(), t.name(), t.status(),
                        t.dependencies().isEmpty() ? "-" : String.join(",", t.dependencies()));
            }
        }

        if (op.resultSummary() != null) {
            counters(op.resultSummary().counters(), op.resultSummary().elapsed().toMillis());
        }
        if (op.errorMessage() != null) {
            System.out.println();
            error(op.errorMessage());
        }
    }

    public static void counters(SyncCounters c, long elapsedMs) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Sync Summary|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Issues: " + c.processedIssues() + " processed"
                        + (c.failedIssues() > 0 ? ", @|fg(red) " + c.failedIssues() + " failed|@" : "")));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Files: @|fg(green) " + c.createdFiles() + " created|@, " + c.updatedFiles() + " updated, "
                        + c.deletedFiles() + " deleted, " + c.unchangedFiles() + " unchanged"));
        System.out.println("  Commits: " + c.commits());
        System.out.println("  Duration: " + formatDuration(elapsedMs));
    }

    static void status(String label, OperationStatus status) {
        if (status == OperationStatus.COMPLETED) {
            success("Status: " + label);
        } else if (status == OperationStatus.FAILED || status == OperationStatus.CANCELLED) {
            error("Status: " + label);
        } else {
            info("Status: " + label);
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static String shortHash(String hash) {
        return hash.length() > 8 ? hash.substring(0, 8) : hash;
    }
}

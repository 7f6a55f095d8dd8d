package com.congruence.dispatch.cli;

import com.congruence.core.error.CongruenceException;
import com.congruence.core.git.GitAccessException;
import com.congruence.core.model.CoordinationRun;
import com.congruence.core.model.MiningRun;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CONGRUENCE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CONGRUENCE]|@ " + message));
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

    /**
     * Prints the typed code and message, plus the remediation for git failures.
     *
     * @return the exit code commands return for it
     */
    public static int failure(CongruenceException e) {
        error("[" + e.code() + "] " + e.getMessage());
        if (e instanceof GitAccessException git) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) " + git.errorType() + "|@ " + git.solution()));
        }
        return 1;
    }

    public static void miningRun(MiningRun run) {
        String color = switch (run.status()) {
            case SUCCEEDED -> "fg(green)";
            case FAILED -> "fg(red)";
            case QUEUED, RUNNING -> "fg(yellow)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold RUN " + run.id() + "|@ @|" + color + " " + run.status() + "|@ project " + run.projectId()
                + " on " + run.branch() + " (" + run.dataType().value() + ")"));
        if (run.command() != null) {
            System.out.println("  Command:   " + run.command());
        }
        if (run.artifactDir() != null) {
            System.out.println("  Artifacts: " + run.artifactDir());
        }
        System.out.println("  Created:   " + run.createdAt()
                + (run.finishedAt() != null ? "  Finished: " + run.finishedAt() : ""));
        if (run.errorCode() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) [" + run.errorCode() + "]|@ " + run.errorMessage()));
        }
    }

    public static void coordinationRun(CoordinationRun run) {
        String color = switch (run.band()) {
            case EXCELLENT, GOOD -> "fg(green)";
            case MODERATE -> "fg(yellow)";
            case POOR -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + run.algorithm() + "|@ #" + run.id() + " score @|" + color + " "
                + String.format("%.3f", run.score()) + " " + run.band() + "|@"
                + " (" + run.crCount() + " required, " + run.diffCount() + " missing) " + run.createdAt()));
    }
}

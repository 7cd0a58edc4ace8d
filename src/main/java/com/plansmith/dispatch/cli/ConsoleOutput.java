package com.plansmith.dispatch.cli;

import com.plansmith.core.events.PipelineEvent;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Plansmith CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PLANSMITH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PLANSMITH]|@ " + message));
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

    public static void section(String title) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + title + "|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void event(PipelineEvent event) {
        String prefix = switch (event.eventType()) {
            case "pipeline.started" -> "@|fg(cyan) [RUN]|@";
            case "plan.generated" -> "@|fg(blue) [PLANNER]|@";
            case "plan.validated" -> "@|fg(green),bold [VALID]|@";
            case "plan.rejected" -> "@|fg(red) [INVALID]|@";
            case "plan.refined" -> "@|fg(magenta) [REFINER]|@";
            case "pipeline.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "pipeline.failed" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + event.payload()));
    }
}

package com.plansmith.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Plansmith.
 */
@Command(
        name = "plansmith",
        mixinStandardHelpOptions = true,
        version = "Plansmith 0.1.0",
        description = "Drafts, validates and refines structured project plans with an LLM",
        subcommands = {
                PlanCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PlansmithCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}

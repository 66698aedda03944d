package com.blueprint.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Blueprint.
 * Routes to subcommands: serve, plan, health.
 */
@Command(
        name = "blueprint",
        mixinStandardHelpOptions = true,
        version = "Blueprint 0.1.0",
        description = "Turns project ideas into clarified, dated plans",
        subcommands = {
                ServeCommand.class,
                PlanCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class BlueprintCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}

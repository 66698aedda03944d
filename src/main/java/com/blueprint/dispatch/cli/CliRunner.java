package com.blueprint.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final BlueprintCommand blueprintCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(BlueprintCommand blueprintCommand, IFactory factory) {
        this.blueprintCommand = blueprintCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // In serve mode the embedded web server keeps the JVM alive; picocli's
        // execute() would return at once and let main() exit.
        if (isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(blueprintCommand, factory).execute(args);
    }

    public static boolean isServeMode(String... args) {
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

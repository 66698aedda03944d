package com.blueprint;

import com.blueprint.dispatch.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point for both the REST server ({@code blueprint serve}) and the one-shot
 * CLI commands. Only the server starts a servlet container; a CLI run exits with
 * the command's exit code once it returns.
 */
@SpringBootApplication
public class BlueprintApplication {

    public static void main(String[] args) {
        boolean serveMode = CliRunner.isServeMode(args);

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(BlueprintApplication.class)
                .properties(launchProperties(serveMode))
                .run(args);

        if (!serveMode) {
            System.exit(SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class)));
        }
    }

    static String[] launchProperties(boolean serveMode) {
        return new String[] {
                "spring.main.web-application-type=" + (serveMode ? "servlet" : "none"),
                "spring.main.banner-mode=off"
        };
    }
}

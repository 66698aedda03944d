package com.blueprint.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: blueprint serve
 * <p>
 * Starts Blueprint as a long-running HTTP server exposing the REST API. The web
 * server is enabled by {@link com.blueprint.BlueprintApplication#main} detecting
 * "serve" in the arguments; {@link CliRunner} then skips picocli. The startup banner
 * is printed once the server is ready.
 * <p>
 * Configure the port via {@code SERVER_PORT=9090 blueprint serve}.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Blueprint HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; see CliRunner.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Blueprint server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}

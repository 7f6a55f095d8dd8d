package com.congruence.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: congruence serve
 * <p>
 * Starts the REST API. The web server is enabled by
 * {@link com.congruence.CongruenceApplication#main} detecting "serve" in args,
 * and {@link CliRunner} skips picocli in that mode.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Congruence server running on port " + port);
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}

package com.autowake.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: autowake serve
 * <p>
 * Runs Autowake as a long-lived process: admin REST API plus the idle monitor. The web
 * server is enabled by {@link com.autowake.AutowakeApplication#main} detecting "serve".
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 autowake serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Autowake HTTP server and idle monitor")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8081}")
    private int port;

    @Override
    public void run() {
        // Not called in serve mode, CliRunner skips picocli. Kept for --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Autowake server running on port " + port);
        System.out.println();
        System.out.println("  Services:  http://localhost:" + port + "/api/v1/services");
        System.out.println("  Health:    http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}

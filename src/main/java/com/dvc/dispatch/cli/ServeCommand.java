package com.dvc.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: dvc serve
 * <p>
 * Starts the engine as a long-running HTTP server. The web server is enabled
 * by {@link com.dvc.DvcApplication#main} detecting "serve" in the arguments;
 * {@link CliRunner} then skips picocli and the banner is printed once Tomcat
 * is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the DVC engine HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // only reached through --help style invocations; serve mode bypasses picocli
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("DVC engine running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1");
        System.out.println("  Health:     http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop. Active challenge containers are removed on shutdown.");
    }
}

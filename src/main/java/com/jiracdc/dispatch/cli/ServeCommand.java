package com.jiracdc.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: jiracdc serve
 * <p>
 * Starts the REST API and, when {@code jiracdc.sync.polling-enabled} is set, the poll scheduler.
 * The web server is enabled by {@link com.jiracdc.JiraCdcApplication#main} detecting "serve" in args;
 * {@link CliRunner} then skips picocli and the banner is printed once Tomcat is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the HTTP server and the poll scheduler")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Value("${jiracdc.sync.polling-enabled:false}")
    private boolean pollingEnabled;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Server running on port " + port);
        System.out.println();
        System.out.println("  API:      http://localhost:" + port + "/api/v1");
        System.out.println("  Webhook:  http://localhost:" + port + "/api/v1/webhooks/jira");
        System.out.println("  Polling:  " + (pollingEnabled ? "enabled" : "disabled"));
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}

package com.jiracdc.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jiracdc.core.model.OperationStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: jiracdc status &lt;operation-id&gt;
 * <p>
 * Operations live in the memory of the server that runs them, so this asks a running
 * {@code jiracdc serve} over REST.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the status of an operation")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Operation ID")
    private String operationId;

    @Option(names = {"--host"}, description = "Server host (default: ${DEFAULT-VALUE})", defaultValue = "localhost")
    private String host;

    @Option(names = {"--port"}, description = "Server port (default: ${DEFAULT-VALUE})", defaultValue = "8080")
    private int port;

    private final ObjectMapper objectMapper;

    public StatusCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        URI uri = URI.create("http://" + host + ":" + port + "/api/v1/operations/" + operationId);

        try {
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .build();
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() == 404) {
                ConsoleOutput.error("Operation not found: " + operationId);
                return 1;
            }
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return 1;
            }
            print(objectMapper.readTree(response.body()));
            return 0;
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to server at " + host + ":" + port);
            ConsoleOutput.info("Start the server first: jiracdc serve");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
            return 1;
        } catch (IOException e) {
            ConsoleOutput.error("Status request failed: " + e.getMessage());
            return 1;
        }
    }

    private static void print(JsonNode op) {
        System.out.println();
        System.out.println("OPERATION " + op.path("operation_id").asText());
        System.out.println("Kind: " + op.path("kind").asText() + " | Project: " + op.path("project_key").asText());

        String status = op.path("status").asText();
        OperationStatus parsed;
        try {
            parsed = OperationStatus.valueOf(status);
        } catch (IllegalArgumentException e) {
            parsed = OperationStatus.PENDING;
        }
        ConsoleOutput.status(status, parsed);

        JsonNode progress = op.path("progress");
        ConsoleOutput.info("Progress: %d/%d steps (%d%%) %s".formatted(
                progress.path("completed_steps").asInt(), progress.path("total_steps").asInt(),
                progress.path("percent").asInt(), progress.path("last_message").asText("")));

        JsonNode tasks = op.path("tasks");
        if (tasks.isArray() && !tasks.isEmpty()) {
            System.out.println();
            System.out.printf("  %-8s %-20s %-10s %s%n", "TASK", "NAME", "STATUS", "MESSAGE");
            System.out.println("  " + "-".repeat(56));
            for (JsonNode t : tasks) {
                System.out.printf("  %-8s %-20s %-10s %s%n", t.path("id").asText(), t.path("name").asText(),
                        t.path("status").asText(), t.path("message").asText("-"));
            }
        }

        JsonNode summary = op.path("summary");
        if (summary.isObject()) {
            System.out.println("──────────────────────────────────");
            System.out.println("  Issues: " + summary.path("processed_issues").asInt() + " processed, "
                    + summary.path("failed_issues").asInt() + " failed");
            System.out.println("  Files: " + summary.path("created_files").asInt() + " created, "
                    + summary.path("updated_files").asInt() + " updated, "
                    + summary.path("deleted_files").asInt() + " deleted");
            System.out.println("  Commits: " + summary.path("commits").asInt());
            System.out.println("  Duration: " + ConsoleOutput.formatDuration(summary.path("elapsed_ms").asLong()));
        }

        if (op.hasNonNull("error_message")) {
            System.out.println();
            ConsoleOutput.error(op.path("error_message").asText());
        }
    }
}

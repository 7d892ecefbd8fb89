package com.jiracdc.dispatch.cli;

import com.jiracdc.core.engine.OperationConflictException;
import com.jiracdc.core.engine.OperationDefaults;
import com.jiracdc.core.engine.OperationProcessor;
import com.jiracdc.core.engine.OperationTimeoutException;
import com.jiracdc.core.events.EventBus;
import com.jiracdc.core.events.OperationEvent;
import com.jiracdc.core.model.Operation;
import com.jiracdc.core.model.OperationConfig;
import com.jiracdc.core.model.OperationKind;
import com.jiracdc.core.model.OperationStatus;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: jiracdc sync &lt;kind&gt; --project KEY
 * <p>
 * Runs one operation in-process and waits for it, printing progress events as they arrive.
 * The JVM exits when the command returns, so the command always waits; {@code --wait} bounds
 * how long. On timeout the operation is cancelled.
 */
@Command(name = "sync", mixinStandardHelpOptions = true, description = "Run a synchronization operation")
@Component
public class SyncCommand implements Callable<Integer> {

    static final int EXIT_FAILED = 1;
    static final int EXIT_TIMEOUT = 2;
    static final int EXIT_CONFLICT = 3;

    @Parameters(index = "0", description = "Operation kind: ${COMPLETION-CANDIDATES}")
    private OperationKind kind;

    @Option(names = {"--project", "-p"}, description = "Jira project key (default: jiracdc.sync.project-key)")
    private String projectKey;

    @Option(names = "--active-only", description = "Skip issues in Done, Closed or Resolved")
    private Boolean activeOnly;

    @Option(names = "--filter", description = "Extra JQL clause ANDed onto the project query")
    private String issueFilter;

    @Option(names = "--page-size", description = "Bootstrap page size")
    private Integer pageSize;

    @Option(names = "--branch", description = "Git branch to push to")
    private String branch;

    @Option(names = {"--wait", "-w"}, description = "Seconds to wait before giving up; 0 waits indefinitely",
            defaultValue = "0")
    private long waitSeconds;

    @Option(names = {"--quiet", "-q"}, description = "Do not print progress events")
    private boolean quiet;

    private final OperationProcessor processor;
    private final OperationDefaults defaults;
    private final EventBus eventBus;

    /**
     * The processor is injected lazily: it pulls in the Jira client, which resolves credentials
     * on construction, and picocli builds this command even for {@code --help}.
     */
    public SyncCommand(@Lazy OperationProcessor processor, OperationDefaults defaults, EventBus eventBus) {
        this.processor = processor;
        this.defaults = defaults;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        OperationConfig config = defaults.resolve(projectKey, activeOnly, issueFilter, pageSize, branch);
        if (config.projectKey() == null || config.projectKey().isBlank()) {
            ConsoleOutput.error("No project given. Use --project or set jiracdc.sync.project-key");
            return EXIT_FAILED;
        }

        Operation started;
        try {
            started = processor.startOperation(kind, config);
        } catch (OperationConflictException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_CONFLICT;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Could not start operation: " + e.getMessage());
            return EXIT_FAILED;
        }
        ConsoleOutput.info("Started %s operation %s for %s".formatted(kind, started.id(), config.projectKey()));

        EventBus.Subscription subscription = quiet
                ? () -> { }
                : eventBus.subscribe(started.id(), SyncCommand::printEvent);
        try {
            Operation finished = processor.waitForCompletion(started.id(), timeout());
            ConsoleOutput.operation(finished);
            return finished.status() == OperationStatus.COMPLETED ? 0 : EXIT_FAILED;
        } catch (OperationTimeoutException e) {
            ConsoleOutput.error(e.getMessage());
            cancelQuietly(started.id());
            ConsoleOutput.operation(e.getLastSnapshot());
            return EXIT_TIMEOUT;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelQuietly(started.id());
            ConsoleOutput.info("Interrupted.");
            return EXIT_FAILED;
        } finally {
            subscription.unsubscribe();
        }
    }

    private Duration timeout() {
        // effectively unbounded while staying clear of nanosecond overflow
        return waitSeconds > 0 ? Duration.ofSeconds(waitSeconds) : Duration.ofDays(365);
    }

    private void cancelQuietly(String id) {
        try {
            processor.cancelOperation(id);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Cancel failed: " + e.getMessage());
        }
    }

    private static void printEvent(OperationEvent event) {
        String data = event.taskId() != null
                ? event.taskId() + " " + event.payload()
                : String.valueOf(event.payload());
        ConsoleOutput.event(event.eventType(), data);
    }
}

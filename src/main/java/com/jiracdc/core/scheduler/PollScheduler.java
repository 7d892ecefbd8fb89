package com.jiracdc.core.scheduler;

import com.jiracdc.core.engine.OperationConflictException;
import com.jiracdc.core.engine.OperationDefaults;
import com.jiracdc.core.engine.OperationProcessor;
import com.jiracdc.core.engine.SyncProperties;
import com.jiracdc.core.model.Operation;
import com.jiracdc.core.model.OperationConfig;
import com.jiracdc.core.model.OperationKind;
import com.jiracdc.git.GitWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic and webhook-triggered synchronization of the configured project.
 *
 * <p>Each tick starts a RECONCILE, or a BOOTSTRAP while the repository holds no issue files and the
 * project has never synced. A tick that finds an operation already in flight for the project is skipped.
 * The {@code @Scheduled} methods only fire when {@link PollSchedulingConfig} is active;
 * {@link #requestEarlyPoll()} works either way.
 */
@Component
public class PollScheduler {

    private static final Logger log = LoggerFactory.getLogger(PollScheduler.class);

    private final OperationProcessor processor;
    private final OperationDefaults defaults;
    private final SyncProperties properties;
    private final GitWriter gitWriter;
    private final Executor executor;
    private final AtomicBoolean earlyPollQueued = new AtomicBoolean();

    public PollScheduler(OperationProcessor processor,
                         OperationDefaults defaults,
                         SyncProperties properties,
                         GitWriter gitWriter,
                         @Qualifier("taskExecutor") Executor executor) {
        this.processor = processor;
        this.defaults = defaults;
        this.properties = properties;
        this.gitWriter = gitWriter;
        this.executor = executor;
    }

    @Scheduled(fixedDelayString = "${jiracdc.sync.poll-interval:PT5M}",
            initialDelayString = "${jiracdc.sync.initial-delay:PT10S}")
    public void scheduledPoll() {
        runWithCorrelation("POLL", this::poll);
    }

    @Scheduled(cron = "${jiracdc.sync.cleanup-cron:0 0 3 * * *}")
    public void cleanupOperations() {
        runWithCorrelation("CLEANUP", () -> {
            int removed = processor.cleanupOldOperations(properties.getRetentionDays());
            log.info("Retention cleanup removed {} operation(s) older than {} day(s)",
                    removed, properties.getRetentionDays());
        });
    }

    /**
     * Queues one poll to run now. Requests arriving while one is queued are folded into it.
     *
     * @return true if a new poll was queued
     */
    public boolean requestEarlyPoll() {
        if (!earlyPollQueued.compareAndSet(false, true)) {
            log.debug("Early poll already queued");
            return false;
        }
        CompletableFuture.runAsync(() -> {
            earlyPollQueued.set(false);
            runWithCorrelation("WEBHOOK", this::poll);
        }, executor);
        return true;
    }

    /**
     * Starts the next operation for the configured project.
     *
     * @return the started operation, or empty when nothing was started
     */
    public Optional<Operation> poll() {
        OperationConfig config = defaults.configured();
        if (config.projectKey() == null || config.projectKey().isBlank()) {
            log.warn("Polling requested but jiracdc.sync.project-key is not set");
            return Optional.empty();
        }

        OperationKind kind = nextKind(config.projectKey());
        try {
            Operation started = processor.startOperation(kind, config);
            log.info("Poll started {} operation {} for {}", kind, started.id(), config.projectKey());
            return Optional.of(started);
        } catch (OperationConflictException e) {
            log.info("Skipping poll for {}: {}", config.projectKey(), e.getMessage());
            return Optional.empty();
        }
    }

    OperationKind nextKind(String projectKey) {
        if (processor.getLastSuccessfulSync(projectKey).isPresent()) {
            return OperationKind.RECONCILE;
        }
        return gitWriter.listIssueKeys().isEmpty() ? OperationKind.BOOTSTRAP : OperationKind.RECONCILE;
    }

    private static void runWithCorrelation(String source, Runnable job) {
        String correlationId = "SCHEDULER-" + source + "-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);
        try {
            job.run();
        } catch (RuntimeException e) {
            log.error("Scheduled job {} failed: {}", correlationId, e.getMessage(), e);
        } finally {
            MDC.remove("correlationId");
        }
    }
}

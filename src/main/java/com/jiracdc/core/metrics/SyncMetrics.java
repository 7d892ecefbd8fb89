package com.jiracdc.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for synchronization operations.
 */
@Service
public class SyncMetrics {

    private final MeterRegistry registry;

    public SyncMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperationResult(String kind, String status) {
        Counter.builder("jiracdc.operations.total")
                .tag("kind", kind)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordOperationDuration(String kind, Duration elapsed) {
        Timer.builder("jiracdc.operation.duration")
                .tag("kind", kind)
                .register(registry)
                .record(elapsed);
    }

    public void recordTaskExecution(String taskKind, String status, long ms) {
        Timer.builder("jiracdc.task.duration")
                .tag("task", taskKind)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts one synchronized issue.
     *
     * @param operationType CREATE, UPDATE, DELETE or UNCHANGED
     * @param success       whether the write succeeded
     */
    public void recordIssueSynced(String operationType, boolean success) {
        Counter.builder("jiracdc.issues.synced")
                .tag("type", operationType)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordRateLimitWait(Duration waited) {
        Timer.builder("jiracdc.ratelimit.wait")
                .description("Time spent waiting for a rate limit token")
                .register(registry)
                .record(waited);
    }

    public void recordSourceError(String type) {
        Counter.builder("jiracdc.source.errors")
                .description("Jira API errors by class")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordPush(boolean success) {
        Counter.builder("jiracdc.git.pushes")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }
}

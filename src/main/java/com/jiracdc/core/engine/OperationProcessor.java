package com.jiracdc.core.engine;

import com.jiracdc.core.events.EventBus;
import com.jiracdc.core.events.OperationEvent;
import com.jiracdc.core.graph.TaskGraphFactory;
import com.jiracdc.core.graph.TaskGraphValidationException;
import com.jiracdc.core.logging.MdcContext;
import com.jiracdc.core.metrics.SyncMetrics;
import com.jiracdc.core.model.Operation;
import com.jiracdc.core.model.OperationConfig;
import com.jiracdc.core.model.OperationKind;
import com.jiracdc.core.model.OperationStatus;
import com.jiracdc.core.model.ProgressSnapshot;
import com.jiracdc.core.model.SyncProgress;
import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskResult;
import com.jiracdc.core.model.TaskStatus;
import com.jiracdc.core.scheduler.TaskScheduler;
import com.jiracdc.core.tasks.TaskContext;
import com.jiracdc.core.tasks.TaskHandler;
import com.jiracdc.core.tasks.TaskHandlerRegistry;
import com.jiracdc.core.tasks.TaskOutcome;
import com.jiracdc.git.GitWriteException;
import com.jiracdc.source.AuthenticationException;
import com.jiracdc.source.CredentialsException;
import com.jiracdc.source.TransientApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.UnaryOperator;

/**
 * Owns the lifecycle of synchronization operations.
 *
 * <p>{@link #startOperation} builds the task graph for the requested kind, stores a PENDING
 * snapshot and hands execution to the operation executor, returning before any task runs.
 * The background run walks the graph in waves: every task whose dependencies completed runs
 * concurrently on the task executor, and the next wave is computed once the current one ends.
 *
 * <p>Operation snapshots are immutable and live in a {@link ConcurrentHashMap}. Every state
 * change goes through {@link ConcurrentHashMap#compute}, so readers never observe a partial update
 * and a late task result cannot overwrite a cancellation.
 *
 * <p>All operations write to one mirror repository, so at most one PENDING or RUNNING operation
 * exists at a time, whatever its project. Another request meanwhile is rejected with
 * {@link OperationConflictException}.
 */
@Service
public class OperationProcessor {

    private static final Logger log = LoggerFactory.getLogger(OperationProcessor.class);

    private static final Duration WAIT_POLL_INTERVAL = Duration.ofMillis(100);

    private final TaskGraphFactory graphFactory;
    private final TaskScheduler scheduler;
    private final TaskHandlerRegistry handlers;
    private final EventBus eventBus;
    private final SyncMetrics metrics;
    private final Clock clock;
    private final Executor operationExecutor;
    private final Executor taskExecutor;
    private final int maxParallelTasks;

    private final ConcurrentHashMap<String, Operation> operations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RunningOperation> running = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Instant> lastSuccessfulSync = new ConcurrentHashMap<>();
    private final Object startLock = new Object();

    @Autowired
    public OperationProcessor(TaskGraphFactory graphFactory,
                              TaskScheduler scheduler,
                              TaskHandlerRegistry handlers,
                              EventBus eventBus,
                              SyncMetrics metrics,
                              Clock clock,
                              @Qualifier("operationExecutor") Executor operationExecutor,
                              @Qualifier("taskExecutor") Executor taskExecutor,
                              SyncProperties properties) {
        this(graphFactory, scheduler, handlers, eventBus, metrics, clock,
                operationExecutor, taskExecutor, properties.getMaxParallelTasks());
    }

    OperationProcessor(TaskGraphFactory graphFactory,
                       TaskScheduler scheduler,
                       TaskHandlerRegistry handlers,
                       EventBus eventBus,
                       SyncMetrics metrics,
                       Clock clock,
                       Executor operationExecutor,
                       Executor taskExecutor,
                       int maxParallelTasks) {
        this.graphFactory = graphFactory;
        this.scheduler = scheduler;
        this.handlers = handlers;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.operationExecutor = operationExecutor;
        this.taskExecutor = taskExecutor;
        this.maxParallelTasks = maxParallelTasks;
    }

    /**
     * Creates an operation and launches it in the background.
     *
     * @return the PENDING snapshot; execution continues after this returns
     * @throws IllegalArgumentException      if the config has no project key
     * @throws OperationConflictException    if any operation still holds the repository
     * @throws TaskGraphValidationException  if the task graph is malformed; the operation is stored as FAILED
     */
    public Operation startOperation(OperationKind kind, OperationConfig config) {
        if (config == null || config.projectKey() == null || config.projectKey().isBlank()) {
            throw new IllegalArgumentException("projectKey is required");
        }

        String id = UUID.randomUUID().toString();
        Instant now = clock.instant();
        List<SyncTask> tasks = null;
        try {
            tasks = graphFactory.build(kind, config, reconcileWindow(config.projectKey(), now));
            TaskGraphFactory.validate(tasks);
        } catch (TaskGraphValidationException e) {
            log.error("Rejected {} operation {} for {}: {}", kind, id, config.projectKey(), e.getMessage());
            List<SyncTask> graph = tasks != null ? tasks : List.of();
            var failed = Operation.pending(id, kind, graph, config, now)
                    .withProgress(new ProgressSnapshot(Math.max(1, graph.size()), 0, "Invalid task graph"))
                    .withError(e.getMessage())
                    .finish(OperationStatus.FAILED, now);
            operations.put(id, failed);
            metrics.recordOperationResult(kind.name(), OperationStatus.FAILED.name());
            publish("operation.failed", id, null, Map.of("error", e.getMessage()));
            throw e;
        }

        Operation operation = Operation.pending(id, kind, tasks, config, now);
        synchronized (startLock) {
            // every operation writes to the same mirror repository
            var active = findActive();
            if (active.isPresent()) {
                throw new OperationConflictException(
                        "Repository is busy with operation %s for project %s in status %s"
                                .formatted(active.get().id(), active.get().config().projectKey(),
                                        active.get().status()));
            }
            operations.put(id, operation);
        }

        log.info("Accepted {} operation {} for project {} ({} tasks)", kind, id, config.projectKey(), tasks.size());
        publish("operation.created", id, null, Map.of(
                "kind", kind.name(), "projectKey", config.projectKey(), "tasks", tasks.size()));

        var signal = new CancellationSignal();
        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(() -> execute(id, signal), operationExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Executor rejected operation {}", id, e);
            update(id, op -> op.withError("Executor rejected operation: " + e.getMessage())
                    .finish(OperationStatus.FAILED, clock.instant()));
            throw e;
        }
        var handle = new RunningOperation(signal, future);
        running.put(id, handle);
        future.whenComplete((ignored, error) -> running.remove(id, handle));
        return operation;
    }

    /**
     * Cancels a running operation. Running tasks observe the signal at their next safe point;
     * no further task is started.
     *
     * @return the CANCELLED snapshot
     * @throws OperationNotFoundException if the id is unknown
     * @throws OperationStateException    if the operation is not RUNNING; nothing changes
     */
    public Operation cancelOperation(String id) {
        Instant now = clock.instant();
        Operation cancelled = operations.compute(id, (key, op) -> {
            if (op == null) {
                throw new OperationNotFoundException("Operation not found: " + id);
            }
            boolean allDone = op.tasks().stream().allMatch(t -> t.status() == TaskStatus.COMPLETED);
            if (op.status() != OperationStatus.RUNNING || allDone) {
                throw new OperationStateException(
                        "Operation %s cannot be cancelled in status %s".formatted(id, op.status()));
            }
            Operation updated = op;
            for (SyncTask task : op.tasks()) {
                if (!task.status().isTerminal()) {
                    updated = updated.withTaskStatus(task.id(), TaskStatus.CANCELLED);
                }
            }
            return updated.withStatus(OperationStatus.CANCELLED)
                    .withProgress(op.progress().withMessage("Cancelled"))
                    .finish(OperationStatus.CANCELLED, now);
        });

        var handle = running.get(id);
        if (handle != null) {
            handle.signal().cancel();
        }
        log.info("Cancelled operation {}", id);
        recordTerminal(cancelled);
        publish("operation.cancelled", id, null, Map.of("completedSteps", cancelled.progress().completedSteps()));
        return cancelled;
    }

    /**
     * Starts a new operation with the kind and config of a FAILED or CANCELLED one. The original
     * stays in the store unchanged.
     *
     * @return the PENDING snapshot of the new operation
     * @throws OperationNotFoundException if the id is unknown
     * @throws OperationStateException    if the operation did not fail and was not cancelled
     * @throws OperationConflictException if the repository is busy
     */
    public Operation retryOperation(String id) {
        Operation original = getOperation(id)
                .orElseThrow(() -> new OperationNotFoundException("Operation not found: " + id));
        if (original.status() != OperationStatus.FAILED && original.status() != OperationStatus.CANCELLED) {
            throw new OperationStateException(
                    "Operation %s cannot be retried in status %s".formatted(id, original.status()));
        }
        Operation retry = startOperation(original.kind(), original.config());
        log.info("Retrying operation {} as {}", id, retry.id());
        return retry;
    }

    /**
     * Polls until the operation reaches a terminal status. Never changes the operation.
     *
     * @throws OperationTimeoutException  if {@code timeout} elapses first; carries the latest snapshot
     * @throws OperationNotFoundException if the id is unknown
     * @throws InterruptedException       if the waiting thread is interrupted
     */
    public Operation waitForCompletion(String id, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Operation op = getOperation(id)
                    .orElseThrow(() -> new OperationNotFoundException("Operation not found: " + id));
            if (op.status().isTerminal()) {
                return op;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new OperationTimeoutException(
                        "Operation %s still %s after %s".formatted(id, op.status(), timeout), op);
            }
            Thread.sleep(Math.max(1, Math.min(WAIT_POLL_INTERVAL.toMillis(), remaining / 1_000_000)));
        }
    }

    /**
     * Removes operations that ended more than {@code retentionDays} ago.
     * Operations without an end time are never removed.
     *
     * @return number of operations removed
     */
    public int cleanupOldOperations(int retentionDays) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        int removed = 0;
        for (Operation op : operations.values()) {
            if (op.endTime() != null && op.endTime().isBefore(cutoff) && operations.remove(op.id(), op)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} operation(s) that ended before {}", removed, cutoff);
        }
        return removed;
    }

    /**
     * @param status optional filter; null returns every operation
     * @return snapshots, newest first
     */
    public List<Operation> listOperations(OperationStatus status) {
        return operations.values().stream()
                .filter(op -> status == null || op.status() == status)
                .sorted(Comparator.comparing(Operation::startTime).reversed())
                .toList();
    }

    public Optional<Operation> getOperation(String id) {
        return Optional.ofNullable(operations.get(id));
    }

    /** When the project last finished a successful sync, if ever. */
    public Optional<Instant> getLastSuccessfulSync(String projectKey) {
        return Optional.ofNullable(lastSuccessfulSync.get(projectKey));
    }

    /**
     * The operation that holds the repository, if any: one that is pending or running, or a
     * cancelled one whose worker has not returned yet.
     */
    public Optional<Operation> findActive() {
        return operations.values().stream()
                .filter(op -> !op.status().isTerminal() || running.containsKey(op.id()))
                .findFirst();
    }

    // ── background execution ─────────────────────────────────────────

    private void execute(String id, CancellationSignal signal) {
        Operation initial = operations.get(id);
        if (initial == null) return;
        MdcContext.setOperation(id, initial.config().projectKey());
        try {
            Operation started = updateIf(id, OperationStatus.PENDING,
                    op -> op.withStatus(OperationStatus.RUNNING).withProgress(op.progress().withMessage("Running")));
            if (started == null || started.status() != OperationStatus.RUNNING) {
                return;
            }
            log.info("Running {} operation {} with {} task(s)", started.kind(), id, started.tasks().size());
            publish("operation.started", id, null, Map.of("kind", started.kind().name()));

            boolean aborted = runGraph(id, started.config(), signal);
            finish(id, aborted);
        } catch (RuntimeException e) {
            log.error("Operation {} failed unexpectedly", id, e);
            Operation failed = updateIf(id, OperationStatus.RUNNING,
                    op -> op.withError(describe(e)).finish(OperationStatus.FAILED, clock.instant()));
            if (failed != null && failed.status() == OperationStatus.FAILED) {
                recordTerminal(failed);
                publish("operation.failed", id, null, Map.of("error", failed.errorMessage()));
            }
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs waves until nothing is eligible, the operation is cancelled, or a connectivity failure aborts it.
     *
     * @return true if a fatal failure aborted the remaining tasks
     */
    private boolean runGraph(String id, OperationConfig config, CancellationSignal signal) {
        Map<String, TaskResult> completedResults = new ConcurrentHashMap<>();
        int waveNumber = 0;

        while (!signal.isCancelled()) {
            Operation op = operations.get(id);
            if (op == null || op.status() != OperationStatus.RUNNING) {
                return false;
            }

            // tasks downstream of a failure can never run
            boolean skipped = false;
            for (SyncTask task : op.tasks()) {
                if (task.status() == TaskStatus.PENDING && scheduler.hasFailedDependency(task, op.tasks())) {
                    log.warn("Task {} [{}] skipped: dependency did not complete", task.id(), task.name());
                    applyTaskResult(id, TaskResult.failed(task.id(), "dependency did not complete", Duration.ZERO), null);
                    publish("task.failed", id, task.id(), Map.of("name", task.name(), "error", "dependency did not complete"));
                    skipped = true;
                }
            }
            if (skipped) continue;

            Set<String> completedIds = new HashSet<>();
            for (SyncTask task : op.tasks()) {
                if (task.status() == TaskStatus.COMPLETED) completedIds.add(task.id());
            }
            List<String> wave = scheduler.computeNextWave(op.tasks(), completedIds, maxParallelTasks);
            if (wave.isEmpty()) {
                return false;
            }
            waveNumber++;
            log.debug("Operation {} wave {}: {}", id, waveNumber, wave);

            var futures = new ArrayList<CompletableFuture<TaskRun>>();
            for (String taskId : wave) {
                SyncTask task = op.task(taskId);
                Operation marked = updateIf(id, OperationStatus.RUNNING, o -> o.withTaskStatus(taskId, TaskStatus.RUNNING));
                if (marked == null || marked.status() != OperationStatus.RUNNING) {
                    break;
                }
                publish("task.started", id, taskId, Map.of("name", task.name()));
                var context = new TaskContext(id, config, signal, Map.copyOf(completedResults), progressSink(id));
                futures.add(CompletableFuture.supplyAsync(() -> runTask(id, task, context), taskExecutor));
            }

            boolean fatal = false;
            for (CompletableFuture<TaskRun> future : futures) {
                TaskRun run = future.join();
                if (run.result().status() == TaskStatus.COMPLETED) {
                    completedResults.put(run.task().id(), run.result());
                }
                applyTaskResult(id, run.result(), run.task());
                if (run.fatal()) {
                    fatal = true;
                }
            }
            if (fatal) {
                return true;
            }
        }
        return false;
    }

    private TaskRun runTask(String operationId, SyncTask task, TaskContext context) {
        MdcContext.setTask(operationId, task.id(), task.name());
        long start = System.nanoTime();
        try {
            if (context.signal().isCancelled()) {
                return new TaskRun(task, TaskResult.cancelled(task.id(), Duration.ZERO), false);
            }
            TaskHandler handler = handlers.get(task.kind());
            log.info("Starting task {} [{}]", task.id(), task.name());
            TaskOutcome outcome = handler.execute(task, context);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordTaskExecution(task.name(), TaskStatus.COMPLETED.name(), elapsed.toMillis());
            log.info("Task {} [{}] completed in {}ms: {}", task.id(), task.name(), elapsed.toMillis(), outcome.message());
            return new TaskRun(task, TaskResult.completed(task.id(), outcome.counters(), outcome.output(),
                    outcome.message(), elapsed), false);
        } catch (OperationCancelledException e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.info("Task {} [{}] stopped: {}", task.id(), task.name(), e.getMessage());
            metrics.recordTaskExecution(task.name(), TaskStatus.CANCELLED.name(), elapsed.toMillis());
            return new TaskRun(task, TaskResult.cancelled(task.id(), elapsed), false);
        } catch (RuntimeException e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            boolean fatal = isConnectivityFailure(e);
            log.warn("Task {} [{}] failed{}: {}", task.id(), task.name(), fatal ? " (fatal)" : "", e.getMessage(), e);
            metrics.recordTaskExecution(task.name(), TaskStatus.FAILED.name(), elapsed.toMillis());
            return new TaskRun(task, TaskResult.failed(task.id(), describe(e), elapsed), fatal);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Records a task result. Ignored once the operation has left RUNNING, so nothing
     * changes after a cancellation.
     */
    private void applyTaskResult(String id, TaskResult result, SyncTask task) {
        Operation updated = updateIf(id, OperationStatus.RUNNING, op -> {
            Operation next = op.withTaskResult(result);
            if (result.status() == TaskStatus.COMPLETED) {
                next = next.withProgress(op.progress().advance("Completed " + op.task(result.taskId()).name()));
            } else if (result.status() == TaskStatus.FAILED) {
                next = next.withError("%s failed: %s".formatted(op.task(result.taskId()).name(), result.message()));
            }
            return next;
        });
        if (updated == null || updated.status() != OperationStatus.RUNNING || task == null) {
            return;
        }
        if (result.status() == TaskStatus.COMPLETED) {
            publish("task.completed", id, result.taskId(), Map.of(
                    "name", task.name(), "message", String.valueOf(result.message())));
            publish("operation.progress", id, result.taskId(), Map.of(
                    "completedSteps", updated.progress().completedSteps(),
                    "totalSteps", updated.progress().totalSteps()));
        } else if (result.status() == TaskStatus.FAILED) {
            publish("task.failed", id, result.taskId(), Map.of(
                    "name", task.name(), "error", String.valueOf(result.message())));
        }
    }

    private void finish(String id, boolean aborted) {
        Instant now = clock.instant();
        Operation finished = updateIf(id, OperationStatus.RUNNING, op -> {
            Operation next = op;
            for (SyncTask task : op.tasks()) {
                if (!task.status().isTerminal()) {
                    String reason = aborted ? "skipped: operation aborted" : "never became eligible";
                    next = next.withTaskResult(TaskResult.failed(task.id(), reason, Duration.ZERO));
                }
            }
            boolean allCompleted = next.tasks().stream().allMatch(t -> t.status() == TaskStatus.COMPLETED);
            OperationStatus status = allCompleted ? OperationStatus.COMPLETED : OperationStatus.FAILED;
            String message = allCompleted ? "Completed" : "Failed";
            return next.withProgress(next.progress().withMessage(message)).finish(status, now);
        });
        if (finished == null || finished.status() == OperationStatus.CANCELLED) {
            return;
        }

        if (finished.status() == OperationStatus.COMPLETED) {
            lastSuccessfulSync.put(finished.config().projectKey(), finished.startTime());
            log.info("Operation {} completed in {}ms: {}", id, finished.resultSummary().elapsed().toMillis(),
                    finished.resultSummary().counters());
        } else {
            log.warn("Operation {} failed: {}", id, finished.errorMessage());
        }
        recordTerminal(finished);
        publish(finished.status() == OperationStatus.COMPLETED ? "operation.completed" : "operation.failed",
                id, null, summaryPayload(finished));
    }

    private java.util.function.Consumer<SyncProgress> progressSink(String id) {
        return progress -> {
            updateIf(id, OperationStatus.RUNNING, op -> op.withProgress(op.progress().withMessage(progress.message())));
            publish("operation.progress", id, null, Map.of(
                    "processed", progress.processed(),
                    "total", progress.total(),
                    "message", String.valueOf(progress.message())));
        };
    }

    /**
     * Atomically applies {@code change} when the operation is in {@code expected} status.
     *
     * @return the snapshot after the call, or null if the operation is gone
     */
    private Operation updateIf(String id, OperationStatus expected, UnaryOperator<Operation> change) {
        return operations.computeIfPresent(id, (key, op) -> op.status() == expected ? change.apply(op) : op);
    }

    private Operation update(String id, UnaryOperator<Operation> change) {
        return operations.computeIfPresent(id, (key, op) -> change.apply(op));
    }

    /**
     * Relative JQL window covering everything since the last successful sync of the project,
     * with a minute of slack. Null when the project never synced.
     */
    private String reconcileWindow(String projectKey, Instant now) {
        Instant last = lastSuccessfulSync.get(projectKey);
        if (last == null) return null;
        long minutes = Math.max(0, Duration.between(last, now).toMinutes()) + 1;
        return "-" + minutes + "m";
    }

    private void recordTerminal(Operation op) {
        metrics.recordOperationResult(op.kind().name(), op.status().name());
        if (op.resultSummary() != null) {
            metrics.recordOperationDuration(op.kind().name(), op.resultSummary().elapsed());
        }
    }

    private Map<String, Object> summaryPayload(Operation op) {
        var payload = new HashMap<String, Object>();
        payload.put("status", op.status().name());
        if (op.resultSummary() != null) {
            payload.put("processedIssues", op.resultSummary().counters().processedIssues());
            payload.put("failedIssues", op.resultSummary().counters().failedIssues());
            payload.put("elapsedMs", op.resultSummary().elapsed().toMillis());
        }
        if (op.errorMessage() != null) {
            payload.put("error", op.errorMessage());
        }
        return payload;
    }

    private void publish(String type, String operationId, String taskId, Map<String, Object> payload) {
        eventBus.publish(new OperationEvent(type, operationId, taskId, payload, clock.instant()));
    }

    /**
     * Connectivity-class failures mean the source or sink cannot be reached at all, so the
     * remaining tasks would fail the same way.
     */
    static boolean isConnectivityFailure(Throwable e) {
        return e instanceof AuthenticationException
                || e instanceof TransientApiException
                || e instanceof CredentialsException
                || e instanceof GitWriteException;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /** In-flight handle: the cancellation token plus the future of the background run. */
    record RunningOperation(CancellationSignal signal, CompletableFuture<Void> future) {}

    private record TaskRun(SyncTask task, TaskResult result, boolean fatal) {}
}

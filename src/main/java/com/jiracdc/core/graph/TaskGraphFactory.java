package com.jiracdc.core.graph;

import com.jiracdc.core.model.OperationConfig;
import com.jiracdc.core.model.OperationKind;
import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskKind;
import com.jiracdc.core.model.TaskPayload;
import com.jiracdc.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the task graph for each operation kind and validates that it is a DAG.
 *
 * <pre>
 * BOOTSTRAP    InitRepo, FetchProjectInfo -> BootstrapSync
 * RECONCILE    CheckSourceUpdates, UpdateRepo -> SyncUpdatedIssues
 * FORCED_SYNC  same as BOOTSTRAP, sync overwrites unchanged files
 * CLEANUP      IdentifyOrphans -> RemoveOrphans
 * </pre>
 */
@Component
public class TaskGraphFactory {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphFactory.class);

    /** Lower bound used by reconcile when the project has never synced successfully. */
    public static final String DEFAULT_RECONCILE_WINDOW = "-24h";

    /**
     * @param since reconcile lower bound; ignored by other kinds, defaults to {@link #DEFAULT_RECONCILE_WINDOW}
     */
    public List<SyncTask> build(OperationKind kind, OperationConfig config, String since) {
        var window = since != null && !since.isBlank() ? since : DEFAULT_RECONCILE_WINDOW;
        var builder = new Builder();
        switch (kind) {
            case BOOTSTRAP, FORCED_SYNC -> {
                boolean overwrite = kind == OperationKind.FORCED_SYNC;
                var init = builder.add(TaskKind.INIT_REPO, "Clone or update the mirror repository",
                        10, List.of(), new TaskPayload.InitRepo(config.branch()));
                var fetch = builder.add(TaskKind.FETCH_PROJECT_INFO, "Fetch metadata for project " + config.projectKey(),
                        10, List.of(), new TaskPayload.FetchProjectInfo(config.projectKey()));
                builder.add(TaskKind.BOOTSTRAP_SYNC,
                        (overwrite ? "Rewrite all issues of " : "Synchronize all issues of ") + config.projectKey(),
                        5, List.of(init, fetch), new TaskPayload.BootstrapSync(overwrite, config.pageSize()));
            }
            case RECONCILE -> {
                var check = builder.add(TaskKind.CHECK_SOURCE_UPDATES, "Count issues updated since " + window,
                        10, List.of(), new TaskPayload.CheckSourceUpdates(window));
                var update = builder.add(TaskKind.UPDATE_REPO, "Pull the mirror repository",
                        10, List.of(), new TaskPayload.UpdateRepo(config.branch()));
                builder.add(TaskKind.SYNC_UPDATED_ISSUES, "Synchronize issues updated since " + window,
                        5, List.of(check, update), new TaskPayload.SyncUpdatedIssues(window));
            }
            case CLEANUP -> {
                var identify = builder.add(TaskKind.IDENTIFY_ORPHANS, "Find files with no matching issue",
                        10, List.of(), new TaskPayload.IdentifyOrphans(config.projectKey()));
                builder.add(TaskKind.REMOVE_ORPHANS, "Delete orphaned issue files",
                        5, List.of(identify), new TaskPayload.RemoveOrphans(config.branch()));
            }
        }
        var tasks = builder.tasks;
        validate(tasks);
        log.debug("Built {} graph with {} task(s)", kind, tasks.size());
        return tasks;
    }

    /**
     * Checks ids are unique, every dependency exists, and there is no cycle.
     *
     * @throws TaskGraphValidationException describing the first problem found
     */
    public static void validate(List<SyncTask> tasks) {
        Map<String, SyncTask> byId = new HashMap<>();
        for (SyncTask task : tasks) {
            if (byId.put(task.id(), task) != null) {
                throw new TaskGraphValidationException("Duplicate task id: " + task.id());
            }
        }

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (SyncTask task : tasks) {
            inDegree.putIfAbsent(task.id(), 0);
            for (String dep : task.dependencies()) {
                if (!byId.containsKey(dep)) {
                    throw new TaskGraphValidationException(
                            "Task %s depends on unknown task %s".formatted(task.id(), dep));
                }
                if (dep.equals(task.id())) {
                    throw new TaskGraphValidationException("Task %s depends on itself".formatted(task.id()));
                }
                inDegree.merge(task.id(), 1, Integer::sum);
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(task.id());
            }
        }

        // Kahn's algorithm: anything left unvisited sits on a cycle
        var ready = new ArrayDeque<String>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) ready.add(id);
        });
        Set<String> visited = new HashSet<>();
        while (!ready.isEmpty()) {
            var id = ready.poll();
            visited.add(id);
            for (String next : dependents.getOrDefault(id, List.of())) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        if (visited.size() != tasks.size()) {
            var cyclic = tasks.stream().map(SyncTask::id).filter(id -> !visited.contains(id)).sorted().toList();
            throw new TaskGraphValidationException("Task graph has a dependency cycle among " + cyclic);
        }
    }

    private static final class Builder {
        private final List<SyncTask> tasks = new ArrayList<>();

        String add(TaskKind kind, String description, int priority, List<String> deps, TaskPayload payload) {
            var id = "TASK-" + (tasks.size() + 1);
            tasks.add(new SyncTask(id, kind.taskName(), description, kind, TaskStatus.PENDING,
                    priority, List.copyOf(deps), payload));
            return id;
        }
    }
}

package com.jiracdc.core.scheduler;

import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Computes the next wave of eligible tasks based on dependency satisfaction
 * and the concurrency limit.
 */
@Service("syncTaskScheduler")
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    /**
     * Compute the next wave of task IDs eligible for dispatch.
     *
     * @param tasks        all tasks in the operation, with their current status
     * @param completedIds IDs of tasks that completed successfully
     * @param maxParallel  maximum tasks in one wave
     * @return task IDs to run next, highest priority first; empty if nothing is eligible
     */
    public List<String> computeNextWave(List<SyncTask> tasks, Set<String> completedIds, int maxParallel) {
        int limit = Math.max(1, maxParallel);

        log.debug("computeNextWave: {} tasks, {} completed, maxParallel={}", tasks.size(), completedIds.size(), limit);

        var candidates = new ArrayList<SyncTask>();
        for (var task : tasks) {
            if (task.status() != TaskStatus.PENDING) {
                log.debug("  {} [{}] - {}", task.id(), task.name(), task.status());
                continue;
            }
            if (!allDependenciesSatisfied(task, completedIds)) {
                log.debug("  {} [{}] - deps unsatisfied: {}", task.id(), task.name(), task.dependencies());
                continue;
            }
            candidates.add(task);
        }

        // stable sort keeps declaration order among equal priorities
        candidates.sort(Comparator.comparingInt(SyncTask::priority).reversed());

        var wave = new ArrayList<String>();
        for (var task : candidates) {
            if (wave.size() >= limit) break;
            log.debug("  {} [{}] - eligible (deps: {})", task.id(), task.name(), task.dependencies());
            wave.add(task.id());
        }
        return wave;
    }

    /**
     * True when some dependency of {@code task} ended without completing, so it can never run.
     */
    public boolean hasFailedDependency(SyncTask task, List<SyncTask> tasks) {
        for (var dep : task.dependencies()) {
            for (var other : tasks) {
                if (other.id().equals(dep)
                        && (other.status() == TaskStatus.FAILED || other.status() == TaskStatus.CANCELLED)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean allDependenciesSatisfied(SyncTask task, Set<String> completedIds) {
        if (task.dependencies() == null || task.dependencies().isEmpty()) return true;
        return completedIds.containsAll(task.dependencies());
    }
}

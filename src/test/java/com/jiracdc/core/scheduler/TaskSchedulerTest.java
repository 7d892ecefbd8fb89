package com.jiracdc.core.scheduler;

import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskKind;
import com.jiracdc.core.model.TaskPayload;
import com.jiracdc.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskSchedulerTest {

    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new TaskScheduler();
    }

    private SyncTask task(String id, int priority, List<String> deps) {
        return new SyncTask(id, "InitRepo", "Do " + id, TaskKind.INIT_REPO, TaskStatus.PENDING, priority, deps,
                new TaskPayload.InitRepo("main"));
    }

    @Test
    @DisplayName("3 independent tasks -> wave of 3")
    void independentTasks() {
        var tasks = List.of(task("A", 0, List.of()), task("B", 0, List.of()), task("C", 0, List.of()));
        assertEquals(List.of("A", "B", "C"), scheduler.computeNextWave(tasks, Set.of(), 10));
    }

    @Test
    @DisplayName("linear chain A->B->C -> waves of 1")
    void linearChain() {
        var tasks = List.of(task("A", 0, List.of()), task("B", 0, List.of("A")), task("C", 0, List.of("B")));

        assertEquals(List.of("A"), scheduler.computeNextWave(tasks, Set.of(), 10));
        assertEquals(List.of("B"), scheduler.computeNextWave(
                List.of(tasks.get(0).withStatus(TaskStatus.COMPLETED), tasks.get(1), tasks.get(2)), Set.of("A"), 10));
        assertEquals(List.of("C"), scheduler.computeNextWave(
                List.of(tasks.get(0).withStatus(TaskStatus.COMPLETED), tasks.get(1).withStatus(TaskStatus.COMPLETED),
                        tasks.get(2)), Set.of("A", "B"), 10));
    }

    @Test
    @DisplayName("higher priority first, declaration order breaks ties")
    void priorityOrder() {
        var tasks = List.of(task("A", 5, List.of()), task("B", 10, List.of()), task("C", 5, List.of()),
                task("D", 10, List.of()));
        assertEquals(List.of("B", "D", "A", "C"), scheduler.computeNextWave(tasks, Set.of(), 10));
    }

    @Test
    @DisplayName("wave is capped at maxParallel, keeping the highest priorities")
    void capped() {
        var tasks = List.of(task("A", 1, List.of()), task("B", 3, List.of()), task("C", 2, List.of()));
        assertEquals(List.of("B", "C"), scheduler.computeNextWave(tasks, Set.of(), 2));
    }

    @Test
    @DisplayName("non-positive maxParallel still schedules one task")
    void minimumOne() {
        var tasks = List.of(task("A", 0, List.of()), task("B", 0, List.of()));
        assertEquals(List.of("A"), scheduler.computeNextWave(tasks, Set.of(), 0));
    }

    @Test
    @DisplayName("running and finished tasks are never rescheduled")
    void skipsNonPending() {
        var tasks = List.of(task("A", 0, List.of()).withStatus(TaskStatus.RUNNING),
                task("B", 0, List.of()).withStatus(TaskStatus.COMPLETED),
                task("C", 0, List.of()).withStatus(TaskStatus.FAILED));
        assertTrue(scheduler.computeNextWave(tasks, Set.of("B"), 10).isEmpty());
    }

    @Test
    @DisplayName("diamond waits for both parents")
    void diamond() {
        var tasks = List.of(task("A", 0, List.of()), task("B", 0, List.of()), task("C", 0, List.of("A", "B")));
        var partial = List.of(tasks.get(0).withStatus(TaskStatus.COMPLETED), tasks.get(1).withStatus(TaskStatus.RUNNING),
                tasks.get(2));
        assertTrue(scheduler.computeNextWave(partial, Set.of("A"), 10).isEmpty());
    }

    @Test
    @DisplayName("failed or cancelled dependency is detected")
    void failedDependency() {
        var a = task("A", 0, List.of()).withStatus(TaskStatus.FAILED);
        var b = task("B", 0, List.of()).withStatus(TaskStatus.COMPLETED);
        var c = task("C", 0, List.of("A", "B"));
        var d = task("D", 0, List.of("B"));

        assertTrue(scheduler.hasFailedDependency(c, List.of(a, b, c, d)));
        assertFalse(scheduler.hasFailedDependency(d, List.of(a, b, c, d)));
        assertTrue(scheduler.hasFailedDependency(d, List.of(a, b.withStatus(TaskStatus.CANCELLED), c, d)));
    }
}

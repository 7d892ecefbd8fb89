package com.jiracdc.core.graph;

import com.jiracdc.core.model.OperationConfig;
import com.jiracdc.core.model.OperationKind;
import com.jiracdc.core.model.SyncTask;
import com.jiracdc.core.model.TaskKind;
import com.jiracdc.core.model.TaskPayload;
import com.jiracdc.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskGraphFactoryTest {

    private final TaskGraphFactory factory = new TaskGraphFactory();
    private final OperationConfig config = new OperationConfig("PROJ", true, null, 25, "mirror");

    private static List<TaskKind> kinds(List<SyncTask> tasks) {
        return tasks.stream().map(SyncTask::kind).toList();
    }

    @Test
    @DisplayName("bootstrap: two independent roots feeding the sync")
    void bootstrapGraph() {
        var tasks = factory.build(OperationKind.BOOTSTRAP, config, null);

        assertEquals(List.of(TaskKind.INIT_REPO, TaskKind.FETCH_PROJECT_INFO, TaskKind.BOOTSTRAP_SYNC), kinds(tasks));
        assertEquals(List.of("TASK-1", "TASK-2", "TASK-3"), tasks.stream().map(SyncTask::id).toList());
        assertTrue(tasks.get(0).dependencies().isEmpty());
        assertTrue(tasks.get(1).dependencies().isEmpty());
        assertEquals(List.of("TASK-1", "TASK-2"), tasks.get(2).dependencies());
        assertEquals(new TaskPayload.BootstrapSync(false, 25), tasks.get(2).payload());
        assertEquals(new TaskPayload.InitRepo("mirror"), tasks.get(0).payload());
        assertEquals("BootstrapSync", tasks.get(2).name());
        assertTrue(tasks.stream().allMatch(t -> t.status() == TaskStatus.PENDING));
    }

    @Test
    @DisplayName("forced sync reuses the bootstrap shape with overwrite on")
    void forcedSyncGraph() {
        var tasks = factory.build(OperationKind.FORCED_SYNC, config, null);

        assertEquals(List.of(TaskKind.INIT_REPO, TaskKind.FETCH_PROJECT_INFO, TaskKind.BOOTSTRAP_SYNC), kinds(tasks));
        assertEquals(new TaskPayload.BootstrapSync(true, 25), tasks.get(2).payload());
    }

    @Test
    @DisplayName("reconcile carries the update window to both the check and the sync")
    void reconcileGraph() {
        var tasks = factory.build(OperationKind.RECONCILE, config, "-12m");

        assertEquals(List.of(TaskKind.CHECK_SOURCE_UPDATES, TaskKind.UPDATE_REPO, TaskKind.SYNC_UPDATED_ISSUES),
                kinds(tasks));
        assertEquals(new TaskPayload.CheckSourceUpdates("-12m"), tasks.get(0).payload());
        assertEquals(new TaskPayload.SyncUpdatedIssues("-12m"), tasks.get(2).payload());
        assertEquals(List.of("TASK-1", "TASK-2"), tasks.get(2).dependencies());
    }

    @Test
    @DisplayName("reconcile without a window falls back to the default")
    void reconcileDefaultWindow() {
        var tasks = factory.build(OperationKind.RECONCILE, config, " ");
        assertEquals(new TaskPayload.SyncUpdatedIssues(TaskGraphFactory.DEFAULT_RECONCILE_WINDOW),
                tasks.get(2).payload());
    }

    @Test
    @DisplayName("cleanup is a two-step chain")
    void cleanupGraph() {
        var tasks = factory.build(OperationKind.CLEANUP, config, null);

        assertEquals(List.of(TaskKind.IDENTIFY_ORPHANS, TaskKind.REMOVE_ORPHANS), kinds(tasks));
        assertEquals(List.of("TASK-1"), tasks.get(1).dependencies());
        assertEquals(new TaskPayload.RemoveOrphans("mirror"), tasks.get(1).payload());
    }

    @ParameterizedTest
    @EnumSource(OperationKind.class)
    @DisplayName("every template has unique ids and only known dependencies")
    void templatesAreWellFormed(OperationKind kind) {
        var tasks = factory.build(kind, config, null);
        var ids = new HashSet<String>();
        tasks.forEach(t -> assertTrue(ids.add(t.id())));
        tasks.forEach(t -> assertTrue(ids.containsAll(t.dependencies())));
        assertDoesNotThrow(() -> TaskGraphFactory.validate(tasks));
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        private SyncTask task(String id, List<String> deps) {
            return new SyncTask(id, "InitRepo", id, TaskKind.INIT_REPO, TaskStatus.PENDING, 0, deps,
                    new TaskPayload.InitRepo("main"));
        }

        @Test
        @DisplayName("rejects duplicate ids")
        void duplicateIds() {
            var e = assertThrows(TaskGraphValidationException.class,
                    () -> TaskGraphFactory.validate(List.of(task("A", List.of()), task("A", List.of()))));
            assertTrue(e.getMessage().contains("Duplicate task id: A"));
        }

        @Test
        @DisplayName("rejects unknown dependencies")
        void unknownDependency() {
            var e = assertThrows(TaskGraphValidationException.class,
                    () -> TaskGraphFactory.validate(List.of(task("A", List.of("Z")))));
            assertTrue(e.getMessage().contains("unknown task Z"));
        }

        @Test
        @DisplayName("rejects self dependencies")
        void selfDependency() {
            assertThrows(TaskGraphValidationException.class,
                    () -> TaskGraphFactory.validate(List.of(task("A", List.of("A")))));
        }

        @Test
        @DisplayName("rejects cycles and names the tasks on them")
        void cycle() {
            var e = assertThrows(TaskGraphValidationException.class, () -> TaskGraphFactory.validate(List.of(
                    task("A", List.of()), task("B", List.of("C")), task("C", List.of("B")))));
            assertTrue(e.getMessage().contains("[B, C]"));
        }

        @Test
        @DisplayName("accepts an empty graph")
        void empty() {
            assertDoesNotThrow(() -> TaskGraphFactory.validate(List.of()));
        }
    }
}

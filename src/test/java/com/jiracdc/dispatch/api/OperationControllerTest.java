package com.jiracdc.dispatch.api;

import com.jiracdc.core.engine.OperationConflictException;
import com.jiracdc.core.engine.OperationDefaults;
import com.jiracdc.core.engine.OperationNotFoundException;
import com.jiracdc.core.engine.OperationProcessor;
import com.jiracdc.core.engine.OperationStateException;
import com.jiracdc.core.graph.TaskGraphFactory;
import com.jiracdc.core.model.Operation;
import com.jiracdc.core.model.OperationConfig;
import com.jiracdc.core.model.OperationKind;
import com.jiracdc.core.model.OperationStatus;
import com.jiracdc.core.model.SyncCounters;
import com.jiracdc.core.model.TaskResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(OperationController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class OperationControllerTest {

    private static final Instant START = Instant.parse("2024-03-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OperationProcessor processor;

    @MockitoBean
    private OperationDefaults defaults;

    private static OperationConfig config() {
        return new OperationConfig("PROJ", true, null, 50, "main");
    }

    private static Operation pending(String id) {
        var tasks = new TaskGraphFactory().build(OperationKind.BOOTSTRAP, config(), null);
        return Operation.pending(id, OperationKind.BOOTSTRAP, tasks, config(), START);
    }

    // ── POST /api/v1/operations ─────────────────────────────────────

    @Test
    @DisplayName("POST /operations returns 202 with the pending operation")
    void startOperation() throws Exception {
        when(defaults.resolve(eq("PROJ"), eq(true), isNull(), isNull(), isNull())).thenReturn(config());
        when(processor.startOperation(OperationKind.BOOTSTRAP, config())).thenReturn(pending("op-1"));

        mockMvc.perform(post("/api/v1/operations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"bootstrap\",\"project_key\":\"PROJ\",\"active_issues_only\":true}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.operation_id").value("op-1"))
                .andExpect(jsonPath("$.kind").value("BOOTSTRAP"))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.project_key").value("PROJ"))
                .andExpect(jsonPath("$.active_issues_only").value(true))
                .andExpect(jsonPath("$.progress.total_steps").value(3))
                .andExpect(jsonPath("$.progress.completed_steps").value(0))
                .andExpect(jsonPath("$.start_time").value("2024-03-01T12:00:00Z"))
                .andExpect(jsonPath("$.summary").doesNotExist())
                .andExpect(jsonPath("$.tasks", hasSize(3)))
                .andExpect(jsonPath("$.tasks[2].name").value("BootstrapSync"))
                .andExpect(jsonPath("$.tasks[2].dependencies", contains("TASK-1", "TASK-2")));
    }

    @Test
    @DisplayName("POST /operations with an unknown kind returns 400")
    void invalidKind() throws Exception {
        mockMvc.perform(post("/api/v1/operations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"EVERYTHING\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("Invalid kind: EVERYTHING")));
        verifyNoInteractions(processor);
    }

    @Test
    @DisplayName("POST /operations without a kind returns 400")
    void missingKind() throws Exception {
        mockMvc.perform(post("/api/v1/operations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project_key\":\"PROJ\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("kind is required"));
    }

    @Test
    @DisplayName("POST /operations without any project returns 400")
    void missingProject() throws Exception {
        var noProject = new OperationConfig(null, false, null, 50, "main");
        when(defaults.resolve(any(), any(), any(), any(), any())).thenReturn(noProject);
        when(processor.startOperation(OperationKind.RECONCILE, noProject))
                .thenThrow(new IllegalArgumentException("projectKey is required"));

        mockMvc.perform(post("/api/v1/operations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"RECONCILE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("projectKey is required"));
    }

    @Test
    @DisplayName("POST /operations while the repository is busy returns 409")
    void conflict() throws Exception {
        when(defaults.resolve(any(), any(), any(), any(), any())).thenReturn(config());
        when(processor.startOperation(any(), any()))
                .thenThrow(new OperationConflictException(
                        "Repository is busy with operation op-0 for project PROJ in status RUNNING"));

        mockMvc.perform(post("/api/v1/operations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"RECONCILE\",\"project_key\":\"PROJ\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", containsString("busy with operation op-0")));
    }

    // ── GET ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /operations/{id} returns the snapshot with summary once finished")
    void getFinished() throws Exception {
        var op = pending("op-2").withStatus(OperationStatus.RUNNING)
                .withTaskResult(TaskResult.completed("TASK-1", SyncCounters.ZERO, null, "Repository ready",
                        Duration.ofMillis(12)))
                .withTaskResult(TaskResult.completed("TASK-2", SyncCounters.ZERO, null, "Project PROJ",
                        Duration.ofMillis(5)))
                .withTaskResult(TaskResult.completed("TASK-3", new SyncCounters(2, 2, 0, 0, 0, 2, 0), null,
                        "Synchronized 2 issue(s), 0 failed", Duration.ofMillis(40)))
                .finish(OperationStatus.COMPLETED, START.plusSeconds(3));
        when(processor.getOperation("op-2")).thenReturn(Optional.of(op));

        mockMvc.perform(get("/api/v1/operations/op-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.end_time").value("2024-03-01T12:00:03Z"))
                .andExpect(jsonPath("$.summary.processed_issues").value(2))
                .andExpect(jsonPath("$.summary.commits").value(2))
                .andExpect(jsonPath("$.summary.elapsed_ms").value(3000))
                .andExpect(jsonPath("$.tasks[0].status").value("COMPLETED"))
                .andExpect(jsonPath("$.tasks[0].message").value("Repository ready"))
                .andExpect(jsonPath("$.tasks[0].elapsed_ms").value(12));
    }

    @Test
    @DisplayName("GET /operations/{id} for an unknown id returns 404")
    void getUnknown() throws Exception {
        when(processor.getOperation("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/operations/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Operation not found: missing"));
    }

    @Test
    @DisplayName("GET /operations filters by status")
    void listByStatus() throws Exception {
        when(processor.listOperations(OperationStatus.PENDING)).thenReturn(List.of(pending("op-3"), pending("op-4")));

        mockMvc.perform(get("/api/v1/operations").param("status", "pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].operation_id").value("op-3"));
    }

    @Test
    @DisplayName("GET /operations with a bad status returns 400")
    void listBadStatus() throws Exception {
        mockMvc.perform(get("/api/v1/operations").param("status", "sleeping"))
                .andExpect(status().isBadRequest());
    }

    // ── POST /api/v1/operations/{id}/cancel ─────────────────────────

    @Test
    @DisplayName("POST /operations/{id}/cancel returns the cancelled snapshot")
    void cancel() throws Exception {
        var cancelled = pending("op-5").withStatus(OperationStatus.RUNNING)
                .finish(OperationStatus.CANCELLED, START.plusSeconds(1));
        when(processor.cancelOperation("op-5")).thenReturn(cancelled);

        mockMvc.perform(post("/api/v1/operations/op-5/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }

    @Test
    @DisplayName("POST /operations/{id}/cancel on a finished operation returns 409")
    void cancelNotRunning() throws Exception {
        when(processor.cancelOperation("op-6"))
                .thenThrow(new OperationStateException("Operation op-6 cannot be cancelled in status COMPLETED"));

        mockMvc.perform(post("/api/v1/operations/op-6/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", containsString("cannot be cancelled")));
    }

    // ── POST /api/v1/operations/{id}/retry ──────────────────────────

    @Test
    @DisplayName("POST /operations/{id}/retry accepts the new operation")
    void retry() throws Exception {
        when(processor.retryOperation("op-7")).thenReturn(pending("op-8"));

        mockMvc.perform(post("/api/v1/operations/op-7/retry"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.operation_id").value("op-8"))
                .andExpect(jsonPath("$.kind").value("BOOTSTRAP"))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    @DisplayName("POST /operations/{id}/retry on a completed operation returns 409")
    void retryCompleted() throws Exception {
        when(processor.retryOperation("op-9"))
                .thenThrow(new OperationStateException("Operation op-9 cannot be retried in status COMPLETED"));

        mockMvc.perform(post("/api/v1/operations/op-9/retry"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", containsString("cannot be retried")));
    }

    @Test
    @DisplayName("POST /operations/{id}/retry on an unknown id returns 404")
    void retryUnknown() throws Exception {
        when(processor.retryOperation("nope"))
                .thenThrow(new OperationNotFoundException("Operation not found: nope"));

        mockMvc.perform(post("/api/v1/operations/nope/retry"))
                .andExpect(status().isNotFound());
    }
}

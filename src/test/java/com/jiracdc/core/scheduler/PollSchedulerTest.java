package com.jiracdc.core.scheduler;

import com.jiracdc.core.engine.OperationConflictException;
import com.jiracdc.core.engine.OperationDefaults;
import com.jiracdc.core.engine.OperationProcessor;
import com.jiracdc.core.engine.SyncProperties;
import com.jiracdc.core.model.Operation;
import com.jiracdc.core.model.OperationConfig;
import com.jiracdc.core.model.OperationKind;
import com.jiracdc.git.GitProperties;
import com.jiracdc.git.GitWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PollSchedulerTest {

    private OperationProcessor processor;
    private GitWriter gitWriter;
    private SyncProperties syncProperties;
    private final List<Runnable> queued = new ArrayList<>();
    private PollScheduler scheduler;

    @BeforeEach
    void setUp() {
        processor = mock(OperationProcessor.class);
        gitWriter = mock(GitWriter.class);
        syncProperties = new SyncProperties();
        syncProperties.setProjectKey("PROJ");
        syncProperties.setRetentionDays(3);
        var gitProperties = new GitProperties();
        gitProperties.setBranch("main");
        scheduler = new PollScheduler(processor, new OperationDefaults(syncProperties, gitProperties),
                syncProperties, gitWriter, queued::add);
    }

    private static Operation operation(OperationKind kind) {
        return Operation.pending("op-1", kind, List.of(), OperationConfig.forProject("PROJ"), Instant.now());
    }

    @Test
    @DisplayName("first poll against an empty repository bootstraps")
    void bootstrapWhenEmpty() {
        when(processor.getLastSuccessfulSync("PROJ")).thenReturn(Optional.empty());
        when(gitWriter.listIssueKeys()).thenReturn(List.of());
        when(processor.startOperation(eq(OperationKind.BOOTSTRAP), any())).thenReturn(operation(OperationKind.BOOTSTRAP));

        assertTrue(scheduler.poll().isPresent());
        verify(processor).startOperation(eq(OperationKind.BOOTSTRAP),
                argThat(c -> c.projectKey().equals("PROJ") && c.branch().equals("main")));
    }

    @Test
    @DisplayName("an existing mirror or a past sync reconciles")
    void reconcileOtherwise() {
        when(processor.getLastSuccessfulSync("PROJ")).thenReturn(Optional.empty());
        when(gitWriter.listIssueKeys()).thenReturn(List.of("PROJ-1"));
        assertEquals(OperationKind.RECONCILE, scheduler.nextKind("PROJ"));

        when(processor.getLastSuccessfulSync("PROJ")).thenReturn(Optional.of(Instant.now()));
        when(gitWriter.listIssueKeys()).thenReturn(List.of());
        assertEquals(OperationKind.RECONCILE, scheduler.nextKind("PROJ"));
    }

    @Test
    @DisplayName("a poll that collides with a running operation is skipped")
    void conflictSkipped() {
        when(processor.getLastSuccessfulSync("PROJ")).thenReturn(Optional.of(Instant.now()));
        when(processor.startOperation(any(), any())).thenThrow(new OperationConflictException("busy"));

        assertTrue(scheduler.poll().isEmpty());
    }

    @Test
    @DisplayName("no configured project means no operation")
    void noProject() {
        syncProperties.setProjectKey(null);

        assertTrue(scheduler.poll().isEmpty());
        verify(processor, never()).startOperation(any(), any());
    }

    @Test
    @DisplayName("scheduled poll never lets an exception escape")
    void scheduledPollSwallowsFailures() {
        when(processor.getLastSuccessfulSync("PROJ")).thenThrow(new IllegalStateException("boom"));
        assertDoesNotThrow(() -> scheduler.scheduledPoll());
    }

    @Test
    @DisplayName("early poll requests are coalesced until the queued one runs")
    void earlyPollCoalesces() {
        when(processor.getLastSuccessfulSync("PROJ")).thenReturn(Optional.of(Instant.now()));
        when(processor.startOperation(any(), any())).thenReturn(operation(OperationKind.RECONCILE));

        assertTrue(scheduler.requestEarlyPoll());
        assertFalse(scheduler.requestEarlyPoll());
        assertEquals(1, queued.size());

        queued.remove(0).run();
        verify(processor).startOperation(eq(OperationKind.RECONCILE), any());
        assertTrue(scheduler.requestEarlyPoll());
    }

    @Test
    @DisplayName("cleanup uses the configured retention")
    void cleanup() {
        scheduler.cleanupOperations();
        verify(processor).cleanupOldOperations(3);
    }
}

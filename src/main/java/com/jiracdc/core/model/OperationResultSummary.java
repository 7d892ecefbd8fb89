package com.jiracdc.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Aggregated counters over all task results plus wall-clock time, computed once when an operation ends.
 */
public record OperationResultSummary(
    SyncCounters counters,
    Duration elapsed
) implements Serializable {

    public static OperationResultSummary of(List<TaskResult> results, Duration elapsed) {
        SyncCounters total = SyncCounters.ZERO;
        for (TaskResult result : results) {
            if (result.counters() != null) {
                total = total.plus(result.counters());
            }
        }
        return new OperationResultSummary(total, elapsed);
    }

    public int processedIssues() {
        return counters.processedIssues();
    }
}

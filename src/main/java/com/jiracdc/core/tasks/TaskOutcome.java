package com.jiracdc.core.tasks;

import com.jiracdc.core.model.SyncCounters;
import com.jiracdc.core.model.TaskOutput;

/**
 * What a handler produced. The processor turns it into a {@link com.jiracdc.core.model.TaskResult}.
 */
public record TaskOutcome(SyncCounters counters, TaskOutput output, String message) {

    public static TaskOutcome of(String message) {
        return new TaskOutcome(SyncCounters.ZERO, TaskOutput.NONE, message);
    }
}

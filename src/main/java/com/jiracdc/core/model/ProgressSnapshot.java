package com.jiracdc.core.model;

import java.io.Serializable;

/**
 * Step-level progress of an operation. {@code completedSteps} only ever grows.
 */
public record ProgressSnapshot(
    int totalSteps,
    int completedSteps,
    String lastMessage
) implements Serializable {

    public static ProgressSnapshot start(int totalSteps) {
        return new ProgressSnapshot(totalSteps, 0, "Pending");
    }

    public ProgressSnapshot advance(String message) {
        return new ProgressSnapshot(totalSteps, Math.min(totalSteps, completedSteps + 1), message);
    }

    public ProgressSnapshot withMessage(String message) {
        return new ProgressSnapshot(totalSteps, completedSteps, message);
    }

    public int percent() {
        return totalSteps == 0 ? 0 : completedSteps * 100 / totalSteps;
    }
}

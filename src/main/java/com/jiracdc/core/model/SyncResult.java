package com.jiracdc.core.model;

import java.io.Serializable;

/**
 * Outcome of synchronizing one issue.
 *
 * @param issueKey      the issue
 * @param operationType what happened to its file
 * @param success       false when the issue could not be fetched or written
 * @param filePath      repository-relative file path (null on failure)
 * @param commitHash    commit created for the change (null when nothing was committed)
 * @param errorMessage  failure reason (null on success)
 */
public record SyncResult(
    String issueKey,
    SyncOperationType operationType,
    boolean success,
    String filePath,
    String commitHash,
    String errorMessage
) implements Serializable {

    public static SyncResult succeeded(String issueKey, SyncOperationType type, String filePath, String commitHash) {
        return new SyncResult(issueKey, type, true, filePath, commitHash, null);
    }

    public static SyncResult failed(String issueKey, SyncOperationType type, String errorMessage) {
        return new SyncResult(issueKey, type, false, null, null, errorMessage);
    }
}

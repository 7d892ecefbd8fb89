package com.jiracdc.git;

import com.jiracdc.core.model.SyncOperationType;

/**
 * Outcome of writing one issue file.
 *
 * @param path          repository-relative file path
 * @param commitHash    commit created, or null when nothing changed
 * @param operationType CREATE, UPDATE, DELETE or UNCHANGED
 */
public record WriteResult(String path, String commitHash, SyncOperationType operationType) {}

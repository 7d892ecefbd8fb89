package com.jiracdc.core.model;

/**
 * What happened to an issue file during synchronization.
 */
public enum SyncOperationType {
    CREATE,
    UPDATE,
    DELETE,
    UNCHANGED
}

package com.jiracdc.core.model;

/**
 * Kind of synchronization operation. Each kind maps to a fixed task graph template.
 */
public enum OperationKind {
    BOOTSTRAP,
    RECONCILE,
    FORCED_SYNC,
    CLEANUP
}

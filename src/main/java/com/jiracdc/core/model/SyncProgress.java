package com.jiracdc.core.model;

/**
 * Item-level progress emitted by the sync engine while it works through a batch.
 *
 * @param processed issues handled so far
 * @param total     issues in scope (grows during a paged scan once the total is known)
 * @param issueKey  issue just handled (nullable)
 * @param message   human-readable status
 */
public record SyncProgress(
    int processed,
    int total,
    String issueKey,
    String message
) {

    public int percent() {
        return total == 0 ? 0 : processed * 100 / total;
    }
}

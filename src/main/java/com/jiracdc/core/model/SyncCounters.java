package com.jiracdc.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Counters produced by synchronization work. Summed across tasks for the operation summary.
 */
public record SyncCounters(
    int processedIssues,
    int createdFiles,
    int updatedFiles,
    int deletedFiles,
    int unchangedFiles,
    int commits,
    int failedIssues
) implements Serializable {

    public static final SyncCounters ZERO = new SyncCounters(0, 0, 0, 0, 0, 0, 0);

    public SyncCounters plus(SyncCounters other) {
        return new SyncCounters(
                processedIssues + other.processedIssues,
                createdFiles + other.createdFiles,
                updatedFiles + other.updatedFiles,
                deletedFiles + other.deletedFiles,
                unchangedFiles + other.unchangedFiles,
                commits + other.commits,
                failedIssues + other.failedIssues);
    }

    /**
     * Derives counters from a batch of per-issue results.
     */
    public static SyncCounters fromResults(List<SyncResult> results) {
        int created = 0, updated = 0, deleted = 0, unchanged = 0, commits = 0, failed = 0;
        for (SyncResult r : results) {
            if (!r.success()) {
                failed++;
                continue;
            }
            switch (r.operationType()) {
                case CREATE -> created++;
                case UPDATE -> updated++;
                case DELETE -> deleted++;
                case UNCHANGED -> unchanged++;
            }
            if (r.commitHash() != null && !r.commitHash().isEmpty()) {
                commits++;
            }
        }
        return new SyncCounters(results.size(), created, updated, deleted, unchanged, commits, failed);
    }
}

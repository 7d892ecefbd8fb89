package com.jiracdc.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Canonical issue representation written to the repository.
 * {@code assignee}, {@code reporter}, {@code parentKey} and the timestamps are null when absent.
 */
public record IssueData(
    String key,
    String summary,
    String description,
    String status,
    String issueType,
    String priority,
    String assignee,
    String reporter,
    List<String> labels,
    List<String> components,
    List<String> fixVersions,
    String parentKey,
    Instant created,
    Instant updated
) implements Serializable {

    public IssueData {
        labels = labels == null ? List.of() : List.copyOf(labels);
        components = components == null ? List.of() : List.copyOf(components);
        fixVersions = fixVersions == null ? List.of() : List.copyOf(fixVersions);
    }
}

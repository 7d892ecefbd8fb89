package com.jiracdc.git;

import com.jiracdc.core.model.IssueData;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an issue as the markdown file stored in the repository: a frontmatter block,
 * a title line, the structured fields and the description body.
 */
public class IssueMarkdownFormatter {

    static final String FRONTMATTER_DELIMITER = "---";
    static final String SYNCED_AT_PREFIX = "syncedAt: ";

    /** File name for an issue, e.g. {@code PROJ-1.md}. */
    public static String fileName(String issueKey) {
        return issueKey + ".md";
    }

    public String format(IssueData issue, Instant syncedAt) {
        var content = new StringBuilder();

        content.append(FRONTMATTER_DELIMITER).append('\n');
        content.append("key: ").append(issue.key()).append('\n');
        content.append("summary: \"").append(nullToEmpty(issue.summary()).replace("\"", "\\\"")).append("\"\n");
        content.append("status: ").append(nullToEmpty(issue.status())).append('\n');
        content.append("issueType: ").append(nullToEmpty(issue.issueType())).append('\n');
        content.append("priority: ").append(nullToEmpty(issue.priority())).append('\n');
        content.append("assignee: ").append(displayAssignee(issue)).append('\n');
        content.append("reporter: ").append(displayReporter(issue)).append('\n');
        if (issue.parentKey() != null) {
            content.append("parentKey: ").append(issue.parentKey()).append('\n');
        }
        content.append("created: ").append(timestamp(issue.created())).append('\n');
        content.append("updated: ").append(timestamp(issue.updated())).append('\n');
        content.append(SYNCED_AT_PREFIX).append(timestamp(syncedAt)).append('\n');
        appendYamlList(content, "labels", issue.labels());
        appendYamlList(content, "components", issue.components());
        appendYamlList(content, "fixVersions", issue.fixVersions());
        content.append(FRONTMATTER_DELIMITER).append("\n\n");

        content.append("# ").append(issue.key()).append(": ").append(nullToEmpty(issue.summary())).append("\n\n");
        content.append("**Status:** ").append(nullToEmpty(issue.status())).append('\n');
        content.append("**Assignee:** ").append(displayAssignee(issue)).append('\n');
        content.append("**Reporter:** ").append(displayReporter(issue)).append('\n');
        content.append("**Priority:** ").append(nullToEmpty(issue.priority())).append('\n');
        if (!issue.labels().isEmpty()) {
            content.append("**Labels:** ").append(String.join(", ", issue.labels())).append('\n');
        }
        if (!issue.components().isEmpty()) {
            content.append("**Components:** ").append(String.join(", ", issue.components())).append('\n');
        }

        content.append("\n## Description\n\n");
        content.append(nullToEmpty(issue.description()));
        content.append('\n');
        return content.toString();
    }

    /**
     * True when two rendered files differ at most in their {@code syncedAt} line.
     */
    public boolean sameContent(String existing, String rendered) {
        return withoutSyncedAt(existing).equals(withoutSyncedAt(rendered));
    }

    private static String withoutSyncedAt(String content) {
        return content.lines()
                .filter(line -> !line.startsWith(SYNCED_AT_PREFIX))
                .collect(Collectors.joining("\n"));
    }

    private static void appendYamlList(StringBuilder content, String name, List<String> values) {
        if (values.isEmpty()) return;
        content.append(name).append(":\n");
        for (String value : values) {
            content.append("  - ").append(value).append('\n');
        }
    }

    private static String displayAssignee(IssueData issue) {
        return issue.assignee() != null ? issue.assignee() : "Unassigned";
    }

    private static String displayReporter(IssueData issue) {
        return issue.reporter() != null ? issue.reporter() : "Unknown";
    }

    private static String timestamp(Instant instant) {
        return instant == null ? "" : DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}

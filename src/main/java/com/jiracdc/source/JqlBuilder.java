package com.jiracdc.source;

import java.util.List;

/**
 * Composes the JQL queries used for project scans.
 */
public final class JqlBuilder {

    /** Statuses treated as finished. Matched case-sensitively. */
    public static final List<String> INACTIVE_STATUSES = List.of("Done", "Closed", "Resolved");

    private final StringBuilder jql;

    private JqlBuilder(String projectKey) {
        this.jql = new StringBuilder("project = ").append(projectKey);
    }

    public static JqlBuilder project(String projectKey) {
        if (projectKey == null || projectKey.isBlank()) {
            throw new IllegalArgumentException("projectKey is required");
        }
        return new JqlBuilder(projectKey);
    }

    /** Excludes issues whose status is Done, Closed or Resolved. */
    public JqlBuilder activeOnly(boolean activeOnly) {
        if (activeOnly) {
            for (String status : INACTIVE_STATUSES) {
                jql.append(" AND status != ").append(status);
            }
        }
        return this;
    }

    /**
     * Restricts to issues updated at or after {@code since}, either a relative JQL
     * expression ("-24h") or a quoted timestamp ("2024-01-01 10:00").
     */
    public JqlBuilder updatedSince(String since) {
        if (since != null && !since.isBlank()) {
            String value = since.startsWith("-") ? since : "\"" + since + "\"";
            jql.append(" AND updated >= ").append(value);
        }
        return this;
    }

    /** ANDs an arbitrary extra clause onto the query, parenthesized so an OR inside it stays scoped. */
    public JqlBuilder and(String clause) {
        if (clause != null && !clause.isBlank()) {
            jql.append(" AND (").append(clause.trim()).append(')');
        }
        return this;
    }

    public String orderByKey() {
        return jql + " ORDER BY key ASC";
    }

    public String build() {
        return jql.toString();
    }
}

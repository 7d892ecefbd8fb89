package com.jiracdc.core.sync;

import com.jiracdc.core.model.IssueData;
import com.jiracdc.core.model.IssueRecord;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;

/**
 * Maps a Jira issue to the canonical {@link IssueData}. Total: missing fields, users or
 * timestamps become null or empty lists, never an exception.
 */
public final class IssueConverter {

    /** Jira's REST timestamp format, e.g. {@code 2024-01-15T10:30:00.000+0000}. */
    private static final DateTimeFormatter JIRA_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");

    private IssueConverter() {}

    public static IssueData convert(IssueRecord source) {
        IssueRecord.Fields f = source.getFields() != null ? source.getFields() : new IssueRecord.Fields();
        return new IssueData(
                source.getKey(),
                f.getSummary(),
                f.getDescription(),
                name(f.getStatus()),
                name(f.getIssueType()),
                name(f.getPriority()),
                userName(f.getAssignee()),
                userName(f.getReporter()),
                f.getLabels() == null ? List.of() : f.getLabels().stream().filter(Objects::nonNull).toList(),
                names(f.getComponents()),
                names(f.getFixVersions()),
                f.getParent() != null ? f.getParent().getKey() : null,
                parseTimestamp(f.getCreated()),
                parseTimestamp(f.getUpdated()));
    }

    public static List<IssueData> convertAll(List<IssueRecord> sources) {
        return sources.stream().map(IssueConverter::convert).toList();
    }

    /**
     * Parses a Jira timestamp, falling back to ISO-8601 offset format.
     *
     * @return the instant, or null if absent or unparseable
     */
    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return OffsetDateTime.parse(value, JIRA_TIMESTAMP).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private static String name(IssueRecord.Named named) {
        return named != null ? named.getName() : null;
    }

    private static List<String> names(List<IssueRecord.Named> values) {
        if (values == null) return List.of();
        return values.stream()
                .filter(Objects::nonNull)
                .map(IssueRecord.Named::getName)
                .filter(Objects::nonNull)
                .toList();
    }

    private static String userName(IssueRecord.User user) {
        if (user == null) return null;
        if (user.getDisplayName() != null) return user.getDisplayName();
        return user.getName();
    }
}

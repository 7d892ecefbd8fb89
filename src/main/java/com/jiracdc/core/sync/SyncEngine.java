package com.jiracdc.core.sync;

import com.jiracdc.core.engine.CancellationSignal;
import com.jiracdc.core.metrics.SyncMetrics;
import com.jiracdc.core.model.IssueData;
import com.jiracdc.core.model.IssueRecord;
import com.jiracdc.core.model.OperationConfig;
import com.jiracdc.core.model.SyncOperationType;
import com.jiracdc.core.model.SyncProgress;
import com.jiracdc.core.model.SyncResult;
import com.jiracdc.git.GitProperties;
import com.jiracdc.git.GitWriter;
import com.jiracdc.git.IssueFileWriteException;
import com.jiracdc.git.WriteResult;
import com.jiracdc.source.JqlBuilder;
import com.jiracdc.source.SearchPage;
import com.jiracdc.source.SourceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Moves issues from the source tracker into the mirror repository.
 *
 * <p>Single-issue sync, one-shot project sync and paginated bootstrap all share the same per-item
 * path: fetch, convert, write. A failure writing one issue is recorded in that issue's
 * {@link SyncResult} and the batch carries on. A commit or push failure
 * ({@link com.jiracdc.git.GitWriteException}) aborts the batch. Cancellation is checked between items.
 */
@Service
public class SyncEngine {

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    /** Upper bound on issues returned by the single search of a project sync. */
    static final int MAX_PROJECT_SYNC_RESULTS = 1000;

    private final SourceClient sourceClient;
    private final GitWriter gitWriter;
    private final SyncMetrics metrics;
    private final String defaultBranch;

    @Autowired
    public SyncEngine(SourceClient sourceClient, GitWriter gitWriter, SyncMetrics metrics, GitProperties gitProperties) {
        this(sourceClient, gitWriter, metrics, gitProperties.getBranch());
    }

    SyncEngine(SourceClient sourceClient, GitWriter gitWriter, SyncMetrics metrics, String defaultBranch) {
        this.sourceClient = sourceClient;
        this.gitWriter = gitWriter;
        this.metrics = metrics;
        this.defaultBranch = defaultBranch;
    }

    /**
     * Fetches one issue, writes its file and pushes.
     *
     * @param forceRefresh commit even when the file content is unchanged
     * @throws com.jiracdc.source.NotFoundException if the issue does not exist
     */
    public SyncResult synchronizeIssue(String issueKey, boolean forceRefresh, CancellationSignal signal) {
        log.info("Synchronizing issue {} (force={})", issueKey, forceRefresh);
        IssueRecord record = sourceClient.getIssue(issueKey, SourceClient.DEFAULT_FIELDS, signal);
        SyncResult result = writeIssue(IssueConverter.convert(record), forceRefresh);
        if (result.success() && result.commitHash() != null) {
            push(defaultBranch);
        }
        return result;
    }

    /**
     * Runs one search against the project and writes every matching issue, pushing once at the end
     * if anything was committed.
     *
     * @param config       project, active-only flag and extra filter
     * @param forceRefresh commit even when content is unchanged
     * @param updatedSince optional JQL lower bound on {@code updated} (e.g. "-24h"); null for all issues
     * @param sink         receives a progress update after each issue
     */
    public List<SyncResult> synchronizeProject(OperationConfig config, boolean forceRefresh, String updatedSince,
                                               Consumer<SyncProgress> sink, CancellationSignal signal) {
        var jql = JqlBuilder.project(config.projectKey())
                .activeOnly(config.activeIssuesOnly())
                .updatedSince(updatedSince)
                .and(config.issueFilter())
                .orderByKey();
        log.info("Synchronizing project {} with query: {}", config.projectKey(), jql);

        SearchPage page = sourceClient.searchIssues(jql, 0, MAX_PROJECT_SYNC_RESULTS, SourceClient.DEFAULT_FIELDS, signal);
        List<IssueData> issues = IssueConverter.convertAll(page.items());
        if (config.activeIssuesOnly()) {
            issues = filterActiveIssues(issues);
        }
        if (page.totalCount() > page.items().size()) {
            log.warn("Project {} has {} matching issues, only the first {} are synchronized in this pass",
                    config.projectKey(), page.totalCount(), page.items().size());
        }

        var results = new ArrayList<SyncResult>(issues.size());
        int total = issues.size();
        for (IssueData issue : issues) {
            signal.throwIfCancelled();
            SyncResult result = writeIssue(issue, forceRefresh);
            results.add(result);
            sink.accept(new SyncProgress(results.size(), total, issue.key(), describe(result)));
        }

        if (results.stream().anyMatch(r -> r.commitHash() != null)) {
            push(config.branch());
        }
        log.info("Project {} synchronized: {} issue(s), {} failed", config.projectKey(), results.size(),
                results.stream().filter(r -> !r.success()).count());
        return results;
    }

    /**
     * Full paginated scan of the project. Writes each page and pushes once per page.
     * Issue keys seen on an earlier page are skipped, so results never contain duplicates.
     *
     * @param overwrite commit every file even when content is unchanged (forced sync)
     */
    public List<SyncResult> bootstrap(OperationConfig config, boolean overwrite,
                                      Consumer<SyncProgress> sink, CancellationSignal signal) {
        log.info("Bootstrapping project {} (pageSize={}, activeOnly={}, overwrite={})",
                config.projectKey(), config.pageSize(), config.activeIssuesOnly(), overwrite);

        var results = new ArrayList<SyncResult>();
        Set<String> seen = new HashSet<>();
        int offset = 0;
        int total = 0;
        int pages = 0;

        while (true) {
            signal.throwIfCancelled();
            SearchPage page = fetchPage(config, offset, signal);
            pages++;
            total = Math.max(total, page.totalCount());

            List<IssueData> issues = IssueConverter.convertAll(page.items());
            if (config.activeIssuesOnly()) {
                issues = filterActiveIssues(issues);
            }

            int written = 0;
            for (IssueData issue : issues) {
                signal.throwIfCancelled();
                if (!seen.add(issue.key())) {
                    log.debug("Skipping duplicate issue {} at offset {}", issue.key(), offset);
                    continue;
                }
                SyncResult result = writeIssue(issue, overwrite);
                results.add(result);
                written++;
                sink.accept(new SyncProgress(results.size(), Math.max(total, results.size()), issue.key(),
                        describe(result)));
            }
            if (written > 0) {
                push(config.branch());
            }

            offset += page.items().size();
            log.debug("Bootstrap page {} done: offset={} total={}", pages, offset, page.totalCount());
            if (page.items().isEmpty() || offset >= page.totalCount()) {
                break;
            }
        }

        sink.accept(new SyncProgress(results.size(), results.size(), null,
                "Bootstrap complete: %d issue(s) in %d page(s)".formatted(results.size(), pages)));
        log.info("Bootstrap of {} complete: {} issue(s) over {} page(s)", config.projectKey(), results.size(), pages);
        return results;
    }

    /**
     * Counts issues updated since {@code since} without fetching them.
     */
    public int countUpdatedIssues(OperationConfig config, String since, CancellationSignal signal) {
        var jql = JqlBuilder.project(config.projectKey())
                .activeOnly(config.activeIssuesOnly())
                .updatedSince(since)
                .and(config.issueFilter())
                .build();
        return sourceClient.searchIssues(jql, 0, 0, List.of("key"), signal).totalCount();
    }

    /**
     * Keys of this project with a file in the repository but no matching issue in the project scope.
     * With {@code activeIssuesOnly}, issues that have since moved to Done, Closed or Resolved count as orphans.
     */
    public List<String> findOrphans(OperationConfig config, CancellationSignal signal) {
        Set<String> inScope = new HashSet<>();
        int offset = 0;
        while (true) {
            signal.throwIfCancelled();
            var jql = JqlBuilder.project(config.projectKey())
                    .activeOnly(config.activeIssuesOnly())
                    .and(config.issueFilter())
                    .orderByKey();
            SearchPage page = sourceClient.searchIssues(jql, offset, config.pageSize(), List.of("status"), signal);
            for (IssueRecord record : page.items()) {
                inScope.add(record.getKey());
            }
            offset += page.items().size();
            if (page.items().isEmpty() || offset >= page.totalCount()) {
                break;
            }
        }

        // files of other projects share the repository and are never candidates
        String prefix = config.projectKey() + "-";
        var orphans = new ArrayList<String>();
        for (String key : gitWriter.listIssueKeys()) {
            if (key.startsWith(prefix) && !inScope.contains(key)) {
                orphans.add(key);
            }
        }
        log.info("Found {} orphaned issue file(s) for project {}", orphans.size(), config.projectKey());
        return orphans;
    }

    /**
     * Deletes the files of the given issues and pushes once if any file was removed.
     */
    public List<SyncResult> removeIssues(List<String> issueKeys, String branch,
                                         Consumer<SyncProgress> sink, CancellationSignal signal) {
        var results = new ArrayList<SyncResult>(issueKeys.size());
        for (String key : new LinkedHashSet<>(issueKeys)) {
            signal.throwIfCancelled();
            SyncResult result;
            try {
                WriteResult write = gitWriter.deleteIssueFile(key);
                result = SyncResult.succeeded(key, write.operationType(), write.path(), write.commitHash());
            } catch (IssueFileWriteException e) {
                log.warn("Failed to delete file for {}: {}", key, e.getMessage());
                result = SyncResult.failed(key, SyncOperationType.DELETE, e.getMessage());
            }
            metrics.recordIssueSynced(result.operationType().name(), result.success());
            results.add(result);
            sink.accept(new SyncProgress(results.size(), issueKeys.size(), key, describe(result)));
        }
        if (results.stream().anyMatch(r -> r.commitHash() != null)) {
            push(branch);
        }
        return results;
    }

    /**
     * Drops issues whose status is Done, Closed or Resolved, keeping the order of the rest.
     */
    public static List<IssueData> filterActiveIssues(List<IssueData> issues) {
        return issues.stream()
                .filter(issue -> issue.status() == null || !JqlBuilder.INACTIVE_STATUSES.contains(issue.status()))
                .toList();
    }

    private SearchPage fetchPage(OperationConfig config, int offset, CancellationSignal signal) {
        if (config.issueFilter() == null || config.issueFilter().isBlank()) {
            return sourceClient.getProjectIssues(config.projectKey(), offset, config.pageSize(),
                    config.activeIssuesOnly(), signal);
        }
        var jql = JqlBuilder.project(config.projectKey())
                .activeOnly(config.activeIssuesOnly())
                .and(config.issueFilter())
                .orderByKey();
        return sourceClient.searchIssues(jql, offset, config.pageSize(), SourceClient.DEFAULT_FIELDS, signal);
    }

    private SyncResult writeIssue(IssueData issue, boolean overwrite) {
        SyncResult result;
        try {
            WriteResult write = gitWriter.createOrUpdateIssueFile(issue, overwrite);
            result = SyncResult.succeeded(issue.key(), write.operationType(), write.path(), write.commitHash());
        } catch (IssueFileWriteException e) {
            log.warn("Failed to write issue {}: {}", issue.key(), e.getMessage());
            result = SyncResult.failed(issue.key(), SyncOperationType.UPDATE, e.getMessage());
        }
        metrics.recordIssueSynced(result.operationType().name(), result.success());
        return result;
    }

    private void push(String branch) {
        try {
            gitWriter.pushChanges(branch != null ? branch : defaultBranch);
            metrics.recordPush(true);
        } catch (RuntimeException e) {
            metrics.recordPush(false);
            throw e;
        }
    }

    private static String describe(SyncResult result) {
        return result.success()
                ? "%s %s".formatted(result.operationType(), result.issueKey())
                : "FAILED %s: %s".formatted(result.issueKey(), result.errorMessage());
    }
}

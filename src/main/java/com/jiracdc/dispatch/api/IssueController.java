package com.jiracdc.dispatch.api;

import com.jiracdc.core.engine.CancellationSignal;
import com.jiracdc.core.model.SyncResult;
import com.jiracdc.core.sync.SyncEngine;
import com.jiracdc.git.GitWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * REST controller for on-demand single-issue synchronization and for reading the mirrored files.
 */
@RestController
@RequestMapping("/api/v1/issues")
public class IssueController {

    private static final Logger log = LoggerFactory.getLogger(IssueController.class);

    static final Pattern ISSUE_KEY = Pattern.compile("^[A-Z][A-Z0-9_]*-\\d+$");

    private static final MediaType MARKDOWN = new MediaType("text", "markdown", StandardCharsets.UTF_8);

    private final SyncEngine syncEngine;
    private final GitWriter gitWriter;

    public IssueController(SyncEngine syncEngine, GitWriter gitWriter) {
        this.syncEngine = syncEngine;
        this.gitWriter = gitWriter;
    }

    /**
     * GET /api/v1/issues: Keys of every issue file in the mirror, sorted.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listIssues() {
        List<String> keys = gitWriter.listIssueKeys();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("issues", keys);
        body.put("count", keys.size());
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/v1/issues/{key}: The markdown file of one issue as stored in the mirror.
     */
    @GetMapping("/{key}")
    public ResponseEntity<String> getIssue(@PathVariable String key) {
        requireValidKey(key);
        return gitWriter.readIssueFile(key)
                .map(content -> ResponseEntity.ok().contentType(MARKDOWN).body(content))
                .orElseThrow(() -> new IssueNotFoundException("Issue file not found: " + key));
    }

    /**
     * POST /api/v1/issues/{key}/sync: Fetch one issue and commit its file. Runs on the request thread.
     */
    @PostMapping("/{key}/sync")
    public ResponseEntity<Map<String, Object>> syncIssue(@PathVariable String key,
                                                         @RequestParam(name = "force", defaultValue = "false") boolean force) {
        requireValidKey(key);
        gitWriter.initialize();
        SyncResult result = syncEngine.synchronizeIssue(key, force, CancellationSignal.none());
        log.info("Issue {} synced via API: {} (success={})", key, result.operationType(), result.success());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("issue_key", result.issueKey());
        body.put("operation", result.operationType().name());
        body.put("success", result.success());
        body.put("file_path", result.filePath());
        body.put("commit_hash", result.commitHash());
        if (result.errorMessage() != null) {
            body.put("error", result.errorMessage());
        }
        return result.success()
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static void requireValidKey(String key) {
        if (!ISSUE_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid issue key: " + key);
        }
    }
}

package com.jiracdc.core.health;

import com.jiracdc.core.engine.CancellationSignal;
import com.jiracdc.core.engine.OperationProcessor;
import com.jiracdc.core.engine.SyncProperties;
import com.jiracdc.core.model.OperationStatus;
import com.jiracdc.git.GitProperties;
import com.jiracdc.source.SourceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SourceClient sourceClient;
    private final GitProperties gitProperties;
    private final OperationProcessor processor;
    private final SyncProperties syncProperties;

    public HealthCheckService(SourceClient sourceClient, GitProperties gitProperties,
                              OperationProcessor processor, SyncProperties syncProperties) {
        this.sourceClient = sourceClient;
        this.gitProperties = gitProperties;
        this.processor = processor;
        this.syncProperties = syncProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkJira());
        results.add(checkRepository());
        results.add(checkOperations());
        return results;
    }

    private HealthStatus checkJira() {
        long start = System.nanoTime();
        try {
            sourceClient.authenticate(CancellationSignal.none());
            long ms = (System.nanoTime() - start) / 1_000_000;
            return new HealthStatus("jira", HealthStatus.Status.UP,
                    "Authenticated", Map.of("responseTimeMs", String.valueOf(ms)));
        } catch (RuntimeException e) {
            log.warn("Jira health check failed: {}", e.getMessage());
            return new HealthStatus("jira", HealthStatus.Status.DOWN,
                    "Jira error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkRepository() {
        Path workDir = Path.of(gitProperties.getWorkingDirectory()).toAbsolutePath().normalize();
        var metadata = Map.of("path", workDir.toString(), "branch", gitProperties.getBranch());
        if (Files.isDirectory(workDir.resolve(".git"))) {
            return new HealthStatus("repository", HealthStatus.Status.UP,
                    "Working copy present", metadata);
        }
        // not cloned yet; the first operation initializes it
        return new HealthStatus("repository", HealthStatus.Status.DEGRADED,
                "Working copy not initialized", metadata);
    }

    private HealthStatus checkOperations() {
        var metadata = new LinkedHashMap<String, String>();
        metadata.put("running", String.valueOf(processor.listOperations(OperationStatus.RUNNING).size()));
        metadata.put("pending", String.valueOf(processor.listOperations(OperationStatus.PENDING).size()));
        metadata.put("pollingEnabled", String.valueOf(syncProperties.isPollingEnabled()));
        String projectKey = syncProperties.getProjectKey();
        if (projectKey != null && !projectKey.isBlank()) {
            metadata.put("projectKey", projectKey);
            processor.getLastSuccessfulSync(projectKey)
                    .ifPresent(at -> metadata.put("lastSuccessfulSync", at.toString()));
        }
        return new HealthStatus("operations", HealthStatus.Status.UP,
                "Operation processor available", metadata);
    }
}

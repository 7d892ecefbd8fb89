package com.jiracdc.dispatch.cli;

import com.jiracdc.core.engine.CancellationSignal;
import com.jiracdc.core.model.SyncResult;
import com.jiracdc.core.sync.SyncEngine;
import com.jiracdc.git.GitWriter;
import com.jiracdc.source.NotFoundException;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: jiracdc issue &lt;KEY&gt;
 * <p>
 * Synchronizes a single issue into the repository and pushes.
 */
@Command(name = "issue", mixinStandardHelpOptions = true, description = "Synchronize a single issue")
@Component
public class IssueCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Issue key, e.g. PROJ-123")
    private String issueKey;

    @Option(names = {"--force", "-f"}, description = "Commit even when the file content is unchanged")
    private boolean force;

    private final SyncEngine syncEngine;
    private final GitWriter gitWriter;

    public IssueCommand(@Lazy SyncEngine syncEngine, @Lazy GitWriter gitWriter) {
        this.syncEngine = syncEngine;
        this.gitWriter = gitWriter;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            gitWriter.initialize();
            SyncResult result = syncEngine.synchronizeIssue(issueKey, force, CancellationSignal.none());
            ConsoleOutput.issueResult(result);
            return result.success() ? 0 : 1;
        } catch (NotFoundException e) {
            ConsoleOutput.error("Issue not found: " + issueKey);
            return 1;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Sync of " + issueKey + " failed: " + rootCauseMessage(e));
            return 1;
        }
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

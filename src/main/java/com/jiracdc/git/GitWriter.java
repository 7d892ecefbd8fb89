package com.jiracdc.git;

import com.jiracdc.core.model.IssueData;

import java.util.List;
import java.util.Optional;

/**
 * Write path into the mirror repository. Implementations serialize all writes to one repository.
 */
public interface GitWriter {

    /** Clones the repository if the working copy is missing, otherwise pulls. */
    void initialize();

    /** Fast-forwards the working copy to the remote branch. */
    void pull();

    /**
     * Writes and commits the file for one issue.
     *
     * @param overwrite commit even when the rendered content matches the existing file
     * @throws IssueFileWriteException if the file cannot be written or staged
     * @throws GitWriteException       if the commit fails
     */
    WriteResult createOrUpdateIssueFile(IssueData issue, boolean overwrite);

    /**
     * Removes and commits the deletion of an issue file.
     *
     * @throws GitWriteException if the removal cannot be committed
     */
    WriteResult deleteIssueFile(String issueKey);

    /**
     * Pushes local commits.
     *
     * @throws GitWriteException if the push is rejected or the remote is unreachable
     */
    void pushChanges(String branch);

    /** Keys of all issue files currently in the working copy. */
    List<String> listIssueKeys();

    /**
     * Markdown content of one issue file in the working copy.
     *
     * @return empty if the issue has no file
     * @throws GitWriteException if the file exists but cannot be read
     */
    Optional<String> readIssueFile(String issueKey);
}

package com.jiracdc.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Typed output of a completed task, readable by the tasks that depend on it.
 */
public sealed interface TaskOutput extends Serializable
        permits TaskOutput.None, TaskOutput.ProjectInfo, TaskOutput.UpdateCheck, TaskOutput.Orphans {

    None NONE = new None();

    record None() implements TaskOutput {}

    record ProjectInfo(String key, String name) implements TaskOutput {}

    /**
     * @param since        JQL lower bound used for the check
     * @param changedCount number of issues updated since then
     */
    record UpdateCheck(String since, int changedCount) implements TaskOutput {}

    record Orphans(List<String> issueKeys) implements TaskOutput {}
}

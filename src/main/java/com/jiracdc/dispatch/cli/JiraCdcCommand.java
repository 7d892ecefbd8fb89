package com.jiracdc.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 * Routes to subcommands: serve, sync, status, issue.
 */
@Command(
        name = "jiracdc",
        mixinStandardHelpOptions = true,
        version = "jiracdc 0.1.0",
        description = "Mirrors Jira issues into a git repository as markdown files",
        subcommands = {
                ServeCommand.class,
                SyncCommand.class,
                StatusCommand.class,
                IssueCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class JiraCdcCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}

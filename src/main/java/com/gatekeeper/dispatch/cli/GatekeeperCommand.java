package com.gatekeeper.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;

/**
 * Top-level CLI command for Gatekeeper.
 * Routes to the history subcommands and the risk assessment preview.
 */
@Command(
        name = "gatekeeper",
        mixinStandardHelpOptions = true,
        version = "Gatekeeper 0.1.0",
        description = "Risk-scored approvals with a git-like decision history",
        subcommands = {
                LogCommand.class,
                BranchCommand.class,
                CheckoutCommand.class,
                MergeCommand.class,
                RevertCommand.class,
                TagCommand.class,
                StatusCommand.class,
                ShowCommand.class,
                CommitCommand.class,
                AssessCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class GatekeeperCommand implements Runnable {

    static final String DEFAULT_REPO = ".gatekeeper/approvals.json";

    @Option(names = {"--repo", "-r"}, description = "Approval history file (default: ${DEFAULT-VALUE})",
            defaultValue = DEFAULT_REPO)
    private Path repo;

    @Spec
    private CommandSpec spec;

    public Path repo() {
        return repo;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}

package com.gatekeeper.dispatch.cli;

import com.gatekeeper.history.HistoryStore;
import com.gatekeeper.history.snapshot.RepositorySnapshotCodec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: gatekeeper checkout [-b] &lt;branch&gt;
 */
@Command(name = "checkout", mixinStandardHelpOptions = true, description = "Switch the current branch")
@Component
public class CheckoutCommand extends RepositoryCommand {

    @Parameters(index = "0", description = "Branch name")
    private String name;

    @Option(names = "-b", description = "Create the branch at the current head first")
    private boolean create;

    public CheckoutCommand(HistoryStore store, RepositorySnapshotCodec codec) {
        super(store, codec);
    }

    @Override
    protected boolean execute() {
        if (create) {
            store.createBranch(name);
        }
        store.checkoutBranch(name);
        ConsoleOutput.success("Switched to branch '" + name + "'");
        return true;
    }
}

package com.gatekeeper.dispatch.cli;

import com.gatekeeper.history.CommitFactory;
import com.gatekeeper.history.HistoryStore;
import com.gatekeeper.history.model.Commit;
import com.gatekeeper.history.snapshot.RepositorySnapshotCodec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: gatekeeper revert &lt;commit&gt; [--no-commit] [-m message]
 */
@Command(name = "revert", mixinStandardHelpOptions = true, description = "Record the opposite of an earlier decision")
@Component
public class RevertCommand extends RepositoryCommand {

    @Parameters(index = "0", description = "Commit id, unique prefix or tag")
    private String commitId;

    @Option(names = "--no-commit", description = "Show the revert commit without recording it")
    private boolean noCommit;

    @Option(names = {"--message", "-m"}, description = "Commit message")
    private String message;

    public RevertCommand(HistoryStore store, RepositorySnapshotCodec codec) {
        super(store, codec);
    }

    @Override
    protected boolean execute() {
        Commit revert = store.revertCommit(commitId, noCommit, message);
        if (noCommit) {
            ConsoleOutput.info("Revert preview (not recorded):");
            System.out.println(CommitFactory.format(revert, false, true, true));
            return false;
        }
        ConsoleOutput.success("[" + store.getCurrentBranch().name() + " " + revert.shortId() + "] "
                + revert.metadata().subject());
        return true;
    }
}

package com.gatekeeper.dispatch.cli;

import com.gatekeeper.history.CommitFactory;
import com.gatekeeper.history.HistoryStore;
import com.gatekeeper.history.model.Commit;
import com.gatekeeper.history.snapshot.RepositorySnapshotCodec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: gatekeeper show &lt;commit&gt;
 */
@Command(name = "show", mixinStandardHelpOptions = true, description = "Show one commit with its changes")
@Component
public class ShowCommand extends RepositoryCommand {

    @Parameters(index = "0", description = "Commit id, unique prefix or tag")
    private String ref;

    public ShowCommand(HistoryStore store, RepositorySnapshotCodec codec) {
        super(store, codec);
    }

    @Override
    protected boolean execute() {
        Commit commit = store.getCommit(ref);
        System.out.println(CommitFactory.format(commit, false, true, true));
        System.out.println();
        System.out.println("Diff: " + commit.diff().type().label() + " - " + commit.diff().summary());
        System.out.println("Request: " + commit.response().requestId());
        return false;
    }
}

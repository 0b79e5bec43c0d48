package com.gatekeeper.dispatch.cli;

import com.gatekeeper.history.HistoryStore;
import com.gatekeeper.history.model.Commit;
import com.gatekeeper.history.snapshot.RepositorySnapshotCodec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: gatekeeper merge &lt;source&gt; [--into target] [-m message]
 */
@Command(name = "merge", mixinStandardHelpOptions = true, description = "Merge a branch into another")
@Component
public class MergeCommand extends RepositoryCommand {

    @Parameters(index = "0", description = "Branch to merge")
    private String source;

    @Option(names = "--into", description = "Target branch (default: current branch)")
    private String target;

    @Option(names = {"--message", "-m"}, description = "Merge commit message")
    private String message;

    public MergeCommand(HistoryStore store, RepositorySnapshotCodec codec) {
        super(store, codec);
    }

    @Override
    protected boolean execute() {
        String into = target != null ? target : store.getCurrentBranch().name();
        Commit merge = store.mergeBranch(source, into, message);
        ConsoleOutput.success("Merged " + source + " into " + into + " (" + merge.shortId() + ", "
                + merge.parentIds().size() + " parent" + (merge.parentIds().size() != 1 ? "s" : "") + ")");
        return true;
    }
}

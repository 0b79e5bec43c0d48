package com.gatekeeper.dispatch.cli;

import com.gatekeeper.history.CommitFactory;
import com.gatekeeper.history.HistoryStore;
import com.gatekeeper.history.model.Commit;
import com.gatekeeper.history.model.LogFilter;
import com.gatekeeper.history.snapshot.RepositorySnapshotCodec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Instant;
import java.util.List;

/**
 * CLI command: gatekeeper log
 * <p>
 * Lists recorded decisions newest first, like {@code git log}.
 */
@Command(name = "log", mixinStandardHelpOptions = true, description = "Show the approval decision log")
@Component
public class LogCommand extends RepositoryCommand {

    @Option(names = {"--branch", "-b"}, description = "Only commits on this branch")
    private String branch;

    @Option(names = "--author", description = "Author name substring (case-insensitive)")
    private String author;

    @Option(names = "--since", description = "ISO-8601 instant, inclusive")
    private Instant since;

    @Option(names = "--until", description = "ISO-8601 instant, inclusive")
    private Instant until;

    @Option(names = "--grep", description = "Regex matched against the message (case-insensitive)")
    private String grep;

    @Option(names = {"--limit", "-n"}, description = "Maximum number of commits", defaultValue = "0")
    private int limit;

    @Option(names = "--oneline", description = "One line per commit")
    private boolean oneline;

    @Option(names = "--stat", description = "Show the change list of each commit")
    private boolean showDiff;

    @Option(names = "--tags", description = "Show auto tags")
    private boolean showTags;

    public LogCommand(HistoryStore store, RepositorySnapshotCodec codec) {
        super(store, codec);
    }

    @Override
    protected boolean execute() {
        LogFilter filter = new LogFilter(branch, author, since, until, grep, limit);
        List<Commit> commits = store.getLog(filter);
        if (commits.isEmpty()) {
            ConsoleOutput.info("No commits found.");
            return false;
        }
        for (Commit commit : commits) {
            System.out.println(CommitFactory.format(commit, oneline, showDiff, showTags));
            if (!oneline) {
                System.out.println();
            }
        }
        return false;
    }
}

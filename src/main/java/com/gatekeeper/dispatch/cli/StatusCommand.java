package com.gatekeeper.dispatch.cli;

import com.gatekeeper.history.HistoryStore;
import com.gatekeeper.history.model.Branch;
import com.gatekeeper.history.model.MergeRequest;
import com.gatekeeper.history.model.RepositoryStatistics;
import com.gatekeeper.history.snapshot.RepositorySnapshotCodec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: gatekeeper status
 * <p>
 * Shows the current branch, repository totals, open merge requests and the risk profile.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show repository status")
@Component
public class StatusCommand extends RepositoryCommand {

    public StatusCommand(HistoryStore store, RepositorySnapshotCodec codec) {
        super(store, codec);
    }

    @Override
    protected boolean execute() {
        ConsoleOutput.printBanner();

        Branch current = store.getCurrentBranch();
        ConsoleOutput.info("On branch " + current.name()
                + (current.head() != null ? " at " + current.head().substring(0, 7) : " (no commits yet)"));

        RepositoryStatistics stats = store.getStatistics();
        RepositoryStatistics.Totals totals = stats.totals();
        System.out.printf("  Commits: %d  Branches: %d  Merge requests: %d  Tags: %d%n",
                totals.commits(), totals.branches(), totals.mergeRequests(), totals.tags());
        System.out.printf("  Last 7 days: %d commits  Last 30 days: %d commits%n",
                stats.activity().commitsLastWeek(), stats.activity().commitsLastMonth());
        System.out.printf("  Rejection rate: %.0f%%  Most active: %s%n",
                stats.risk().rejectionRate() * 100, stats.contributors().mostActive());

        if (!stats.risk().riskDistribution().isEmpty()) {
            System.out.println("  Risk: " + stats.risk().riskDistribution());
            System.out.println("  Categories: " + stats.risk().categoryDistribution());
        }

        var open = store.getMergeRequests().stream().filter(mr -> mr.status().isOpen()).toList();
        if (!open.isEmpty()) {
            System.out.println();
            System.out.printf("  %-10s %-10s %-24s %s%n", "MR", "STATUS", "BRANCHES", "TITLE");
            System.out.println("  " + "-".repeat(64));
            for (MergeRequest mr : open) {
                System.out.printf("  %-10s %-10s %-24s %s%n",
                        mr.id().substring(0, 8), mr.status().label(),
                        ConsoleOutput.truncate(mr.sourceBranch() + " -> " + mr.targetBranch(), 24),
                        ConsoleOutput.truncate(mr.title(), 30));
            }
        }
        return false;
    }
}

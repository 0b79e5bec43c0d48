package com.gatekeeper.dispatch.cli;

import com.gatekeeper.core.model.ApprovalAction;
import com.gatekeeper.core.model.ApprovalCategory;
import com.gatekeeper.core.model.ApprovalResponse;
import com.gatekeeper.core.model.RiskLevel;
import com.gatekeeper.core.model.TrustRank;
import com.gatekeeper.history.HistoryStore;
import com.gatekeeper.history.model.Author;
import com.gatekeeper.history.model.Commit;
import com.gatekeeper.history.snapshot.RepositorySnapshotCodec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Clock;
import java.util.UUID;

/**
 * CLI command: gatekeeper commit --action approve [--comment ...] [-m ...]
 * <p>
 * Records a decision taken outside the coordinator, e.g. a review done in another tool.
 */
@Command(name = "commit", mixinStandardHelpOptions = true, description = "Record an approval decision")
@Component
public class CommitCommand extends RepositoryCommand {

    @Option(names = {"--action", "-a"}, required = true, description = "approve, reject, trust or review")
    private String action;

    @Option(names = {"--request-id"}, description = "Request the decision answers (default: generated)")
    private String requestId;

    @Option(names = {"--comment", "-c"}, description = "Decision comment")
    private String comment;

    @Option(names = {"--message", "-m"}, description = "Commit message (default: derived from the decision)")
    private String message;

    @Option(names = "--rank", description = "Trust rank granted with a trust action")
    private String rank;

    @Option(names = "--risk", description = "Risk level of the request")
    private String risk;

    @Option(names = "--category", description = "Category of the request")
    private String category;

    @Option(names = "--quick", description = "Mark as a quick decision")
    private boolean quick;

    @Option(names = "--author", description = "Author name")
    private String authorName;

    @Option(names = "--email", description = "Author email")
    private String authorEmail;

    private final Clock clock;

    public CommitCommand(HistoryStore store, RepositorySnapshotCodec codec, Clock clock) {
        super(store, codec);
        this.clock = clock;
    }

    @Override
    protected boolean execute() {
        ApprovalAction approvalAction = ApprovalAction.fromLabel(action);
        TrustRank trustRank = rank != null ? TrustRank.fromLabel(rank) : null;
        ApprovalResponse response = ApprovalResponse.of(
                requestId != null ? requestId : UUID.randomUUID().toString(),
                approvalAction,
                comment,
                approvalAction == ApprovalAction.TRUST ? trustRank : null,
                clock.instant(),
                quick);

        Author author = authorName != null
                ? new Author(authorName, authorEmail != null ? authorEmail : "")
                : null;
        Commit commit = store.createCommit(response, message, author,
                risk != null ? RiskLevel.fromLabel(risk) : null,
                category != null ? ApprovalCategory.fromLabel(category) : null);

        ConsoleOutput.success("[" + store.getCurrentBranch().name() + " " + commit.shortId() + "] "
                + commit.metadata().subject());
        return true;
    }
}

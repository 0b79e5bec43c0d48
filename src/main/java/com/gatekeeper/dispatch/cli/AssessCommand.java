package com.gatekeeper.dispatch.cli;

import com.gatekeeper.core.model.ApprovalCategory;
import com.gatekeeper.core.model.ProposedAction;
import com.gatekeeper.core.model.RiskAssessmentResult;
import com.gatekeeper.core.model.RiskFactor;
import com.gatekeeper.core.model.TaskContext;
import com.gatekeeper.core.model.TrustRank;
import com.gatekeeper.core.policy.CategoryClassifier;
import com.gatekeeper.core.policy.CategorySuggestion;
import com.gatekeeper.core.risk.RiskAssessor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: gatekeeper assess "&lt;intent&gt;" --path a --path b
 * <p>
 * Previews the risk assessment and approval decision for a proposed change without
 * creating a request or touching the history.
 */
@Command(name = "assess", mixinStandardHelpOptions = true, description = "Preview the risk of a proposed change")
@Component
public class AssessCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "What the change is meant to do")
    private String intent;

    @Option(names = {"--path", "-p"}, description = "Affected file (repeatable)")
    private List<String> paths = new ArrayList<>();

    @Option(names = {"--description", "-d"}, description = "Action description (default: the intent)")
    private String description;

    @Option(names = "--irreversible", description = "The action cannot be undone")
    private boolean irreversible;

    @Option(names = "--rank", description = "Requester trust rank (default: ${DEFAULT-VALUE})", defaultValue = "novice")
    private String rank;

    @Option(names = "--category", description = "Approval category (default: classified from the intent)")
    private String category;

    private final RiskAssessor riskAssessor;
    private final CategoryClassifier categoryClassifier;

    public AssessCommand(RiskAssessor riskAssessor, CategoryClassifier categoryClassifier) {
        this.riskAssessor = riskAssessor;
        this.categoryClassifier = categoryClassifier;
    }

    @Override
    public Integer call() {
        TrustRank trustRank;
        try {
            trustRank = TrustRank.fromLabel(rank);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid rank: " + rank + ". Valid ranks: novice, learning, collaborative, trusted, autonomous");
            return RepositoryCommand.EXIT_FAILURE;
        }

        TaskContext context = TaskContext.of(intent, trustRank);
        ApprovalCategory effectiveCategory;
        if (category != null) {
            effectiveCategory = ApprovalCategory.parse(category).orElse(null);
            if (effectiveCategory == null) {
                ConsoleOutput.error("Unknown category: " + category);
                return RepositoryCommand.EXIT_FAILURE;
            }
        } else {
            CategorySuggestion suggestion = categoryClassifier.classify(context);
            effectiveCategory = suggestion.category().orElse(null);
            ConsoleOutput.info("Theme: " + suggestion.themeId()
                    + String.format(" (confidence %.2f)", suggestion.confidence()));
        }

        String actionDescription = description != null ? description : intent;
        ProposedAction action = new ProposedAction("change", actionDescription, paths, null, !irreversible);
        RiskAssessmentResult result = riskAssessor.assess(context, List.of(action), effectiveCategory);

        System.out.println();
        for (RiskFactor factor : result.factors()) {
            ConsoleOutput.risk(String.format("%-20s", factor.category()), factor.level(),
                    String.format("%.2f x %.2f  %s", factor.score(), factor.weight(), factor.description()));
        }
        System.out.println();
        ConsoleOutput.risk("Overall", result.overallRisk(),
                String.format("score %.2f - %s", result.overallScore(), RiskAssessor.explain(result.overallRisk())));
        ConsoleOutput.decision(result.requiresApproval(),
                "rank " + trustRank.label()
                        + (effectiveCategory != null ? ", category " + effectiveCategory.label() : "")
                        + (result.autoApprovalEligible() ? ", eligible for auto-approval" : ""));

        if (!result.recommendations().isEmpty()) {
            System.out.println();
            System.out.println("Recommendations:");
            result.recommendations().forEach(r -> System.out.println("  - " + r));
        }
        return 0;
    }
}

package com.gatekeeper.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gatekeeper.core.model.ApprovalAction;
import com.gatekeeper.core.model.ApprovalCategory;
import com.gatekeeper.core.model.ApprovalResponse;
import com.gatekeeper.core.model.RiskLevel;
import com.gatekeeper.history.model.ApprovalChange;
import com.gatekeeper.history.model.ApprovalDiff;
import com.gatekeeper.history.model.ApprovalState;
import com.gatekeeper.history.model.Author;
import com.gatekeeper.history.model.ChangeOperation;
import com.gatekeeper.history.model.Commit;
import com.gatekeeper.history.model.CommitMetadata;
import com.gatekeeper.history.model.DiffType;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds immutable, content-addressed commits from approval responses.
 * <p>
 * The tree hash covers the reduced approval state: approved flag, action, granted rank,
 * response timestamp and the previous state. The commit id hashes a git-style text block:
 * <pre>
 * tree &lt;treeHash&gt;
 * parent &lt;id&gt;            (one line per parent)
 * author name &lt;email&gt;
 *
 * &lt;message&gt;
 *
 * approval-action: approve
 * approval-status: approved
 * diff-summary: ...
 * </pre>
 * The commit's own creation time is not part of either hash, so identical content yields identical ids.
 */
@Component
public class CommitFactory {

    static final int ID_LENGTH = 40;

    private final Clock clock;
    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    public CommitFactory(Clock clock) {
        this.clock = clock;
    }

    public Commit create(ApprovalResponse response, List<String> parentIds, Author author, String message,
                         ApprovalState previousState) {
        return create(response, parentIds, author, message, previousState, null, null);
    }

    /**
     * @param message       commit message; a default is derived from the response when null or blank
     * @param previousState state of the parent commit; null for a first commit
     * @param riskLevel     risk of the original request; inferred from the comment when null
     * @param category      category of the original request; inferred from the comment when null
     */
    public Commit create(ApprovalResponse response, List<String> parentIds, Author author, String message,
                         ApprovalState previousState, RiskLevel riskLevel, ApprovalCategory category) {
        String effectiveMessage = message == null || message.isBlank() ? defaultMessage(response) : message;
        ApprovalDiff diff = diff(response, previousState);
        String treeHash = treeHash(response, previousState);

        String content = canonicalContent(treeHash, parentIds, author, effectiveMessage, response, diff.summary());
        String id = sha256(content).substring(0, ID_LENGTH);

        CommitMetadata metadata = new CommitMetadata(
                clock.instant(),
                author.name(),
                author.email(),
                effectiveMessage,
                autoTags(response),
                riskLevel != null ? riskLevel : inferRiskLevel(response.comment()),
                category != null ? category : inferCategory(response.comment()));

        return new Commit(id, parentIds, response, metadata, diff, treeHash);
    }

    String treeHash(ApprovalResponse response, ApprovalState previousState) {
        Map<String, Object> state = new TreeMap<>();
        state.put("approved", response.approved());
        state.put("action", response.action().label());
        state.put("trustRank", response.trustRank() != null ? response.trustRank().label() : null);
        state.put("timestamp", response.timestamp() != null ? response.timestamp().toString() : null);
        state.put("previousState", previousState);
        try {
            return sha256(canonicalMapper.writeValueAsString(state)).substring(0, ID_LENGTH);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize approval state", e);
        }
    }

    static String canonicalContent(String treeHash, List<String> parentIds, Author author, String message,
                                   ApprovalResponse response, String diffSummary) {
        List<String> lines = new ArrayList<>();
        lines.add("tree " + treeHash);
        for (String parent : parentIds) {
            lines.add("parent " + parent);
        }
        lines.add("author " + author.identity());
        lines.add("");
        lines.add(message);
        lines.add("");
        lines.add("approval-action: " + response.action().label());
        lines.add("approval-status: " + (response.approved() ? "approved" : "rejected"));
        lines.add("diff-summary: " + diffSummary);
        return String.join("\n", lines);
    }

    static String defaultMessage(ApprovalResponse response) {
        ApprovalAction action = response.action();
        if (action == ApprovalAction.TRUST) {
            String rank = response.trustRank() != null ? response.trustRank().label() : "unchanged";
            return "Grant trust: Auto-approve similar requests (" + rank + ")";
        }
        if (action == ApprovalAction.REVIEW) {
            return "Request review: Additional validation required";
        }
        String label = action.label();
        String base = Character.toUpperCase(label.charAt(0)) + label.substring(1) + ": "
                + (response.approved() ? "approved" : "rejected");
        if (response.comment() != null && !response.comment().isBlank()) {
            return base + "\n\n" + response.comment();
        }
        return base;
    }

    static ApprovalDiff diff(ApprovalResponse response, ApprovalState previousState) {
        List<ApprovalChange> changes = new ArrayList<>();

        if (response.trustRank() != null
                && (previousState == null || previousState.trustRank() != response.trustRank())) {
            boolean hadRank = previousState != null && previousState.trustRank() != null;
            changes.add(new ApprovalChange(
                    "trust-level",
                    hadRank ? ChangeOperation.MODIFY : ChangeOperation.ADD,
                    hadRank ? previousState.trustRank().label() : null,
                    response.trustRank().label(),
                    "Trust level " + (hadRank ? "changed" : "set") + " to " + response.trustRank().label()));
        }

        changes.add(new ApprovalChange(
                "approval-status",
                ChangeOperation.ADD,
                null,
                String.valueOf(response.approved()),
                "Request " + (response.approved() ? "approved" : "rejected")));

        changes.add(new ApprovalChange(
                "approval-action",
                ChangeOperation.ADD,
                null,
                response.action().label(),
                "Action taken: " + response.action().label()));

        ApprovalState base = previousState != null ? previousState : ApprovalState.initial();
        String summary = changes.stream().map(ApprovalChange::description).collect(Collectors.joining(", "));
        return new ApprovalDiff(diffType(response), previousState, base.apply(response), changes, summary);
    }

    static DiffType diffType(ApprovalResponse response) {
        if (response.action() == ApprovalAction.TRUST) {
            return DiffType.TRUST_CHANGE;
        }
        return response.approved() ? DiffType.APPROVAL : DiffType.REJECTION;
    }

    static List<String> autoTags(ApprovalResponse response) {
        List<String> tags = new ArrayList<>();
        tags.add(response.action().label());
        tags.add(response.approved() ? "approved" : "rejected");
        if (response.quickDecision()) {
            tags.add("quick-decision");
        }
        if (response.trustRank() != null) {
            tags.add("trust-" + response.trustRank().label());
        }
        return tags;
    }

    static RiskLevel inferRiskLevel(String comment) {
        String text = comment != null ? comment.toLowerCase(Locale.ROOT) : "";
        if (text.contains("critical") || text.contains("security")) {
            return RiskLevel.CRITICAL;
        }
        if (text.contains("high")) {
            return RiskLevel.HIGH;
        }
        if (text.contains("medium")) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    static ApprovalCategory inferCategory(String comment) {
        String text = comment != null ? comment.toLowerCase(Locale.ROOT) : "";
        if (text.contains("security")) {
            return ApprovalCategory.SECURITY;
        }
        if (text.contains("architecture")) {
            return ApprovalCategory.ARCHITECTURE;
        }
        if (text.contains("performance")) {
            return ApprovalCategory.PERFORMANCE;
        }
        if (text.contains("refactor")) {
            return ApprovalCategory.REFACTORING;
        }
        return ApprovalCategory.IMPLEMENTATION;
    }

    /**
     * See {@link CommitGraph#findCommonAncestor}.
     */
    public Optional<String> findCommonAncestor(String a, String b, Map<String, Commit> commits) {
        return CommitGraph.findCommonAncestor(a, b, commits);
    }

    /**
     * Render a commit the way {@code git log} does.
     */
    public static String format(Commit commit, boolean oneline, boolean showDiff, boolean showTags) {
        CommitMetadata meta = commit.metadata();
        if (oneline) {
            return commit.shortId() + " " + meta.subject();
        }

        StringBuilder sb = new StringBuilder();
        sb.append("commit ").append(commit.id()).append('\n');
        if (!commit.parentIds().isEmpty()) {
            sb.append(commit.isMerge() ? "Parents: " : "Parent: ")
              .append(String.join(" ", commit.parentIds())).append('\n');
        }
        sb.append("Author: ").append(meta.author()).append(" <").append(meta.email()).append(">\n");
        sb.append("Date: ").append(meta.timestamp()).append('\n');
        if (showTags && !meta.tags().isEmpty()) {
            sb.append("Tags: ").append(String.join(", ", meta.tags())).append('\n');
        }
        sb.append("Risk: ").append(meta.riskLevel().label())
          .append(", Category: ").append(meta.category().label()).append('\n');
        sb.append('\n');
        sb.append("    ").append(meta.message().replace("\n", "\n    "));

        if (showDiff) {
            sb.append("\n\nChanges:");
            for (ApprovalChange change : commit.diff().changes()) {
                sb.append("\n    ").append(change.operation().label()).append(": ").append(change.description());
            }
        }
        return sb.toString();
    }

    private static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}

package com.gatekeeper.history;

import com.gatekeeper.core.error.ConflictException;
import com.gatekeeper.core.error.NotFoundException;
import com.gatekeeper.core.error.StateException;
import com.gatekeeper.core.events.EventBus;
import com.gatekeeper.core.events.EventTypes;
import com.gatekeeper.core.logging.MdcContext;
import com.gatekeeper.core.metrics.GatekeeperMetrics;
import com.gatekeeper.core.model.ApprovalAction;
import com.gatekeeper.core.model.ApprovalCategory;
import com.gatekeeper.core.model.ApprovalResponse;
import com.gatekeeper.core.model.RiskLevel;
import com.gatekeeper.history.model.ApprovalState;
import com.gatekeeper.history.model.Author;
import com.gatekeeper.history.model.Branch;
import com.gatekeeper.history.model.BranchFilter;
import com.gatekeeper.history.model.Commit;
import com.gatekeeper.history.model.CommitMetadata;
import com.gatekeeper.history.model.LogFilter;
import com.gatekeeper.history.model.MergeRequest;
import com.gatekeeper.history.model.MergeRequestStatus;
import com.gatekeeper.history.model.RepositorySnapshot;
import com.gatekeeper.history.model.RepositoryStatistics;
import com.gatekeeper.history.model.Review;
import com.gatekeeper.history.model.ReviewStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Git-like store for approval decisions: a commit DAG plus branches, tags and merge requests.
 * <p>
 * Commits, branches and merge requests live in id-indexed maps and reference each other by id.
 * Every public method is synchronized on the store; mutating operations validate all their
 * inputs before changing anything, so a failed call leaves the repository untouched.
 */
@Service
public class HistoryStore {

    private static final Logger log = LoggerFactory.getLogger(HistoryStore.class);

    private static final int MIN_PREFIX_LENGTH = 4;

    private final CommitFactory commitFactory;
    private final HistoryProperties properties;
    private final EventBus eventBus;
    private final GatekeeperMetrics metrics;
    private final Clock clock;

    private String repositoryId;
    private String repositoryName;
    private String defaultBranch;
    private String currentBranch;
    private final Map<String, Branch> branches = new LinkedHashMap<>();
    private final Map<String, Commit> commits = new LinkedHashMap<>();
    private final Map<String, String> tags = new LinkedHashMap<>();
    private final Map<String, MergeRequest> mergeRequests = new LinkedHashMap<>();
    private Instant createdAt;
    private Instant lastActivity;

    public HistoryStore(CommitFactory commitFactory,
                        HistoryProperties properties,
                        EventBus eventBus,
                        GatekeeperMetrics metrics,
                        Clock clock) {
        this.commitFactory = commitFactory;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        initialize();
    }

    private void initialize() {
        Instant now = clock.instant();
        repositoryId = UUID.randomUUID().toString();
        repositoryName = properties.getRepositoryName();
        defaultBranch = properties.getDefaultBranch();
        currentBranch = defaultBranch;
        branches.clear();
        commits.clear();
        tags.clear();
        mergeRequests.clear();
        branches.put(defaultBranch, Branch.empty(defaultBranch, true, now));
        createdAt = now;
        lastActivity = now;
    }

    // -- commits --------------------------------------------------------------

    public synchronized Commit createCommit(ApprovalResponse response) {
        return createCommit(response, null, null, null, null);
    }

    public synchronized Commit createCommit(ApprovalResponse response, String message) {
        return createCommit(response, message, null, null, null);
    }

    /**
     * Append a decision to the current branch. The parent is the current head, if any, and the
     * previous state is the head commit's resulting state.
     *
     * @param author    null for the configured default author
     * @param riskLevel null to infer from the response comment
     * @param category  null to infer from the response comment
     */
    public synchronized Commit createCommit(ApprovalResponse response, String message, Author author,
                                            RiskLevel riskLevel, ApprovalCategory category) {
        Branch branch = currentBranchOrThrow();
        Commit commit = buildOnHead(branch, response, message, author, riskLevel, category);

        MdcContext.setBranch(branch.name());
        try {
            Instant now = clock.instant();
            commits.put(commit.id(), commit);
            branches.put(branch.name(), branch.advance(commit.id(), List.of(commit.id()), now));
            lastActivity = now;

            metrics.recordCommit(branch.name());
            log.info("[{} {}] {}", branch.name(), commit.shortId(), commit.metadata().subject());
            eventBus.publish(EventTypes.COMMIT_CREATED, branch.name(),
                    Map.of("commit", commit, "branch", branch.name()));
            return commit;
        } finally {
            MdcContext.clear();
        }
    }

    private Commit buildOnHead(Branch branch, ApprovalResponse response, String message, Author author,
                               RiskLevel riskLevel, ApprovalCategory category) {
        List<String> parents = branch.head() != null ? List.of(branch.head()) : List.of();
        return commitFactory.create(response, parents, author != null ? author : defaultAuthor(),
                message, headState(branch), riskLevel, category);
    }

    /**
     * Look up a commit by full id, tag name or unique id prefix (at least four characters).
     *
     * @throws NotFoundException if nothing matches
     * @throws ConflictException if the prefix matches more than one commit
     */
    public synchronized Commit getCommit(String ref) {
        Commit exact = commits.get(ref);
        if (exact != null) {
            return exact;
        }
        String tagged = tags.get(ref);
        if (tagged != null) {
            return commits.get(tagged);
        }
        if (ref != null && ref.length() >= MIN_PREFIX_LENGTH) {
            List<Commit> matches = commits.values().stream()
                    .filter(c -> c.id().startsWith(ref))
                    .toList();
            if (matches.size() == 1) {
                return matches.get(0);
            }
            if (matches.size() > 1) {
                throw new ConflictException("Commit prefix '" + ref + "' is ambiguous (" + matches.size() + " matches)");
            }
        }
        throw NotFoundException.commit(ref);
    }

    // -- branches -------------------------------------------------------------

    public synchronized Branch createBranch(String name) {
        return createBranch(name, null);
    }

    /**
     * @param baseCommit commit to branch from; null means the current head (possibly empty)
     * @throws ConflictException if the name is taken
     * @throws NotFoundException if the base commit does not exist
     */
    public synchronized Branch createBranch(String name, String baseCommit) {
        if (name == null || name.isBlank()) {
            throw new StateException("Branch name must not be blank");
        }
        if (branches.containsKey(name)) {
            throw new ConflictException("Branch '" + name + "' already exists");
        }
        String base = baseCommit != null ? resolveCommitId(baseCommit) : currentBranchOrThrow().head();

        Instant now = clock.instant();
        Branch branch = new Branch(
                name,
                base,
                base,
                base != null ? CommitGraph.firstParentChain(base, commits) : List.of(),
                List.of(),
                properties.getProtectedBranches().contains(name),
                now,
                now);
        branches.put(name, branch);
        lastActivity = now;

        log.info("Created branch {} at {}", name, base != null ? base : "(empty)");
        eventBus.publish(EventTypes.BRANCH_CREATED, name, Map.of("branch", branch));
        return branch;
    }

    public synchronized Branch checkoutBranch(String name) {
        Branch branch = getBranch(name);
        currentBranch = name;
        log.info("Switched to branch {}", name);
        return branch;
    }

    /**
     * @throws ConflictException for the default branch (even with force), a protected branch
     *                           without force, or a branch with unmerged commits without force
     * @throws NotFoundException if the branch does not exist
     */
    public synchronized void deleteBranch(String name, boolean force) {
        if (name.equals(defaultBranch)) {
            throw new ConflictException("Cannot delete the default branch '" + name + "'");
        }
        Branch branch = getBranch(name);
        if (branch.protectedBranch() && !force) {
            throw new ConflictException("Branch '" + name + "' is protected. Use force to delete.");
        }
        if (!force && hasUnmergedChanges(branch)) {
            throw new ConflictException("Branch '" + name + "' has unmerged changes. Use force to delete.");
        }

        branches.remove(name);
        if (name.equals(currentBranch)) {
            currentBranch = defaultBranch;
        }
        lastActivity = clock.instant();
        log.info("Deleted branch {}{}", name, force ? " (forced)" : "");
        eventBus.publish(EventTypes.BRANCH_DELETED, name, Map.of("name", name));
    }

    public synchronized Branch protectBranch(String name, boolean protect) {
        Branch updated = getBranch(name).withProtected(protect);
        branches.put(name, updated);
        log.info("Branch {} is now {}", name, protect ? "protected" : "unprotected");
        return updated;
    }

    public synchronized Branch getBranch(String name) {
        Branch branch = branches.get(name);
        if (branch == null) {
            throw NotFoundException.branch(name);
        }
        return branch;
    }

    public synchronized Branch getCurrentBranch() {
        return currentBranchOrThrow();
    }

    public synchronized String getDefaultBranch() {
        return defaultBranch;
    }

    /**
     * Branches ordered by most recent activity first.
     */
    public synchronized List<Branch> listBranches(BranchFilter filter) {
        List<Branch> result = new ArrayList<>(branches.values());
        if (filter.mergedOnly()) {
            result.removeIf(b -> b.name().equals(defaultBranch) || !isBranchMerged(b));
        }
        result.sort(Comparator.comparing(Branch::lastActivity).reversed());
        return result;
    }

    // -- merge requests -------------------------------------------------------

    /**
     * @throws StateException if either branch does not exist
     */
    public synchronized MergeRequest createMergeRequest(String title, String description,
                                                       String sourceBranch, String targetBranch, String author) {
        Branch source = branches.get(sourceBranch);
        Branch target = branches.get(targetBranch);
        if (source == null || target == null) {
            throw new StateException("Source or target branch does not exist");
        }

        Instant now = clock.instant();
        MergeRequest request = new MergeRequest(
                UUID.randomUUID().toString(),
                title,
                description,
                sourceBranch,
                targetBranch,
                CommitGraph.commitsBetween(source.baseCommit(), source.head(), commits),
                List.of(),
                MergeRequestStatus.PENDING,
                author,
                now,
                now,
                null,
                null);
        mergeRequests.put(request.id(), request);
        branches.put(sourceBranch, source.withMergeRequest(request.id(), now));
        lastActivity = now;

        log.info("Opened merge request {} ({} -> {})", request.id(), sourceBranch, targetBranch);
        eventBus.publish(EventTypes.MERGE_REQUEST_CREATED, sourceBranch, Map.of("mergeRequest", request));
        return request;
    }

    /**
     * Add a review. An approving review moves the request to approved; a changes-requested
     * review moves it to rejected; comments leave the status unchanged.
     *
     * @throws StateException if the request is already merged or closed
     */
    public synchronized MergeRequest reviewMergeRequest(String mergeRequestId, String reviewer,
                                                       ReviewStatus status, String comment) {
        MergeRequest request = getMergeRequest(mergeRequestId);
        if (!request.status().isOpen() && request.status() != MergeRequestStatus.REJECTED) {
            throw new StateException("Merge request " + mergeRequestId + " is " + request.status().label());
        }

        Instant now = clock.instant();
        MergeRequestStatus newStatus = switch (status) {
            case APPROVED -> MergeRequestStatus.APPROVED;
            case CHANGES_REQUESTED -> MergeRequestStatus.REJECTED;
            case PENDING, COMMENTED -> request.status();
        };
        Review review = new Review(UUID.randomUUID().toString(), reviewer, status, comment, now);
        MergeRequest updated = request.withReview(review, newStatus, now);
        mergeRequests.put(updated.id(), updated);

        eventBus.publish(EventTypes.MERGE_REQUEST_UPDATED, updated.sourceBranch(), Map.of("mergeRequest", updated));
        return updated;
    }

    public synchronized MergeRequest closeMergeRequest(String mergeRequestId) {
        MergeRequest request = getMergeRequest(mergeRequestId);
        if (request.status() == MergeRequestStatus.MERGED || request.status() == MergeRequestStatus.CLOSED) {
            throw new StateException("Merge request " + mergeRequestId + " is already " + request.status().label());
        }
        MergeRequest closed = request.closed(clock.instant());
        mergeRequests.put(closed.id(), closed);
        eventBus.publish(EventTypes.MERGE_REQUEST_UPDATED, closed.sourceBranch(), Map.of("mergeRequest", closed));
        return closed;
    }

    public synchronized MergeRequest getMergeRequest(String mergeRequestId) {
        MergeRequest request = mergeRequests.get(mergeRequestId);
        if (request == null) {
            throw NotFoundException.mergeRequest(mergeRequestId);
        }
        return request;
    }

    public synchronized List<MergeRequest> getMergeRequests() {
        return List.copyOf(mergeRequests.values());
    }

    // -- merge / revert -------------------------------------------------------

    public synchronized Commit mergeBranch(String sourceBranch, String targetBranch) {
        return mergeBranch(sourceBranch, targetBranch, null);
    }

    /**
     * Record a merge commit on the target with parents {@code [targetHead, sourceHead]} (empty heads
     * dropped). The target's path gains the source-only commits followed by the merge commit.
     * Pending or approved merge requests for the same pair are marked merged.
     *
     * @throws StateException if either branch is missing or source and target are the same
     */
    public synchronized Commit mergeBranch(String sourceBranch, String targetBranch, String message) {
        Branch source = branches.get(sourceBranch);
        Branch target = branches.get(targetBranch);
        if (source == null || target == null) {
            throw new StateException("Source or target branch does not exist");
        }
        if (sourceBranch.equals(targetBranch)) {
            throw new StateException("Cannot merge branch '" + sourceBranch + "' into itself");
        }

        MdcContext.setBranch(targetBranch);
        try {
            Instant now = clock.instant();
            String mergeMessage = message != null && !message.isBlank()
                    ? message
                    : "Merge branch '" + sourceBranch + "' into '" + targetBranch + "'";
            ApprovalResponse mergeResponse = ApprovalResponse.of("merge-" + UUID.randomUUID(),
                    ApprovalAction.APPROVE, mergeMessage, null, now, false);

            List<String> parents = new ArrayList<>();
            if (target.head() != null) {
                parents.add(target.head());
            }
            if (source.head() != null) {
                parents.add(source.head());
            }
            Commit mergeCommit = commitFactory.create(mergeResponse, parents, defaultAuthor(), mergeMessage,
                    headState(target), RiskLevel.LOW, null);

            List<String> appended = new ArrayList<>();
            for (String id : source.path()) {
                if (!target.contains(id)) {
                    appended.add(id);
                }
            }
            appended.add(mergeCommit.id());

            commits.put(mergeCommit.id(), mergeCommit);
            branches.put(targetBranch, target.advance(mergeCommit.id(), appended, now));
            lastActivity = now;

            for (MergeRequest request : List.copyOf(mergeRequests.values())) {
                if (request.targets(sourceBranch, targetBranch) && request.status().isMergeable()) {
                    MergeRequest merged = request.merged(now);
                    mergeRequests.put(merged.id(), merged);
                    eventBus.publish(EventTypes.MERGE_REQUEST_UPDATED, sourceBranch, Map.of("mergeRequest", merged));
                }
            }

            metrics.recordMerge(targetBranch);
            log.info("Merged {} into {} as {}", sourceBranch, targetBranch, mergeCommit.shortId());
            eventBus.publish(EventTypes.MERGE_COMPLETED, targetBranch, Map.of(
                    "sourceBranch", sourceBranch,
                    "targetBranch", targetBranch,
                    "mergeCommit", mergeCommit));
            return mergeCommit;
        } finally {
            MdcContext.clear();
        }
    }

    public synchronized Commit revertCommit(String commitId) {
        return revertCommit(commitId, false, null);
    }

    /**
     * Record the opposite of an earlier decision on the current branch.
     *
     * @param noCommit build and return the revert commit without storing it
     * @param message  null for {@code Revert "<original message>"}
     * @throws NotFoundException if the commit does not exist
     */
    public synchronized Commit revertCommit(String commitId, boolean noCommit, String message) {
        Commit original = getCommit(commitId);
        String revertMessage = "Revert \"" + original.metadata().message() + "\"";

        ApprovalResponse revert = ApprovalResponse.of(
                "revert-" + original.response().requestId(),
                original.response().approved() ? ApprovalAction.REJECT : ApprovalAction.APPROVE,
                revertMessage,
                null,
                clock.instant(),
                false);
        String effectiveMessage = message != null && !message.isBlank() ? message : revertMessage;

        if (noCommit) {
            return buildOnHead(currentBranchOrThrow(), revert, effectiveMessage, null,
                    original.metadata().riskLevel(), original.metadata().category());
        }
        return createCommit(revert, effectiveMessage, null,
                original.metadata().riskLevel(), original.metadata().category());
    }

    // -- tags -----------------------------------------------------------------

    /**
     * @param commitId null to tag the current head
     * @throws ConflictException if the tag exists and force is not set
     * @throws StateException    if no commit is given and the current branch is empty
     * @throws NotFoundException if the commit does not exist
     */
    public synchronized void createTag(String name, String commitId, boolean force) {
        if (tags.containsKey(name) && !force) {
            throw new ConflictException("Tag '" + name + "' already exists. Use force to overwrite.");
        }
        String target = commitId != null ? commitId : currentBranchOrThrow().head();
        if (target == null) {
            throw new StateException("No commit to tag");
        }
        String resolved = resolveCommitId(target);

        tags.put(name, resolved);
        lastActivity = clock.instant();
        log.info("Tagged {} as {}", resolved, name);
        eventBus.publish(EventTypes.TAG_CREATED, name, Map.of("name", name, "commitId", resolved));
    }

    public synchronized void deleteTag(String name) {
        if (tags.remove(name) == null) {
            throw NotFoundException.tag(name);
        }
        lastActivity = clock.instant();
        log.info("Deleted tag {}", name);
    }

    public synchronized Map<String, String> getTags() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    // -- queries --------------------------------------------------------------

    /**
     * Commits matching every set filter, newest first.
     *
     * @throws NotFoundException if the filter names an unknown branch
     */
    public synchronized List<Commit> getLog(LogFilter filter) {
        List<Commit> result = new ArrayList<>(commits.values());
        // Reverse insertion order so that equal timestamps still list the latest commit first
        Collections.reverse(result);

        if (filter.branch() != null) {
            Branch branch = getBranch(filter.branch());
            result.removeIf(c -> !branch.contains(c.id()));
        }
        if (filter.author() != null) {
            String needle = filter.author().toLowerCase();
            result.removeIf(c -> !c.metadata().author().toLowerCase().contains(needle));
        }
        if (filter.since() != null) {
            result.removeIf(c -> c.metadata().timestamp().isBefore(filter.since()));
        }
        if (filter.until() != null) {
            result.removeIf(c -> c.metadata().timestamp().isAfter(filter.until()));
        }
        if (filter.grep() != null) {
            Pattern pattern = Pattern.compile(filter.grep(), Pattern.CASE_INSENSITIVE);
            result.removeIf(c -> !pattern.matcher(c.metadata().message()).find());
        }

        result.sort(Comparator.comparing((Commit c) -> c.metadata().timestamp()).reversed());
        if (filter.limit() > 0 && result.size() > filter.limit()) {
            return List.copyOf(result.subList(0, filter.limit()));
        }
        return List.copyOf(result);
    }

    public synchronized Optional<String> findCommonAncestor(String a, String b) {
        return commitFactory.findCommonAncestor(resolveCommitId(a), resolveCommitId(b), commits);
    }

    public synchronized RepositoryStatistics getStatistics() {
        Instant now = clock.instant();
        Instant lastWeek = now.minus(Duration.ofDays(7));
        Instant lastMonth = now.minus(Duration.ofDays(30));

        int commitsLastWeek = 0;
        int commitsLastMonth = 0;
        int rejected = 0;
        Map<String, Integer> contributorActivity = new LinkedHashMap<>();
        Map<String, Integer> riskDistribution = new LinkedHashMap<>();
        Map<String, Integer> categoryDistribution = new LinkedHashMap<>();

        for (Commit commit : commits.values()) {
            Instant ts = commit.metadata().timestamp();
            if (!ts.isBefore(lastWeek)) commitsLastWeek++;
            if (!ts.isBefore(lastMonth)) commitsLastMonth++;
            if (!commit.response().approved()) rejected++;
            contributorActivity.merge(commit.metadata().author(), 1, Integer::sum);
            riskDistribution.merge(commit.metadata().riskLevel().label(), 1, Integer::sum);
            categoryDistribution.merge(commit.metadata().category().label(), 1, Integer::sum);
        }

        double averageTimeToMerge = mergeRequests.values().stream()
                .filter(mr -> mr.mergedAt() != null)
                .mapToLong(mr -> Duration.between(mr.createdAt(), mr.mergedAt()).toMillis())
                .average()
                .orElse(0.0);

        String mostActive = contributorActivity.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse("N/A");

        return new RepositoryStatistics(
                new RepositoryStatistics.Totals(commits.size(), branches.size(), mergeRequests.size(), tags.size()),
                new RepositoryStatistics.Activity(commitsLastWeek, commitsLastMonth, averageTimeToMerge),
                new RepositoryStatistics.Contributors(contributorActivity.size(), mostActive, contributorActivity),
                new RepositoryStatistics.Risk(riskDistribution, categoryDistribution,
                        commits.isEmpty() ? 0.0 : (double) rejected / commits.size()));
    }

    // -- export / import ------------------------------------------------------

    public synchronized RepositorySnapshot exportRepository() {
        return new RepositorySnapshot(
                repositoryId,
                repositoryName,
                defaultBranch,
                currentBranch,
                List.copyOf(branches.values()),
                List.copyOf(commits.values()),
                new LinkedHashMap<>(tags),
                List.copyOf(mergeRequests.values()),
                createdAt,
                lastActivity);
    }

    /**
     * Replace the whole repository with a snapshot. The snapshot is checked for dangling
     * references first; on failure the current state is kept.
     *
     * @throws StateException if the snapshot is inconsistent
     */
    public synchronized void importRepository(RepositorySnapshot snapshot) {
        Map<String, Commit> importedCommits = new LinkedHashMap<>();
        for (Commit commit : snapshot.commits()) {
            importedCommits.put(commit.id(), commit);
        }
        for (Commit commit : importedCommits.values()) {
            CommitMetadata meta = commit.metadata();
            if (commit.response() == null || meta == null || meta.timestamp() == null || meta.author() == null
                    || meta.riskLevel() == null || meta.category() == null) {
                throw new StateException("Commit " + commit.id() + " has incomplete metadata");
            }
            for (String parent : commit.parentIds()) {
                if (!importedCommits.containsKey(parent)) {
                    throw new StateException("Commit " + commit.id() + " has unknown parent " + parent);
                }
            }
        }
        Map<String, Branch> importedBranches = new LinkedHashMap<>();
        for (Branch branch : snapshot.branches()) {
            if (branch.head() != null && !importedCommits.containsKey(branch.head())) {
                throw new StateException("Branch '" + branch.name() + "' points at unknown commit " + branch.head());
            }
            if (branch.baseCommit() != null && !importedCommits.containsKey(branch.baseCommit())) {
                throw new StateException("Branch '" + branch.name() + "' starts from unknown commit "
                        + branch.baseCommit());
            }
            for (String id : branch.path()) {
                if (!importedCommits.containsKey(id)) {
                    throw new StateException("Branch '" + branch.name() + "' lists unknown commit " + id);
                }
            }
            importedBranches.put(branch.name(), branch);
        }
        if (!importedBranches.containsKey(snapshot.defaultBranch())) {
            throw new StateException("Snapshot is missing its default branch '" + snapshot.defaultBranch() + "'");
        }
        for (Map.Entry<String, String> tag : snapshot.tags().entrySet()) {
            if (!importedCommits.containsKey(tag.getValue())) {
                throw new StateException("Tag '" + tag.getKey() + "' points at unknown commit " + tag.getValue());
            }
        }

        repositoryId = snapshot.id();
        repositoryName = snapshot.name();
        defaultBranch = snapshot.defaultBranch();
        currentBranch = importedBranches.containsKey(snapshot.currentBranch())
                ? snapshot.currentBranch()
                : snapshot.defaultBranch();
        branches.clear();
        branches.putAll(importedBranches);
        commits.clear();
        commits.putAll(importedCommits);
        tags.clear();
        tags.putAll(new TreeMap<>(snapshot.tags()));
        mergeRequests.clear();
        for (MergeRequest request : snapshot.mergeRequests()) {
            mergeRequests.put(request.id(), request);
        }
        createdAt = snapshot.createdAt();
        lastActivity = snapshot.lastActivity();
        log.debug("Imported repository {} ({} commits, {} branches)", repositoryName, commits.size(), branches.size());
    }

    // -- internals ------------------------------------------------------------

    private Branch currentBranchOrThrow() {
        Branch branch = branches.get(currentBranch);
        if (branch == null) {
            throw NotFoundException.branch(currentBranch);
        }
        return branch;
    }

    private ApprovalState headState(Branch branch) {
        if (branch.head() == null) {
            return null;
        }
        Commit head = commits.get(branch.head());
        return head != null ? head.diff().after() : null;
    }

    private String resolveCommitId(String ref) {
        return getCommit(ref).id();
    }

    private boolean hasUnmergedChanges(Branch branch) {
        Branch main = branches.get(defaultBranch);
        for (String id : branch.path()) {
            if (main == null || !main.contains(id)) {
                return true;
            }
        }
        return false;
    }

    private boolean isBranchMerged(Branch branch) {
        Branch main = branches.get(defaultBranch);
        return branch.head() != null && main != null && main.contains(branch.head());
    }

    private Author defaultAuthor() {
        return new Author(properties.getAuthorName(), properties.getAuthorEmail());
    }
}

package com.gatekeeper.core.approval;

import com.gatekeeper.core.error.ConflictException;
import com.gatekeeper.core.error.NotFoundException;
import com.gatekeeper.core.error.StateException;
import com.gatekeeper.core.events.EventBus;
import com.gatekeeper.core.events.EventTypes;
import com.gatekeeper.core.logging.MdcContext;
import com.gatekeeper.core.metrics.GatekeeperMetrics;
import com.gatekeeper.core.model.ApprovalAction;
import com.gatekeeper.core.model.ApprovalCategory;
import com.gatekeeper.core.model.ApprovalRequest;
import com.gatekeeper.core.model.ApprovalResponse;
import com.gatekeeper.core.model.ApprovalStatistics;
import com.gatekeeper.core.model.AuditEntry;
import com.gatekeeper.core.model.ProposedAction;
import com.gatekeeper.core.model.RequestState;
import com.gatekeeper.core.model.RiskAssessmentResult;
import com.gatekeeper.core.model.RiskLevel;
import com.gatekeeper.core.model.TaskContext;
import com.gatekeeper.core.model.TrustRank;
import com.gatekeeper.core.model.TrustSettings;
import com.gatekeeper.core.policy.CategoryClassifier;
import com.gatekeeper.core.policy.CategorySuggestion;
import com.gatekeeper.core.policy.TrustPolicy;
import com.gatekeeper.core.risk.RiskAssessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Orchestrates the lifecycle of approval requests.
 * <p>
 * Each request is scored by the {@link RiskAssessor}, checked against the {@link TrustPolicy},
 * and either auto-resolved on the spot or parked in the pending table until a human responds,
 * the low-risk timeout fires, or the caller cancels. After every response the learning counters
 * are updated and the trust rank may advance one step.
 * <p>
 * The pending table is a concurrent map: inserts use {@code putIfAbsent} and responses remove the
 * entry before doing anything else, so each request is answered exactly once.
 */
@Service
public class ApprovalCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ApprovalCoordinator.class);

    static final String REASON_DISABLED = "System disabled";
    static final String REASON_LOW_RISK = "Low risk - auto-approved";
    static final String REASON_TRUST_LEVEL = "Auto-approved based on trust level";
    static final String REASON_TIMEOUT = "Timeout auto-approval";

    private record PendingEntry(
        ApprovalRequest request,
        ApprovalHandle handle,
        ScheduledFuture<?> timer
    ) {}

    private final RiskAssessor riskAssessor;
    private final TrustPolicy trustPolicy;
    private final CategoryClassifier categoryClassifier;
    private final EventBus eventBus;
    private final GatekeeperMetrics metrics;
    private final ApprovalProperties properties;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    private final ConcurrentHashMap<String, PendingEntry> pendingRequests = new ConcurrentHashMap<>();
    // Guards the capacity check together with the insert; removals need no lock
    private final Object pendingLock = new Object();
    private final List<AuditEntry> auditTrail = new ArrayList<>();

    private final Object trustLock = new Object();
    private TrustRank currentRank;
    private int successfulTasks;
    private int totalApprovals;
    private int automaticApprovals;
    private int userSatisfaction;
    private int errorsEncountered;

    public ApprovalCoordinator(RiskAssessor riskAssessor,
                               TrustPolicy trustPolicy,
                               CategoryClassifier categoryClassifier,
                               EventBus eventBus,
                               GatekeeperMetrics metrics,
                               ApprovalProperties properties,
                               Clock clock,
                               ScheduledExecutorService approvalTimeoutScheduler) {
        this.riskAssessor = riskAssessor;
        this.trustPolicy = trustPolicy;
        this.categoryClassifier = categoryClassifier;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        this.scheduler = approvalTimeoutScheduler;
        this.currentRank = properties.getDefaultTrustRank();
    }

    public ApprovalHandle requestApproval(TaskContext context, List<ProposedAction> actions) {
        return requestApproval(context, actions, ApprovalOptions.none());
    }

    /**
     * Main entry point. Returns immediately; the handle's future completes once the request resolves.
     *
     * @throws StateException    if the configured maximum of pending requests is reached
     * @throws ConflictException if the generated id is already pending
     */
    public ApprovalHandle requestApproval(TaskContext context, List<ProposedAction> actions, ApprovalOptions options) {
        if (!properties.isEnabled()) {
            ApprovalHandle handle = new ApprovalHandle(autoRequestId(), null);
            resolveAutomatically(handle, REASON_DISABLED, null, null, null);
            return handle;
        }

        CategorySuggestion suggestion = categoryClassifier.classify(context);
        ApprovalCategory category = options.category() != null
                ? options.category()
                : suggestion.category().orElse(null);

        RiskAssessmentResult assessment = riskAssessor.assess(context, actions, category);
        metrics.recordRiskAssessment(assessment.overallRisk().label(), assessment.overallScore());
        log.info("Assessed {} actions for '{}': risk={} score={} requiresApproval={} autoEligible={}",
                actions.size(), context.intent(), assessment.overallRisk(),
                String.format("%.2f", assessment.overallScore()),
                assessment.requiresApproval(), assessment.autoApprovalEligible());

        if (!assessment.requiresApproval() && context.trustRank() != TrustRank.NOVICE) {
            ApprovalHandle handle = new ApprovalHandle(autoRequestId(), assessment);
            resolveAutomatically(handle, REASON_LOW_RISK, assessment, category, context);
            return handle;
        }

        if (assessment.autoApprovalEligible()
                && trustPolicy.canAutoApprove(assessment.overallRisk(), context.trustRank())) {
            ApprovalHandle handle = new ApprovalHandle(autoRequestId(), assessment);
            resolveAutomatically(handle, REASON_TRUST_LEVEL, assessment, category, context);
            return handle;
        }

        return enqueue(context, actions, suggestion, category, assessment);
    }

    /**
     * Record a human decision for a pending request.
     *
     * @param newTrustRank rank to grant with a {@link ApprovalAction#TRUST} action; ignored otherwise
     * @throws NotFoundException if the id is not pending (never created, or already resolved)
     */
    public ApprovalResponse respond(String requestId, ApprovalAction action, String comment,
                                    TrustRank newTrustRank, boolean quickDecision) {
        PendingEntry entry = pendingRequests.remove(requestId);
        if (entry == null) {
            throw NotFoundException.request(requestId);
        }

        MdcContext.setRequest(requestId);
        try {
            cancelTimer(entry);

            ApprovalResponse response = ApprovalResponse.of(requestId, action, comment,
                    action == ApprovalAction.TRUST ? newTrustRank : null,
                    clock.instant(), quickDecision);

            if (action == ApprovalAction.TRUST && newTrustRank != null) {
                updateTrustRank(newTrustRank, "User granted trust");
            }

            if (properties.isAuditTrailEnabled()) {
                recordAuditEntry(entry.request(), response);
            }
            if (properties.isLearningEnabled()) {
                updateLearningMetrics(response);
            }

            entry.handle().transition(RequestState.RESPONDED);
            long decisionMs = Duration.between(entry.request().createdAt(), response.timestamp()).toMillis();
            metrics.recordDecisionLatency(Math.max(0, decisionMs));
            metrics.recordDecision(response.approved() ? "approved" : "rejected");
            log.info("Request {} answered with {} (approved={})", requestId, action, response.approved());

            eventBus.publish(EventTypes.REQUEST_RESPONDED, requestId,
                    Map.of("request", entry.request(), "response", response));
            entry.handle().response().complete(response);
            entry.handle().transition(RequestState.CLOSED);
            return response;
        } finally {
            MdcContext.clear();
        }
    }

    public ApprovalResponse respond(String requestId, ApprovalAction action, String comment) {
        return respond(requestId, action, comment, null, false);
    }

    /**
     * Withdraw a pending request, e.g. when the caller disconnects. Releases the table entry,
     * notifies listeners and cancels the handle's future; counters and trust are untouched.
     *
     * @throws NotFoundException if the id is not pending
     */
    public void cancel(String requestId) {
        PendingEntry entry = pendingRequests.remove(requestId);
        if (entry == null) {
            throw NotFoundException.request(requestId);
        }
        cancelTimer(entry);
        entry.handle().transition(RequestState.CANCELLED);
        metrics.recordDecision("cancelled");
        log.info("Request {} cancelled", requestId);
        eventBus.publish(EventTypes.REQUEST_CANCELLED, requestId, Map.of("request", entry.request()));
        entry.handle().response().cancel(false);
    }

    public Optional<ApprovalRequest> getPendingRequest(String requestId) {
        return Optional.ofNullable(pendingRequests.get(requestId)).map(PendingEntry::request);
    }

    /**
     * Pending requests, oldest first.
     */
    public List<ApprovalRequest> getAllPendingRequests() {
        return pendingRequests.values().stream()
                .map(PendingEntry::request)
                .sorted((a, b) -> a.createdAt().compareTo(b.createdAt()))
                .toList();
    }

    public TrustRank currentTrustRank() {
        synchronized (trustLock) {
            return currentRank;
        }
    }

    /**
     * Convenience for callers that track trust here rather than in their own session state.
     */
    public TaskContext contextFor(String intent) {
        return TaskContext.of(intent, currentTrustRank());
    }

    public TrustSettings getTrustSettings() {
        synchronized (trustLock) {
            return new TrustSettings(
                    currentRank,
                    trustPolicy.autoApprovalCategoriesFor(currentRank),
                    trustPolicy.requireApprovalCategoriesFor(currentRank),
                    new TrustSettings.LearningMetrics(successfulTasks, totalApprovals,
                            automaticApprovals, userSatisfaction, errorsEncountered));
        }
    }

    /**
     * Explicitly set the trust rank. Unlike automatic progression this may move the rank down.
     */
    public void updateTrustRank(TrustRank newRank, String reason) {
        changeRank(newRank, reason, false);
    }

    public ApprovalStatistics getApprovalStatistics() {
        List<AuditEntry> entries;
        synchronized (auditTrail) {
            entries = List.copyOf(auditTrail);
        }
        int automatic;
        synchronized (trustLock) {
            automatic = automaticApprovals;
        }
        int manual = (int) entries.stream().filter(e -> e.action().approves()).count();
        int rejections = (int) entries.stream().filter(e -> e.action() == ApprovalAction.REJECT).count();
        double avgDecision = entries.stream().mapToLong(AuditEntry::decisionTimeMs).average().orElse(0.0);
        return new ApprovalStatistics(entries.size() + automatic, automatic, manual, rejections, avgDecision);
    }

    public List<AuditEntry> getAuditTrail() {
        synchronized (auditTrail) {
            return List.copyOf(auditTrail);
        }
    }

    // -- internals ------------------------------------------------------------

    private ApprovalHandle enqueue(TaskContext context, List<ProposedAction> actions,
                                   CategorySuggestion suggestion, ApprovalCategory category,
                                   RiskAssessmentResult assessment) {
        ApprovalRequest request = new ApprovalRequest(
                UUID.randomUUID().toString(),
                suggestion.themeId(),
                context,
                actions,
                assessment.recommendations().isEmpty()
                        ? "No rationale provided"
                        : String.join(". ", assessment.recommendations()),
                assessment.overallRisk(),
                assessment.hasSecurityImpact(),
                category,
                clock.instant());

        ApprovalHandle handle = new ApprovalHandle(request.id(), assessment);
        MdcContext.setRequest(request.id());
        try {
            PendingEntry entry = new PendingEntry(request, handle, null);
            insertPending(entry);
            handle.transition(RequestState.PENDING);

            metrics.recordDecision("pending");
            log.info("Request {} pending approval (risk={}, theme={})",
                    request.id(), request.riskLevel(), request.themeId());
            eventBus.publish(EventTypes.REQUEST_CREATED, request.id(),
                    Map.of("request", request, "assessment", assessment));

            Duration timeout = properties.getAutoApprovalTimeout();
            if (timeout != null && !timeout.isZero() && !timeout.isNegative()
                    && assessment.overallRisk() == RiskLevel.LOW) {
                ScheduledFuture<?> timer = scheduler.schedule(
                        () -> onTimeout(request.id()), timeout.toMillis(), TimeUnit.MILLISECONDS);
                // Replace only if the request has not already been answered in the meantime
                if (!pendingRequests.replace(request.id(), entry, new PendingEntry(request, handle, timer))) {
                    timer.cancel(false);
                }
            }
            return handle;
        } finally {
            MdcContext.clear();
        }
    }

    private void insertPending(PendingEntry entry) {
        String id = entry.request().id();
        int max = properties.getMaxPendingApprovals();
        synchronized (pendingLock) {
            if (max > 0 && pendingRequests.size() >= max) {
                throw new StateException("Too many pending approvals (maximum " + max + ")");
            }
            if (pendingRequests.putIfAbsent(id, entry) != null) {
                throw new ConflictException("Approval request " + id + " is already pending");
            }
        }
    }

    void onTimeout(String requestId) {
        PendingEntry entry = pendingRequests.remove(requestId);
        if (entry == null) {
            return;
        }
        MdcContext.setRequest(requestId);
        try {
            entry.handle().transition(RequestState.TIMED_OUT);
            ApprovalResponse response = ApprovalResponse.of(requestId, ApprovalAction.APPROVE,
                    REASON_TIMEOUT, null, clock.instant(), true);
            incrementAutomaticApprovals();
            metrics.recordDecision("timed_out");
            log.info("Request {} timed out; auto-approving", requestId);

            eventBus.publish(EventTypes.REQUEST_TIMED_OUT, requestId,
                    Map.of("request", entry.request(), "response", response));
            entry.handle().transition(RequestState.AUTO_RESOLVED);
            entry.handle().response().complete(response);
        } finally {
            MdcContext.clear();
        }
    }

    private void resolveAutomatically(ApprovalHandle handle, String reason, RiskAssessmentResult assessment,
                                      ApprovalCategory category, TaskContext context) {
        ApprovalResponse response = ApprovalResponse.of(handle.requestId(), ApprovalAction.APPROVE,
                reason, null, clock.instant(), true);
        incrementAutomaticApprovals();
        handle.transition(RequestState.AUTO_RESOLVED);
        metrics.recordDecision("auto");
        log.info("Auto-approved {}: {}", handle.requestId(), reason);

        Map<String, Object> payload = new HashMap<>();
        payload.put("response", response);
        payload.put("reason", reason);
        if (assessment != null) {
            payload.put("assessment", assessment);
        }
        if (category != null) {
            payload.put("category", category);
        }
        if (context != null) {
            payload.put("context", context);
        }
        eventBus.publish(EventTypes.AUTO_APPROVAL, handle.requestId(), payload);
        handle.response().complete(response);
    }

    private void recordAuditEntry(ApprovalRequest request, ApprovalResponse response) {
        AuditEntry entry = new AuditEntry(
                UUID.randomUUID().toString(),
                request.id(),
                response.action(),
                request.riskLevel(),
                request.category(),
                Math.max(0, Duration.between(request.createdAt(), response.timestamp()).toMillis()),
                response.quickDecision(),
                response.timestamp());
        synchronized (auditTrail) {
            auditTrail.add(entry);
            if (auditTrail.size() > properties.getAuditTrailLimit()) {
                int drop = auditTrail.size() - properties.getAuditTrailRetain();
                auditTrail.subList(0, drop).clear();
            }
        }
    }

    private void updateLearningMetrics(ApprovalResponse response) {
        synchronized (trustLock) {
            if (response.approved()) {
                successfulTasks++;
                totalApprovals++;
            }
            if (response.action() == ApprovalAction.TRUST) {
                userSatisfaction++;
            }
        }
        checkTrustProgression();
    }

    /**
     * Advances at most one step per call; never moves the rank down.
     */
    private void checkTrustProgression() {
        ApprovalProperties.Progression thresholds = properties.getProgression();
        TrustRank next = null;
        String reason = null;
        synchronized (trustLock) {
            if (currentRank == TrustRank.NOVICE && successfulTasks >= thresholds.getLearningAt()) {
                next = TrustRank.LEARNING;
                reason = "Automatic progression based on successful tasks";
            } else if (currentRank == TrustRank.LEARNING && successfulTasks >= thresholds.getCollaborativeAt()) {
                next = TrustRank.COLLABORATIVE;
                reason = "Automatic progression based on experience";
            } else if (currentRank == TrustRank.COLLABORATIVE && successfulTasks >= thresholds.getTrustedAt()) {
                next = TrustRank.TRUSTED;
                reason = "Automatic progression based on proven reliability";
            }
        }
        if (next != null) {
            changeRank(next, reason, true);
        }
    }

    private void changeRank(TrustRank newRank, String reason, boolean automatic) {
        TrustRank oldRank;
        synchronized (trustLock) {
            oldRank = currentRank;
            if (automatic && !newRank.isAbove(oldRank)) {
                return;
            }
            currentRank = newRank;
        }
        metrics.recordTrustChange(newRank.label(), automatic);
        log.info("Trust rank {} -> {} ({})", oldRank, newRank, reason);
        eventBus.publish(EventTypes.TRUST_CHANGED, null,
                Map.of("oldRank", oldRank, "newRank", newRank, "reason", reason, "automatic", automatic));
    }

    private void incrementAutomaticApprovals() {
        synchronized (trustLock) {
            automaticApprovals++;
        }
    }

    private static void cancelTimer(PendingEntry entry) {
        if (entry.timer() != null) {
            entry.timer().cancel(false);
        }
    }

    private static String autoRequestId() {
        return "auto-" + UUID.randomUUID();
    }
}

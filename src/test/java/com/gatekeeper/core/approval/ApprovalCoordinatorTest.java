package com.gatekeeper.core.approval;

import com.gatekeeper.core.error.NotFoundException;
import com.gatekeeper.core.error.StateException;
import com.gatekeeper.core.events.EventBus;
import com.gatekeeper.core.events.EventTypes;
import com.gatekeeper.core.events.GatekeeperEvent;
import com.gatekeeper.core.metrics.GatekeeperMetrics;
import com.gatekeeper.core.model.ApprovalAction;
import com.gatekeeper.core.model.ApprovalCategory;
import com.gatekeeper.core.model.ApprovalRequest;
import com.gatekeeper.core.model.ApprovalResponse;
import com.gatekeeper.core.model.ApprovalStatistics;
import com.gatekeeper.core.model.ProposedAction;
import com.gatekeeper.core.model.RequestState;
import com.gatekeeper.core.model.RiskLevel;
import com.gatekeeper.core.model.TaskContext;
import com.gatekeeper.core.model.TrustRank;
import com.gatekeeper.core.policy.KeywordCategoryClassifier;
import com.gatekeeper.core.policy.TrustPolicy;
import com.gatekeeper.core.risk.RiskAssessor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ApprovalCoordinatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final TrustPolicy trustPolicy = new TrustPolicy();
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private ApprovalProperties properties;
    private ScheduledExecutorService scheduler;
    private List<GatekeeperEvent> events;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        properties = new ApprovalProperties();
        properties.setAutoApprovalTimeout(Duration.ZERO);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private ApprovalCoordinator coordinator() {
        return new ApprovalCoordinator(
                new RiskAssessor(trustPolicy),
                trustPolicy,
                new KeywordCategoryClassifier(),
                eventBus,
                new GatekeeperMetrics(registry),
                properties,
                Clock.fixed(NOW, ZoneOffset.UTC),
                scheduler);
    }

    private static List<ProposedAction> authUpgrade() {
        return List.of(
                ProposedAction.reversible("edit", "Upgrade auth token library", "package.json"),
                ProposedAction.reversible("edit", "Rotate auth secret settings", "auth/config.ts"));
    }

    private static List<ProposedAction> docsFix() {
        return List.of(ProposedAction.reversible("edit", "Fix typo in documentation", "docs/README.md"));
    }

    private static TaskContext noviceAuth() {
        return TaskContext.of("update auth token handling", TrustRank.NOVICE);
    }

    private List<String> eventTypes() {
        return events.stream().map(GatekeeperEvent::eventType).toList();
    }

    @Nested
    @DisplayName("automatic resolution")
    class AutomaticTests {

        @Test
        @DisplayName("disabled coordinator approves without scoring")
        void disabled() throws Exception {
            properties.setEnabled(false);
            ApprovalHandle handle = coordinator().requestApproval(noviceAuth(), authUpgrade());

            assertTrue(handle.requestId().startsWith("auto-"));
            assertTrue(handle.assessment().isEmpty());
            assertEquals(RequestState.AUTO_RESOLVED, handle.state());
            ApprovalResponse response = handle.response().get();
            assertTrue(response.approved());
            assertEquals(ApprovalCoordinator.REASON_DISABLED, response.comment());
        }

        @Test
        @DisplayName("low-risk request at learning rank is auto-approved")
        void lowRisk() throws Exception {
            ApprovalCoordinator coordinator = coordinator();
            ApprovalHandle handle = coordinator.requestApproval(
                    TaskContext.of("Fix typo in README", TrustRank.LEARNING), docsFix());

            ApprovalResponse response = handle.response().get();
            assertTrue(response.approved());
            assertTrue(response.quickDecision());
            assertEquals(ApprovalAction.APPROVE, response.action());
            assertEquals(ApprovalCoordinator.REASON_LOW_RISK, response.comment());
            assertEquals(RiskLevel.LOW, handle.assessment().orElseThrow().overallRisk());
            assertTrue(coordinator.getAllPendingRequests().isEmpty());

            GatekeeperEvent auto = events.stream()
                    .filter(e -> e.eventType().equals(EventTypes.AUTO_APPROVAL)).findFirst().orElseThrow();
            assertEquals(ApprovalCategory.IMPLEMENTATION, auto.get("category", ApprovalCategory.class));
            assertEquals(1.0, registry.get("gatekeeper.decisions.total").tag("outcome", "auto").counter().count());
        }

        @Test
        @DisplayName("escalated category is still auto-approved when the rank allows it")
        void trustLevel() throws Exception {
            List<ProposedAction> migrations = List.of(
                    ProposedAction.reversible("edit", "Add migration 1", "db/migrations/001.sql"),
                    ProposedAction.reversible("edit", "Add migration 2", "db/migrations/002.sql"),
                    ProposedAction.reversible("edit", "Add migration 3", "db/migrations/003.sql"));

            ApprovalHandle handle = coordinator().requestApproval(
                    TaskContext.of("Add user table migrations", TrustRank.COLLABORATIVE), migrations,
                    ApprovalOptions.category(ApprovalCategory.SECURITY));

            assertEquals(RiskLevel.MEDIUM, handle.assessment().orElseThrow().overallRisk());
            assertEquals(ApprovalCoordinator.REASON_TRUST_LEVEL, handle.response().get().comment());
        }

        @Test
        @DisplayName("novice rank never takes the low-risk shortcut")
        void noviceNeverShortcuts() {
            ApprovalHandle handle = coordinator().requestApproval(
                    TaskContext.of("Fix typo in README", TrustRank.NOVICE), docsFix());

            assertTrue(handle.isPending());
            assertFalse(handle.response().isDone());
        }
    }

    @Nested
    @DisplayName("pending requests")
    class PendingTests {

        @Test
        @DisplayName("high-risk novice request waits for a human")
        void pending() {
            ApprovalCoordinator coordinator = coordinator();
            ApprovalHandle handle = coordinator.requestApproval(noviceAuth(), authUpgrade());

            assertTrue(handle.isPending());
            ApprovalRequest request = coordinator.getPendingRequest(handle.requestId()).orElseThrow();
            assertEquals(RiskLevel.HIGH, request.riskLevel());
            assertTrue(request.securityImpact());
            assertEquals(ApprovalCategory.SECURITY, request.category());
            assertEquals("security-authentication", request.themeId());
            assertTrue(request.rationale().contains("Test thoroughly before deployment"));
            assertEquals(NOW, request.createdAt());
            assertEquals(List.of(EventTypes.REQUEST_CREATED), eventTypes());
        }

        @Test
        @DisplayName("a request is answered exactly once")
        void respondOnce() throws Exception {
            ApprovalCoordinator coordinator = coordinator();
            ApprovalHandle handle = coordinator.requestApproval(noviceAuth(), authUpgrade());

            ApprovalResponse response = coordinator.respond(handle.requestId(), ApprovalAction.APPROVE, "looks fine");

            assertTrue(response.approved());
            assertEquals(response, handle.response().get(1, TimeUnit.SECONDS));
            assertEquals(RequestState.CLOSED, handle.state());
            assertTrue(coordinator.getPendingRequest(handle.requestId()).isEmpty());
            assertThrows(NotFoundException.class,
                    () -> coordinator.respond(handle.requestId(), ApprovalAction.REJECT, "too late"));
            assertTrue(eventTypes().contains(EventTypes.REQUEST_RESPONDED));
        }

        @Test
        @DisplayName("responding to an unknown id fails")
        void unknownId() {
            assertThrows(NotFoundException.class,
                    () -> coordinator().respond("missing", ApprovalAction.APPROVE, null));
        }

        @Test
        @DisplayName("rejection completes the future with approved=false")
        void reject() throws Exception {
            ApprovalCoordinator coordinator = coordinator();
            ApprovalHandle handle = coordinator.requestApproval(noviceAuth(), authUpgrade());

            coordinator.respond(handle.requestId(), ApprovalAction.REJECT, "not now");

            assertFalse(handle.response().get().approved());
            assertEquals(0, coordinator.getTrustSettings().learningMetrics().successfulTasks());
        }

        @Test
        @DisplayName("pending list is ordered by creation")
        void pendingOrder() {
            properties.setMaxPendingApprovals(0);
            ApprovalCoordinator coordinator = coordinator();
            coordinator.requestApproval(noviceAuth(), authUpgrade());
            coordinator.requestApproval(noviceAuth(), authUpgrade());

            assertEquals(2, coordinator.getAllPendingRequests().size());
        }

        @Test
        @DisplayName("refuses new requests beyond the configured maximum")
        void maxPending() {
            properties.setMaxPendingApprovals(2);
            ApprovalCoordinator coordinator = coordinator();
            coordinator.requestApproval(noviceAuth(), authUpgrade());
            coordinator.requestApproval(noviceAuth(), authUpgrade());

            assertThrows(StateException.class, () -> coordinator.requestApproval(noviceAuth(), authUpgrade()));
        }

        @Test
        @DisplayName("maximum holds when many callers submit at once")
        void maxPendingUnderContention() throws Exception {
            properties.setMaxPendingApprovals(5);
            int callers = 32;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            try {
                for (int round = 0; round < 20; round++) {
                    ApprovalCoordinator coordinator = coordinator();
                    CountDownLatch start = new CountDownLatch(1);
                    AtomicInteger accepted = new AtomicInteger();
                    AtomicInteger refused = new AtomicInteger();
                    List<Future<?>> submissions = new ArrayList<>();
                    for (int i = 0; i < callers; i++) {
                        submissions.add(pool.submit(() -> {
                            start.await();
                            try {
                                coordinator.requestApproval(noviceAuth(), authUpgrade());
                                accepted.incrementAndGet();
                            } catch (StateException e) {
                                refused.incrementAndGet();
                            }
                            return null;
                        }));
                    }
                    start.countDown();
                    for (Future<?> submission : submissions) {
                        submission.get(5, TimeUnit.SECONDS);
                    }

                    assertEquals(5, accepted.get(), "round " + round);
                    assertEquals(callers - 5, refused.get(), "round " + round);
                    assertEquals(5, coordinator.getAllPendingRequests().size());
                }
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("cancel releases the request and cancels the future")
        void cancel() {
            ApprovalCoordinator coordinator = coordinator();
            ApprovalHandle handle = coordinator.requestApproval(noviceAuth(), authUpgrade());

            coordinator.cancel(handle.requestId());

            assertTrue(handle.response().isCancelled());
            assertEquals(RequestState.CANCELLED, handle.state());
            assertTrue(coordinator.getAllPendingRequests().isEmpty());
            assertTrue(eventTypes().contains(EventTypes.REQUEST_CANCELLED));
            assertThrows(NotFoundException.class, () -> coordinator.cancel(handle.requestId()));
        }
    }

    @Nested
    @DisplayName("timeout")
    class TimeoutTests {

        @Test
        @DisplayName("low-risk pending request auto-approves after the timeout")
        void lowRiskTimesOut() throws Exception {
            properties.setAutoApprovalTimeout(Duration.ofMillis(50));
            ApprovalCoordinator coordinator = coordinator();
            ApprovalHandle handle = coordinator.requestApproval(
                    TaskContext.of("Fix typo in README", TrustRank.NOVICE), docsFix());

            ApprovalResponse response = handle.response().get(5, TimeUnit.SECONDS);

            assertEquals(handle.requestId(), response.requestId());
            assertEquals(ApprovalCoordinator.REASON_TIMEOUT, response.comment());
            assertTrue(response.approved());
            assertEquals(RequestState.AUTO_RESOLVED, handle.state());
            assertTrue(coordinator.getAllPendingRequests().isEmpty());
            assertEquals(1, coordinator.getApprovalStatistics().autoApprovals());
        }

        @Test
        @DisplayName("high-risk requests get no timer")
        void highRiskWaits() throws Exception {
            properties.setAutoApprovalTimeout(Duration.ofMillis(20));
            ApprovalCoordinator coordinator = coordinator();
            ApprovalHandle handle = coordinator.requestApproval(noviceAuth(), authUpgrade());

            Thread.sleep(150);
            assertTrue(handle.isPending());
            assertFalse(handle.response().isDone());
        }

        @Test
        @DisplayName("created is published before a timer can fire")
        void createdBeforeTimedOut() {
            properties.setAutoApprovalTimeout(Duration.ofMillis(1));
            ScheduledExecutorService immediate = mock(ScheduledExecutorService.class);
            when(immediate.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class))).thenAnswer(invocation -> {
                invocation.getArgument(0, Runnable.class).run();
                return mock(ScheduledFuture.class);
            });
            ApprovalCoordinator coordinator = new ApprovalCoordinator(
                    new RiskAssessor(trustPolicy),
                    trustPolicy,
                    new KeywordCategoryClassifier(),
                    eventBus,
                    new GatekeeperMetrics(registry),
                    properties,
                    Clock.fixed(NOW, ZoneOffset.UTC),
                    immediate);

            ApprovalHandle handle = coordinator.requestApproval(
                    TaskContext.of("Fix typo in README", TrustRank.NOVICE), docsFix());

            assertEquals(List.of(EventTypes.REQUEST_CREATED, EventTypes.REQUEST_TIMED_OUT), eventTypes());
            assertTrue(handle.response().join().approved());
            assertTrue(coordinator.getAllPendingRequests().isEmpty());
        }

        @Test
        @DisplayName("a timer firing after a response is a no-op")
        void lateTimer() {
            ApprovalCoordinator coordinator = coordinator();
            ApprovalHandle handle = coordinator.requestApproval(
                    TaskContext.of("Fix typo in README", TrustRank.NOVICE), docsFix());
            coordinator.respond(handle.requestId(), ApprovalAction.REJECT, null);

            coordinator.onTimeout(handle.requestId());

            assertFalse(handle.response().join().approved());
            assertFalse(eventTypes().contains(EventTypes.REQUEST_TIMED_OUT));
        }
    }

    @Nested
    @DisplayName("trust")
    class TrustTests {

        private void approveMany(ApprovalCoordinator coordinator, int count) {
            for (int i = 0; i < count; i++) {
                ApprovalHandle handle = coordinator.requestApproval(noviceAuth(), authUpgrade());
                coordinator.respond(handle.requestId(), ApprovalAction.APPROVE, null);
            }
        }

        @Test
        @DisplayName("rank advances one step at 5, 15 and 30 successful tasks")
        void progression() {
            properties.setDefaultTrustRank(TrustRank.NOVICE);
            ApprovalCoordinator coordinator = coordinator();

            approveMany(coordinator, 4);
            assertEquals(TrustRank.NOVICE, coordinator.currentTrustRank());
            approveMany(coordinator, 1);
            assertEquals(TrustRank.LEARNING, coordinator.currentTrustRank());
            approveMany(coordinator, 10);
            assertEquals(TrustRank.COLLABORATIVE, coordinator.currentTrustRank());
            approveMany(coordinator, 15);
            assertEquals(TrustRank.TRUSTED, coordinator.currentTrustRank());
            approveMany(coordinator, 20);
            assertEquals(TrustRank.TRUSTED, coordinator.currentTrustRank());

            List<GatekeeperEvent> changes = events.stream()
                    .filter(e -> e.eventType().equals(EventTypes.TRUST_CHANGED)).toList();
            assertEquals(3, changes.size());
            assertTrue(changes.stream().allMatch(e -> Boolean.TRUE.equals(e.get("automatic", Boolean.class))));
        }

        @Test
        @DisplayName("no progression when learning is disabled")
        void learningDisabled() {
            properties.setDefaultTrustRank(TrustRank.NOVICE);
            properties.setLearningEnabled(false);
            ApprovalCoordinator coordinator = coordinator();

            approveMany(coordinator, 6);

            assertEquals(TrustRank.NOVICE, coordinator.currentTrustRank());
        }

        @Test
        @DisplayName("progression never moves an explicitly raised rank down")
        void neverBackward() {
            properties.setDefaultTrustRank(TrustRank.NOVICE);
            ApprovalCoordinator coordinator = coordinator();
            coordinator.updateTrustRank(TrustRank.TRUSTED, "manual");

            approveMany(coordinator, 5);

            assertEquals(TrustRank.TRUSTED, coordinator.currentTrustRank());
        }

        @Test
        @DisplayName("trust action grants the requested rank")
        void trustAction() {
            ApprovalCoordinator coordinator = coordinator();
            ApprovalHandle handle = coordinator.requestApproval(noviceAuth(), authUpgrade());

            ApprovalResponse response = coordinator.respond(handle.requestId(), ApprovalAction.TRUST,
                    null, TrustRank.AUTONOMOUS, false);

            assertTrue(response.approved());
            assertEquals(TrustRank.AUTONOMOUS, response.trustRank());
            assertEquals(TrustRank.AUTONOMOUS, coordinator.currentTrustRank());
            assertEquals(1, coordinator.getTrustSettings().learningMetrics().userSatisfaction());
            assertTrue(coordinator.getTrustSettings().autoApprovalCategories().contains(ApprovalCategory.ARCHITECTURE));
        }

        @Test
        @DisplayName("explicit update may lower the rank")
        void explicitDowngrade() {
            ApprovalCoordinator coordinator = coordinator();
            coordinator.updateTrustRank(TrustRank.NOVICE, "reset");

            assertEquals(TrustRank.NOVICE, coordinator.currentTrustRank());
            assertEquals(TrustRank.NOVICE, coordinator.contextFor("anything").trustRank());
        }
    }

    @Nested
    @DisplayName("statistics and audit")
    class StatisticsTests {

        @Test
        @DisplayName("counts automatic, manual and rejected decisions")
        void statistics() {
            ApprovalCoordinator coordinator = coordinator();
            coordinator.requestApproval(TaskContext.of("Fix typo in README", TrustRank.LEARNING), docsFix());
            ApprovalHandle first = coordinator.requestApproval(noviceAuth(), authUpgrade());
            ApprovalHandle second = coordinator.requestApproval(noviceAuth(), authUpgrade());
            coordinator.respond(first.requestId(), ApprovalAction.APPROVE, null);
            coordinator.respond(second.requestId(), ApprovalAction.REJECT, null);

            ApprovalStatistics stats = coordinator.getApprovalStatistics();
            assertEquals(3, stats.totalRequests());
            assertEquals(1, stats.autoApprovals());
            assertEquals(1, stats.manualApprovals());
            assertEquals(1, stats.rejections());
            assertEquals(0.0, stats.averageDecisionTimeMs());
        }

        @Test
        @DisplayName("audit trail is trimmed to the retained size once over the limit")
        void auditTrim() {
            properties.setAuditTrailLimit(3);
            properties.setAuditTrailRetain(2);
            ApprovalCoordinator coordinator = coordinator();
            for (int i = 0; i < 4; i++) {
                ApprovalHandle handle = coordinator.requestApproval(noviceAuth(), authUpgrade());
                coordinator.respond(handle.requestId(), ApprovalAction.REJECT, null);
            }

            assertEquals(2, coordinator.getAuditTrail().size());
        }

        @Test
        @DisplayName("audit trail stays empty when disabled")
        void auditDisabled() {
            properties.setAuditTrailEnabled(false);
            ApprovalCoordinator coordinator = coordinator();
            ApprovalHandle handle = coordinator.requestApproval(noviceAuth(), authUpgrade());
            coordinator.respond(handle.requestId(), ApprovalAction.APPROVE, null);

            assertTrue(coordinator.getAuditTrail().isEmpty());
        }
    }
}

package com.gatekeeper.history;

import com.gatekeeper.core.model.ApprovalAction;
import com.gatekeeper.core.model.ApprovalCategory;
import com.gatekeeper.core.model.ApprovalResponse;
import com.gatekeeper.core.model.RiskLevel;
import com.gatekeeper.core.model.TrustRank;
import com.gatekeeper.history.model.ApprovalState;
import com.gatekeeper.history.model.Author;
import com.gatekeeper.history.model.ChangeOperation;
import com.gatekeeper.history.model.Commit;
import com.gatekeeper.history.model.DiffType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommitFactoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final Author AUTHOR = new Author("Alice", "alice@example.com");

    private final CommitFactory factory = new CommitFactory(Clock.fixed(T0, ZoneOffset.UTC));

    private static ApprovalResponse approve(String requestId, String comment) {
        return ApprovalResponse.of(requestId, ApprovalAction.APPROVE, comment, null, T0, false);
    }

    @Nested
    @DisplayName("identity")
    class IdentityTests {

        @Test
        @DisplayName("ids are 40 lowercase hex characters")
        void idFormat() {
            Commit commit = factory.create(approve("r1", null), List.of(), AUTHOR, null, null);
            assertTrue(commit.id().matches("[0-9a-f]{40}"));
            assertTrue(commit.treeHash().matches("[0-9a-f]{40}"));
            assertEquals(commit.id().substring(0, 7), commit.shortId());
        }

        @Test
        @DisplayName("identical content yields identical ids regardless of creation time")
        void deterministic() {
            CommitFactory later = new CommitFactory(Clock.fixed(T0.plusSeconds(3600), ZoneOffset.UTC));
            Commit a = factory.create(approve("r1", "ok"), List.of(), AUTHOR, null, null);
            Commit b = later.create(approve("r1", "ok"), List.of(), AUTHOR, null, null);

            assertEquals(a.id(), b.id());
            assertNotEquals(a.metadata().timestamp(), b.metadata().timestamp());
        }

        @Test
        @DisplayName("changing any hashed field changes the id")
        void sensitivity() {
            Commit base = factory.create(approve("r1", "ok"), List.of(), AUTHOR, null, null);

            ApprovalResponse rejected = ApprovalResponse.of("r1", ApprovalAction.REJECT, "ok", null, T0, false);
            assertNotEquals(base.id(), factory.create(rejected, List.of(), AUTHOR, null, null).id());
            assertNotEquals(base.id(), factory.create(approve("r1", "ok"), List.of(base.id()), AUTHOR, null, null).id());
            assertNotEquals(base.id(), factory.create(approve("r1", "ok"), List.of(),
                    new Author("Bob", "bob@example.com"), null, null).id());
            assertNotEquals(base.id(), factory.create(approve("r1", "ok"), List.of(), AUTHOR, "other", null).id());
            assertNotEquals(base.id(), factory.create(approve("r1", "ok"), List.of(), AUTHOR, null,
                    ApprovalState.initial()).id());
        }

        @Test
        @DisplayName("tree hash covers the previous state")
        void treeHashPreviousState() {
            ApprovalResponse response = approve("r1", null);
            ApprovalState state = ApprovalState.initial().apply(approve("r0", null));
            assertNotEquals(factory.treeHash(response, null), factory.treeHash(response, state));
            assertEquals(factory.treeHash(response, state), factory.treeHash(response, state));
        }
    }

    @Nested
    @DisplayName("messages and tags")
    class MessageTests {

        @Test
        @DisplayName("default messages per action")
        void defaults() {
            assertEquals("Approve: approved", CommitFactory.defaultMessage(approve("r", null)));
            assertEquals("Approve: approved\n\nship it", CommitFactory.defaultMessage(approve("r", "ship it")));
            assertEquals("Reject: rejected", CommitFactory.defaultMessage(
                    ApprovalResponse.of("r", ApprovalAction.REJECT, null, null, T0, false)));
            assertEquals("Grant trust: Auto-approve similar requests (trusted)", CommitFactory.defaultMessage(
                    ApprovalResponse.of("r", ApprovalAction.TRUST, null, TrustRank.TRUSTED, T0, false)));
            assertEquals("Request review: Additional validation required", CommitFactory.defaultMessage(
                    ApprovalResponse.of("r", ApprovalAction.REVIEW, null, null, T0, false)));
        }

        @Test
        @DisplayName("explicit message wins over the default")
        void explicitMessage() {
            Commit commit = factory.create(approve("r1", null), List.of(), AUTHOR, "Custom subject\n\nbody", null);
            assertEquals("Custom subject", commit.metadata().subject());
        }

        @Test
        @DisplayName("auto tags reflect action, outcome, speed and rank")
        void autoTags() {
            ApprovalResponse response = ApprovalResponse.of("r", ApprovalAction.TRUST, null,
                    TrustRank.COLLABORATIVE, T0, true);
            assertEquals(List.of("trust", "approved", "quick-decision", "trust-collaborative"),
                    CommitFactory.autoTags(response));
        }
    }

    @Nested
    @DisplayName("diff")
    class DiffTests {

        @Test
        @DisplayName("first rank grant is an add, later grants are modifications")
        void rankChanges() {
            ApprovalResponse grant = ApprovalResponse.of("r", ApprovalAction.TRUST, null, TrustRank.TRUSTED, T0, false);

            var first = CommitFactory.diff(grant, null);
            assertEquals(DiffType.TRUST_CHANGE, first.type());
            assertEquals(ChangeOperation.ADD, first.changes().get(0).operation());
            assertEquals("Trust level set to trusted, Request approved, Action taken: trust", first.summary());

            var second = CommitFactory.diff(grant, ApprovalState.initial());
            assertEquals(ChangeOperation.MODIFY, second.changes().get(0).operation());
            assertEquals("learning", second.changes().get(0).oldValue());
            assertEquals(TrustRank.TRUSTED, second.after().trustRank());
        }

        @Test
        @DisplayName("rejection appends to the rejected list")
        void rejection() {
            ApprovalResponse reject = ApprovalResponse.of("r9", ApprovalAction.REJECT, null, null, T0, false);
            var diff = CommitFactory.diff(reject, null);

            assertEquals(DiffType.REJECTION, diff.type());
            assertEquals(2, diff.changes().size());
            assertEquals(List.of("r9"), diff.after().rejectedRequests());
            assertNull(diff.before());
        }
    }

    @Nested
    @DisplayName("inference")
    class InferenceTests {

        @Test
        @DisplayName("risk and category from comment keywords")
        void infer() {
            assertEquals(RiskLevel.CRITICAL, CommitFactory.inferRiskLevel("Security concern"));
            assertEquals(RiskLevel.HIGH, CommitFactory.inferRiskLevel("high impact"));
            assertEquals(RiskLevel.MEDIUM, CommitFactory.inferRiskLevel("medium"));
            assertEquals(RiskLevel.LOW, CommitFactory.inferRiskLevel(null));
            assertEquals(ApprovalCategory.REFACTORING, CommitFactory.inferCategory("refactoring pass"));
            assertEquals(ApprovalCategory.IMPLEMENTATION, CommitFactory.inferCategory("whatever"));
        }

        @Test
        @DisplayName("explicit risk and category override inference")
        void explicitMetadata() {
            Commit commit = factory.create(approve("r1", "security"), List.of(), AUTHOR, null, null,
                    RiskLevel.LOW, ApprovalCategory.PERFORMANCE);
            assertEquals(RiskLevel.LOW, commit.metadata().riskLevel());
            assertEquals(ApprovalCategory.PERFORMANCE, commit.metadata().category());
        }
    }

    @Nested
    @DisplayName("format")
    class FormatTests {

        @Test
        @DisplayName("oneline shows short id and subject")
        void oneline() {
            Commit commit = factory.create(approve("r1", "looks good"), List.of(), AUTHOR, null, null);
            assertEquals(commit.shortId() + " Approve: approved", CommitFactory.format(commit, true, false, false));
        }

        @Test
        @DisplayName("full form lists header, tags, indented message and changes")
        void full() {
            Commit parent = factory.create(approve("r0", null), List.of(), AUTHOR, null, null);
            Commit commit = factory.create(approve("r1", "looks good"), List.of(parent.id()), AUTHOR, null, null);

            String text = CommitFactory.format(commit, false, true, true);
            assertTrue(text.startsWith("commit " + commit.id() + "\nParent: " + parent.id()));
            assertTrue(text.contains("Author: Alice <alice@example.com>"));
            assertTrue(text.contains("Tags: approve, approved"));
            assertTrue(text.contains("Risk: low, Category: implementation"));
            assertTrue(text.contains("    Approve: approved\n    \n    looks good"));
            assertTrue(text.contains("Changes:\n    add: Request approved"));
        }
    }
}

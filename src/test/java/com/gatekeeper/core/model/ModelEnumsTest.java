package com.gatekeeper.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelEnumsTest {

    @Nested
    @DisplayName("TrustRank")
    class TrustRankTests {

        @Test
        @DisplayName("orders by level")
        void ordering() {
            assertTrue(TrustRank.AUTONOMOUS.isAbove(TrustRank.TRUSTED));
            assertTrue(TrustRank.LEARNING.isAtLeast(TrustRank.LEARNING));
            assertFalse(TrustRank.NOVICE.isAtLeast(TrustRank.LEARNING));
            assertTrue(TrustRank.NOVICE.compareRank(TrustRank.COLLABORATIVE) < 0);
        }

        @Test
        @DisplayName("parses labels and constant names")
        void parsing() {
            assertEquals(TrustRank.COLLABORATIVE, TrustRank.fromLabel("collaborative"));
            assertEquals(TrustRank.TRUSTED, TrustRank.fromLabel("TRUSTED"));
            assertThrows(IllegalArgumentException.class, () -> TrustRank.fromLabel("expert"));
        }
    }

    @Nested
    @DisplayName("ApprovalCategory")
    class CategoryTests {

        @Test
        @DisplayName("lenient parse returns empty for unknown names")
        void lenientParse() {
            assertEquals(ApprovalCategory.SECURITY, ApprovalCategory.parse(" Security ").orElseThrow());
            assertTrue(ApprovalCategory.parse("docs").isEmpty());
            assertTrue(ApprovalCategory.parse(null).isEmpty());
            assertThrows(IllegalArgumentException.class, () -> ApprovalCategory.fromLabel("docs"));
        }
    }

    @Nested
    @DisplayName("ApprovalAction")
    class ActionTests {

        @Test
        @DisplayName("approve and trust count as approval")
        void approves() {
            assertTrue(ApprovalAction.APPROVE.approves());
            assertTrue(ApprovalAction.TRUST.approves());
            assertFalse(ApprovalAction.REJECT.approves());
            assertFalse(ApprovalAction.REVIEW.approves());
        }

        @Test
        @DisplayName("response factory derives the approved flag")
        void responseFactory() {
            ApprovalResponse response = ApprovalResponse.of("r1", ApprovalAction.REVIEW, null, null, null, false);
            assertFalse(response.approved());
        }
    }
}

package com.gatekeeper.core.model;

import java.io.Serializable;
import java.util.Set;

/**
 * Snapshot of the requester's trust posture and the counters that drive automatic progression.
 */
public record TrustSettings(
    TrustRank currentRank,
    Set<ApprovalCategory> autoApprovalCategories,
    Set<ApprovalCategory> requireApprovalFor,
    LearningMetrics learningMetrics
) implements Serializable {

    public TrustSettings {
        autoApprovalCategories = Set.copyOf(autoApprovalCategories);
        requireApprovalFor = Set.copyOf(requireApprovalFor);
    }

    /**
     * Cumulative counters for the process lifetime. Never reset by rank changes.
     */
    public record LearningMetrics(
        int successfulTasks,
        int totalApprovals,
        int automaticApprovals,
        int userSatisfaction,
        int errorsEncountered
    ) implements Serializable {

        public static LearningMetrics empty() {
            return new LearningMetrics(0, 0, 0, 0, 0);
        }
    }
}

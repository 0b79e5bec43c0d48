package com.gatekeeper.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A decision that could not be auto-resolved and is waiting for a human.
 * Lives in the pending table only until it is answered, times out, or is cancelled.
 */
public record ApprovalRequest(
    String id,
    String themeId,
    TaskContext context,
    List<ProposedAction> proposedActions,
    String rationale,
    RiskLevel riskLevel,
    boolean securityImpact,
    ApprovalCategory category,
    Instant createdAt
) implements Serializable {

    public ApprovalRequest {
        proposedActions = proposedActions != null ? List.copyOf(proposedActions) : List.of();
    }
}

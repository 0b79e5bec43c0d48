package com.gatekeeper.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * The recorded answer to a request.
 *
 * @param requestId     the request answered; auto-resolutions use a synthetic {@code auto-} id
 * @param action        action taken
 * @param approved      true for approve and trust
 * @param comment       optional free text (nullable)
 * @param trustRank     rank granted with a trust action (nullable)
 * @param timestamp     when the answer was recorded
 * @param quickDecision true when resolved by a shortcut or automatically
 */
public record ApprovalResponse(
    String requestId,
    ApprovalAction action,
    boolean approved,
    String comment,
    TrustRank trustRank,
    Instant timestamp,
    boolean quickDecision
) implements Serializable {

    public static ApprovalResponse of(String requestId, ApprovalAction action, String comment,
                                      TrustRank trustRank, Instant timestamp, boolean quickDecision) {
        return new ApprovalResponse(requestId, action, action.approves(), comment, trustRank, timestamp, quickDecision);
    }
}

package com.gatekeeper.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One recorded human decision, kept for approval statistics.
 *
 * @param decisionTimeMs milliseconds between request creation and the response
 */
public record AuditEntry(
    String id,
    String requestId,
    ApprovalAction action,
    RiskLevel riskLevel,
    ApprovalCategory category,
    long decisionTimeMs,
    boolean quickDecision,
    Instant timestamp
) implements Serializable {}

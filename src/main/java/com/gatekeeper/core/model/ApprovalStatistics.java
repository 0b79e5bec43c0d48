package com.gatekeeper.core.model;

/**
 * Aggregate counts over the audit trail and automatic resolutions.
 */
public record ApprovalStatistics(
    int totalRequests,
    int autoApprovals,
    int manualApprovals,
    int rejections,
    double averageDecisionTimeMs
) {}

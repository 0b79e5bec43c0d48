package com.gatekeeper.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of scoring a proposed action set. Derived per request and not stored.
 */
public record RiskAssessmentResult(
    RiskLevel overallRisk,
    double overallScore,
    List<RiskFactor> factors,
    List<String> recommendations,
    boolean requiresApproval,
    boolean autoApprovalEligible
) implements Serializable {

    public RiskAssessmentResult {
        factors = factors != null ? List.copyOf(factors) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    public Optional<RiskFactor> factor(String category) {
        return factors.stream().filter(f -> f.category().equals(category)).findFirst();
    }

    public boolean hasSecurityImpact() {
        return factor(RiskFactor.SECURITY_IMPACT)
                .map(f -> f.level() != RiskLevel.LOW)
                .orElse(false);
    }
}

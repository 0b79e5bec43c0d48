package com.gatekeeper.core.model;

import java.io.Serializable;

/**
 * One scored dimension of a risk assessment.
 *
 * @param category    dimension name, e.g. "Security Impact"
 * @param score       raw sub-score before weighting
 * @param level       level of the sub-score on the shared thresholds
 * @param weight      multiplier applied to the sub-score in the overall sum
 * @param description human-readable summary
 */
public record RiskFactor(
    String category,
    double score,
    RiskLevel level,
    double weight,
    String description
) implements Serializable {

    public static final String FILE_IMPACT = "File Impact";
    public static final String SECURITY_IMPACT = "Security Impact";
    public static final String REVERSIBILITY = "Reversibility";
    public static final String DEPENDENCY_CHANGES = "Dependency Changes";
    public static final String DATABASE_IMPACT = "Database Impact";
    public static final String API_IMPACT = "API Impact";

    public double weightedScore() {
        return score * weight;
    }
}

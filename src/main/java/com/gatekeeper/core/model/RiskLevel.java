package com.gatekeeper.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordinal risk classification derived from weighted risk factors.
 */
public enum RiskLevel {
    LOW("low", 0),
    MEDIUM("medium", 1),
    HIGH("high", 2),
    CRITICAL("critical", 3);

    /** Lower bounds (inclusive) of the medium, high and critical bands. */
    public static final double MEDIUM_THRESHOLD = 2.0;
    public static final double HIGH_THRESHOLD = 4.0;
    public static final double CRITICAL_THRESHOLD = 6.0;

    private final String label;
    private final int severity;

    RiskLevel(String label, int severity) {
        this.label = label;
        this.severity = severity;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isAtLeast(RiskLevel other) {
        return severity >= other.severity;
    }

    public boolean isAbove(RiskLevel other) {
        return severity > other.severity;
    }

    /**
     * Maps a weighted score onto a level using ascending thresholds:
     * below 2.0 is low, below 4.0 medium, below 6.0 high, anything else critical.
     */
    public static RiskLevel fromScore(double score) {
        if (score >= CRITICAL_THRESHOLD) return CRITICAL;
        if (score >= HIGH_THRESHOLD) return HIGH;
        if (score >= MEDIUM_THRESHOLD) return MEDIUM;
        return LOW;
    }

    @JsonCreator
    public static RiskLevel fromLabel(String value) {
        for (RiskLevel level : values()) {
            if (level.label.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown risk level: " + value);
    }
}

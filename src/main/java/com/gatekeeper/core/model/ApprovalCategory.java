package com.gatekeeper.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Broad classification of the work a request covers. Some categories escalate approval rules.
 */
public enum ApprovalCategory {
    ARCHITECTURE("architecture"),
    IMPLEMENTATION("implementation"),
    REFACTORING("refactoring"),
    SECURITY("security"),
    PERFORMANCE("performance");

    private final String label;

    ApprovalCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Lenient lookup. Unknown names yield empty so callers fall back to
     * rank-based rules without category escalation.
     */
    public static Optional<ApprovalCategory> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (ApprovalCategory category : values()) {
            if (category.label.equalsIgnoreCase(value.trim()) || category.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static ApprovalCategory fromLabel(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown category: " + value));
    }
}

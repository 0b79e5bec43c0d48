package com.gatekeeper.history.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of state change a commit records.
 */
public enum DiffType {
    APPROVAL("approval"),
    REJECTION("rejection"),
    TRUST_CHANGE("trust-change");

    private final String label;

    DiffType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static DiffType fromLabel(String value) {
        for (DiffType type : values()) {
            if (type.label.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown diff type: " + value);
    }
}

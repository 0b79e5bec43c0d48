package com.gatekeeper.history.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReviewStatus {
    PENDING("pending"),
    APPROVED("approved"),
    CHANGES_REQUESTED("changes-requested"),
    COMMENTED("commented");

    private final String label;

    ReviewStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ReviewStatus fromLabel(String value) {
        for (ReviewStatus status : values()) {
            if (status.label.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown review status: " + value);
    }
}

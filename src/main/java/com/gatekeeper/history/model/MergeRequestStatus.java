package com.gatekeeper.history.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MergeRequestStatus {
    DRAFT("draft"),
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected"),
    MERGED("merged"),
    CLOSED("closed");

    private final String label;

    MergeRequestStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isOpen() {
        return this == DRAFT || this == PENDING || this == APPROVED;
    }

    /** Requests in these states are marked merged when their branches are merged. */
    public boolean isMergeable() {
        return this == PENDING || this == APPROVED;
    }

    @JsonCreator
    public static MergeRequestStatus fromLabel(String value) {
        for (MergeRequestStatus status : values()) {
            if (status.label.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown merge request status: " + value);
    }
}

package com.gatekeeper.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The decision a human (or the system, for auto-resolution) takes on a request.
 */
public enum ApprovalAction {
    APPROVE("approve"),
    REJECT("reject"),
    TRUST("trust"),
    REVIEW("review");

    private final String label;

    ApprovalAction(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Approve and trust both count as approval. */
    public boolean approves() {
        return this == APPROVE || this == TRUST;
    }

    @JsonCreator
    public static ApprovalAction fromLabel(String value) {
        for (ApprovalAction action : values()) {
            if (action.label.equalsIgnoreCase(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown approval action: " + value);
    }
}

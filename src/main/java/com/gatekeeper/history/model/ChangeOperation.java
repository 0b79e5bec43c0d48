package com.gatekeeper.history.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeOperation {
    ADD("add"),
    REMOVE("remove"),
    MODIFY("modify");

    private final String label;

    ChangeOperation(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ChangeOperation fromLabel(String value) {
        for (ChangeOperation op : values()) {
            if (op.label.equalsIgnoreCase(value) || op.name().equalsIgnoreCase(value)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown change operation: " + value);
    }
}

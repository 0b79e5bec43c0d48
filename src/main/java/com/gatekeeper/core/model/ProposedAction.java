package com.gatekeeper.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One change a requester wants to make, as submitted for approval.
 *
 * @param kind          free-form action kind (e.g. "edit", "create", "delete", "command")
 * @param description   human-readable description, scanned for risk keywords
 * @param affectedPaths resource paths the action touches
 * @param riskHint      the requester's own estimate, informational only
 * @param reversible    whether the action can be undone
 */
public record ProposedAction(
    String kind,
    String description,
    List<String> affectedPaths,
    RiskLevel riskHint,
    boolean reversible
) implements Serializable {

    public ProposedAction {
        description = description != null ? description : "";
        affectedPaths = affectedPaths != null ? List.copyOf(affectedPaths) : List.of();
        riskHint = riskHint != null ? riskHint : RiskLevel.LOW;
    }

    public static ProposedAction reversible(String kind, String description, String... paths) {
        return new ProposedAction(kind, description, List.of(paths), RiskLevel.LOW, true);
    }

    public static ProposedAction irreversible(String kind, String description, String... paths) {
        return new ProposedAction(kind, description, List.of(paths), RiskLevel.LOW, false);
    }
}

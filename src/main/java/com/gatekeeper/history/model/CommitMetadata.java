package com.gatekeeper.history.model;

import com.gatekeeper.core.model.ApprovalCategory;
import com.gatekeeper.core.model.RiskLevel;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

public record CommitMetadata(
    Instant timestamp,
    String author,
    String email,
    String message,
    List<String> tags,
    RiskLevel riskLevel,
    ApprovalCategory category
) implements Serializable {

    public CommitMetadata {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    /** First line of the message. */
    public String subject() {
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}

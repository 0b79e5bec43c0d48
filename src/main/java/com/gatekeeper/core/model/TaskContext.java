package com.gatekeeper.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * What the requester is trying to do, supplied once per approval request.
 */
public record TaskContext(
    String intent,
    List<String> sessionHistory,
    Map<String, String> projectMetadata,
    TrustRank trustRank
) implements Serializable {

    public TaskContext {
        intent = intent != null ? intent : "";
        sessionHistory = sessionHistory != null ? List.copyOf(sessionHistory) : List.of();
        projectMetadata = projectMetadata != null ? Map.copyOf(projectMetadata) : Map.of();
        trustRank = trustRank != null ? trustRank : TrustRank.NOVICE;
    }

    public static TaskContext of(String intent, TrustRank trustRank) {
        return new TaskContext(intent, List.of(), Map.of(), trustRank);
    }
}

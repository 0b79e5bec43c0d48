package com.gatekeeper.history.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Fully materialized export of a repository, suitable for JSON persistence or mirroring.
 */
public record RepositorySnapshot(
    String id,
    String name,
    String defaultBranch,
    String currentBranch,
    List<Branch> branches,
    List<Commit> commits,
    Map<String, String> tags,
    List<MergeRequest> mergeRequests,
    Instant createdAt,
    Instant lastActivity
) {

    public RepositorySnapshot {
        branches = branches != null ? List.copyOf(branches) : List.of();
        commits = commits != null ? List.copyOf(commits) : List.of();
        tags = tags != null ? Map.copyOf(tags) : Map.of();
        mergeRequests = mergeRequests != null ? List.copyOf(mergeRequests) : List.of();
    }
}

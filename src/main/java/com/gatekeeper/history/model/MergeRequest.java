package com.gatekeeper.history.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A request to merge one branch into another, with its review trail.
 *
 * @param commitIds commits reachable from the source head but not from its base, oldest first
 */
public record MergeRequest(
    String id,
    String title,
    String description,
    String sourceBranch,
    String targetBranch,
    List<String> commitIds,
    List<Review> reviews,
    MergeRequestStatus status,
    String author,
    Instant createdAt,
    Instant updatedAt,
    Instant mergedAt,
    Instant closedAt
) implements Serializable {

    public MergeRequest {
        commitIds = commitIds != null ? List.copyOf(commitIds) : List.of();
        reviews = reviews != null ? List.copyOf(reviews) : List.of();
    }

    public MergeRequest withReview(Review review, MergeRequestStatus newStatus, Instant now) {
        List<Review> updated = new ArrayList<>(reviews);
        updated.add(review);
        return new MergeRequest(id, title, description, sourceBranch, targetBranch, commitIds, updated,
                newStatus, author, createdAt, now, mergedAt, closedAt);
    }

    public MergeRequest merged(Instant now) {
        return new MergeRequest(id, title, description, sourceBranch, targetBranch, commitIds, reviews,
                MergeRequestStatus.MERGED, author, createdAt, now, now, closedAt);
    }

    public MergeRequest closed(Instant now) {
        return new MergeRequest(id, title, description, sourceBranch, targetBranch, commitIds, reviews,
                MergeRequestStatus.CLOSED, author, createdAt, now, mergedAt, now);
    }

    public boolean targets(String source, String target) {
        return sourceBranch.equals(source) && targetBranch.equals(target);
    }
}

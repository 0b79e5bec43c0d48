package com.gatekeeper.history.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A named pointer into the commit DAG. Immutable; the store swaps in updated copies.
 *
 * @param head            current tip; null for an empty branch
 * @param baseCommit      commit the branch was created from; null when created empty
 * @param path            ids of the commits that belong to this branch, oldest first
 * @param mergeRequestIds merge requests opened from this branch
 */
public record Branch(
    String name,
    String head,
    String baseCommit,
    List<String> path,
    List<String> mergeRequestIds,
    @JsonProperty("protected") boolean protectedBranch,
    Instant createdAt,
    Instant lastActivity
) implements Serializable {

    public Branch {
        path = path != null ? List.copyOf(path) : List.of();
        mergeRequestIds = mergeRequestIds != null ? List.copyOf(mergeRequestIds) : List.of();
    }

    public static Branch empty(String name, boolean protectedBranch, Instant now) {
        return new Branch(name, null, null, List.of(), List.of(), protectedBranch, now, now);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return head == null;
    }

    public boolean contains(String commitId) {
        return path.contains(commitId);
    }

    /** Advance the head and append the given commits to the path. */
    public Branch advance(String newHead, List<String> appended, Instant now) {
        List<String> newPath = new ArrayList<>(path);
        for (String id : appended) {
            if (!newPath.contains(id)) {
                newPath.add(id);
            }
        }
        return new Branch(name, newHead, baseCommit, newPath, mergeRequestIds, protectedBranch, createdAt, now);
    }

    public Branch withMergeRequest(String mergeRequestId, Instant now) {
        List<String> ids = new ArrayList<>(mergeRequestIds);
        ids.add(mergeRequestId);
        return new Branch(name, head, baseCommit, path, ids, protectedBranch, createdAt, now);
    }

    public Branch withProtected(boolean value) {
        return new Branch(name, head, baseCommit, path, mergeRequestIds, value, createdAt, lastActivity);
    }
}

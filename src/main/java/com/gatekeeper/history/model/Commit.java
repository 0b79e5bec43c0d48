package com.gatekeeper.history.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.gatekeeper.core.model.ApprovalResponse;

import java.io.Serializable;
import java.util.List;

/**
 * An immutable, content-addressed approval decision in the history DAG.
 *
 * @param id        40 hex chars derived from the commit's canonical content
 * @param parentIds zero parents for a root, one for a plain commit, two for a merge
 * @param response  the decision recorded
 * @param treeHash  hash of the reduced approval state
 */
public record Commit(
    String id,
    List<String> parentIds,
    ApprovalResponse response,
    CommitMetadata metadata,
    ApprovalDiff diff,
    String treeHash
) implements Serializable {

    public Commit {
        parentIds = parentIds != null ? List.copyOf(parentIds) : List.of();
    }

    @JsonIgnore
    public boolean isMerge() {
        return parentIds.size() > 1;
    }

    @JsonIgnore
    public String shortId() {
        return id.length() > 7 ? id.substring(0, 7) : id;
    }
}

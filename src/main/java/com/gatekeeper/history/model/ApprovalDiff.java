package com.gatekeeper.history.model;

import java.io.Serializable;
import java.util.List;

/**
 * @param before  state before the commit; null for a commit with no predecessor state
 * @param after   state after the commit, used as the next commit's previous state
 * @param summary descriptions of {@code changes} joined with ", "
 */
public record ApprovalDiff(
    DiffType type,
    ApprovalState before,
    ApprovalState after,
    List<ApprovalChange> changes,
    String summary
) implements Serializable {

    public ApprovalDiff {
        changes = changes != null ? List.copyOf(changes) : List.of();
    }
}

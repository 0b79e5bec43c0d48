package com.gatekeeper.history.model;

/**
 * @param mergedOnly only branches whose head is on the default branch, excluding the default branch itself
 */
public record BranchFilter(boolean mergedOnly) {

    public static BranchFilter all() {
        return new BranchFilter(false);
    }

    public static BranchFilter merged() {
        return new BranchFilter(true);
    }
}

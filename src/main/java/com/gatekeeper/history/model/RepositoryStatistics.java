package com.gatekeeper.history.model;

import java.util.Map;

/**
 * Aggregate view over the whole repository.
 */
public record RepositoryStatistics(
    Totals totals,
    Activity activity,
    Contributors contributors,
    Risk risk
) {

    public record Totals(int commits, int branches, int mergeRequests, int tags) {}

    /**
     * @param averageTimeToMergeMs mean time from merge request creation to merge, 0 when none merged
     */
    public record Activity(int commitsLastWeek, int commitsLastMonth, double averageTimeToMergeMs) {}

    public record Contributors(int total, String mostActive, Map<String, Integer> activity) {}

    /**
     * @param rejectionRate fraction of commits whose decision is not approved; 0 when there are no commits
     */
    public record Risk(Map<String, Integer> riskDistribution, Map<String, Integer> categoryDistribution,
                       double rejectionRate) {}
}

package com.gatekeeper.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for approval decisions and history mutations.
 */
@Service
public class GatekeeperMetrics {

    private final MeterRegistry registry;

    public GatekeeperMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "auto", "pending", "approved", "rejected", "timed_out" or "cancelled"
     */
    public void recordDecision(String outcome) {
        Counter.builder("gatekeeper.decisions.total")
                .description("Approval decisions by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRiskAssessment(String riskLevel, double score) {
        DistributionSummary.builder("gatekeeper.risk.score")
                .tag("level", riskLevel)
                .register(registry)
                .record(score);
    }

    public void recordDecisionLatency(long ms) {
        Timer.builder("gatekeeper.decision.latency")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTrustChange(String newRank, boolean automatic) {
        Counter.builder("gatekeeper.trust.changes")
                .tag("rank", newRank)
                .tag("automatic", String.valueOf(automatic))
                .register(registry)
                .increment();
    }

    public void recordCommit(String branch) {
        Counter.builder("gatekeeper.history.commits")
                .tag("branch", branch)
                .register(registry)
                .increment();
    }

    public void recordMerge(String targetBranch) {
        Counter.builder("gatekeeper.history.merges")
                .tag("target", targetBranch)
                .register(registry)
                .increment();
    }
}

package com.gatekeeper.core.approval;

import com.gatekeeper.core.model.TrustRank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "gatekeeper.approval")
public class ApprovalProperties {

    private boolean enabled = true;
    /** Low-risk pending requests auto-approve after this long. Zero disables the timer. */
    private Duration autoApprovalTimeout = Duration.ofSeconds(30);
    /** Upper bound on simultaneously pending requests. Zero or less means unbounded. */
    private int maxPendingApprovals = 5;
    private boolean auditTrailEnabled = true;
    private int auditTrailLimit = 1000;
    private int auditTrailRetain = 500;
    private boolean learningEnabled = true;
    private TrustRank defaultTrustRank = TrustRank.LEARNING;
    private Progression progression = new Progression();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Duration getAutoApprovalTimeout() { return autoApprovalTimeout; }
    public void setAutoApprovalTimeout(Duration autoApprovalTimeout) { this.autoApprovalTimeout = autoApprovalTimeout; }
    public int getMaxPendingApprovals() { return maxPendingApprovals; }
    public void setMaxPendingApprovals(int maxPendingApprovals) { this.maxPendingApprovals = maxPendingApprovals; }
    public boolean isAuditTrailEnabled() { return auditTrailEnabled; }
    public void setAuditTrailEnabled(boolean auditTrailEnabled) { this.auditTrailEnabled = auditTrailEnabled; }
    public int getAuditTrailLimit() { return auditTrailLimit; }
    public void setAuditTrailLimit(int auditTrailLimit) { this.auditTrailLimit = auditTrailLimit; }
    public int getAuditTrailRetain() { return auditTrailRetain; }
    public void setAuditTrailRetain(int auditTrailRetain) { this.auditTrailRetain = auditTrailRetain; }
    public boolean isLearningEnabled() { return learningEnabled; }
    public void setLearningEnabled(boolean learningEnabled) { this.learningEnabled = learningEnabled; }
    public TrustRank getDefaultTrustRank() { return defaultTrustRank; }
    public void setDefaultTrustRank(TrustRank defaultTrustRank) { this.defaultTrustRank = defaultTrustRank; }
    public Progression getProgression() { return progression; }
    public void setProgression(Progression progression) { this.progression = progression; }

    /**
     * Cumulative successful-task counts at which the rank advances one step.
     */
    public static class Progression {
        private int learningAt = 5;
        private int collaborativeAt = 15;
        private int trustedAt = 30;

        public int getLearningAt() { return learningAt; }
        public void setLearningAt(int learningAt) { this.learningAt = learningAt; }
        public int getCollaborativeAt() { return collaborativeAt; }
        public void setCollaborativeAt(int collaborativeAt) { this.collaborativeAt = collaborativeAt; }
        public int getTrustedAt() { return trustedAt; }
        public void setTrustedAt(int trustedAt) { this.trustedAt = trustedAt; }
    }
}

package com.gatekeeper.core.policy;

import com.gatekeeper.core.model.ApprovalCategory;
import com.gatekeeper.core.model.RiskFactor;
import com.gatekeeper.core.model.RiskLevel;
import com.gatekeeper.core.model.TrustRank;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Decides, from a risk level and the requester's trust rank, whether a human must sign off
 * and whether the request may be resolved automatically.
 * <p>
 * Total over its inputs: a null category means "no category-specific escalation".
 */
@Service
public class TrustPolicy {

    /**
     * Category overrides are checked first, then the rank ladder.
     */
    public boolean requiresApproval(RiskLevel riskLevel, TrustRank trustRank, ApprovalCategory category) {
        if (category == ApprovalCategory.SECURITY && riskLevel.isAbove(RiskLevel.LOW)) {
            return true;
        }
        if (category == ApprovalCategory.ARCHITECTURE && riskLevel.isAtLeast(RiskLevel.HIGH)) {
            return true;
        }

        return switch (trustRank) {
            case NOVICE -> true;
            case LEARNING -> riskLevel.isAtLeast(RiskLevel.MEDIUM);
            case COLLABORATIVE -> riskLevel.isAtLeast(RiskLevel.HIGH);
            case TRUSTED -> riskLevel == RiskLevel.CRITICAL;
            case AUTONOMOUS -> false;
        };
    }

    /**
     * Never eligible at critical risk or when any security factor is above low.
     */
    public boolean autoApprovalEligible(RiskLevel riskLevel, List<RiskFactor> factors, TrustRank trustRank) {
        if (riskLevel == RiskLevel.CRITICAL) {
            return false;
        }
        boolean securityFlagged = factors.stream()
                .anyMatch(f -> RiskFactor.SECURITY_IMPACT.equals(f.category()) && f.level() != RiskLevel.LOW);
        if (securityFlagged) {
            return false;
        }
        return canAutoApprove(riskLevel, trustRank);
    }

    /**
     * The rank ladder alone, one step more permissive than {@link #requiresApproval}.
     */
    public boolean canAutoApprove(RiskLevel riskLevel, TrustRank trustRank) {
        if (riskLevel == RiskLevel.CRITICAL) {
            return false;
        }
        return switch (trustRank) {
            case NOVICE -> false;
            case LEARNING -> riskLevel == RiskLevel.LOW;
            case COLLABORATIVE, TRUSTED, AUTONOMOUS -> !riskLevel.isAtLeast(RiskLevel.HIGH);
        };
    }

    /**
     * Categories that may be auto-approved at the given rank.
     */
    public Set<ApprovalCategory> autoApprovalCategoriesFor(TrustRank trustRank) {
        return switch (trustRank) {
            case NOVICE -> EnumSet.noneOf(ApprovalCategory.class);
            case LEARNING -> EnumSet.of(ApprovalCategory.REFACTORING);
            case COLLABORATIVE -> EnumSet.of(ApprovalCategory.REFACTORING, ApprovalCategory.IMPLEMENTATION);
            case TRUSTED -> EnumSet.of(ApprovalCategory.REFACTORING, ApprovalCategory.IMPLEMENTATION,
                    ApprovalCategory.PERFORMANCE);
            case AUTONOMOUS -> EnumSet.of(ApprovalCategory.REFACTORING, ApprovalCategory.IMPLEMENTATION,
                    ApprovalCategory.PERFORMANCE, ApprovalCategory.ARCHITECTURE);
        };
    }

    /**
     * Categories that always need sign-off at the given rank: the complement of
     * {@link #autoApprovalCategoriesFor}. Security is never auto-approved.
     */
    public Set<ApprovalCategory> requireApprovalCategoriesFor(TrustRank trustRank) {
        EnumSet<ApprovalCategory> autoApproved = EnumSet.noneOf(ApprovalCategory.class);
        autoApproved.addAll(autoApprovalCategoriesFor(trustRank));
        return EnumSet.complementOf(autoApproved);
    }
}

package com.gatekeeper.history.model;

import com.gatekeeper.core.model.ApprovalCategory;
import com.gatekeeper.core.model.ApprovalResponse;
import com.gatekeeper.core.model.TrustRank;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Reduced projection of approval state carried from commit to commit. Only this projection,
 * not the proposed action content, feeds the tree hash.
 */
public record ApprovalState(
    TrustRank trustRank,
    List<ApprovalCategory> autoApprovalCategories,
    List<String> approvedRequests,
    List<String> rejectedRequests
) implements Serializable {

    public ApprovalState {
        trustRank = trustRank != null ? trustRank : TrustRank.LEARNING;
        autoApprovalCategories = autoApprovalCategories != null ? List.copyOf(autoApprovalCategories) : List.of();
        approvedRequests = approvedRequests != null ? List.copyOf(approvedRequests) : List.of();
        rejectedRequests = rejectedRequests != null ? List.copyOf(rejectedRequests) : List.of();
    }

    public static ApprovalState initial() {
        return new ApprovalState(TrustRank.LEARNING, List.of(), List.of(), List.of());
    }

    /**
     * The state after applying a response: rank replaced when one was granted, request id
     * appended to the approved or rejected list.
     */
    public ApprovalState apply(ApprovalResponse response) {
        TrustRank rank = response.trustRank() != null ? response.trustRank() : trustRank;
        List<String> approved = approvedRequests;
        List<String> rejected = rejectedRequests;
        if (response.approved()) {
            approved = new ArrayList<>(approvedRequests);
            approved.add(response.requestId());
        } else {
            rejected = new ArrayList<>(rejectedRequests);
            rejected.add(response.requestId());
        }
        return new ApprovalState(rank, autoApprovalCategories, approved, rejected);
    }
}

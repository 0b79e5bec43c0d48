package com.gatekeeper.core.approval;

import com.gatekeeper.core.model.ApprovalCategory;

/**
 * Per-request overrides.
 *
 * @param category explicit category; when null the classifier's suggestion is used
 */
public record ApprovalOptions(ApprovalCategory category) {

    public static ApprovalOptions none() {
        return new ApprovalOptions(null);
    }

    public static ApprovalOptions category(ApprovalCategory category) {
        return new ApprovalOptions(category);
    }
}

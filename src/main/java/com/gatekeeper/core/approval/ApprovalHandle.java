package com.gatekeeper.core.approval;

import com.gatekeeper.core.model.ApprovalResponse;
import com.gatekeeper.core.model.RequestState;
import com.gatekeeper.core.model.RiskAssessmentResult;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Caller's view of one approval request.
 * <p>
 * The {@link #response()} future completes when the request is answered, times out, or is
 * auto-resolved; it is cancelled when the request is cancelled. Waiting on it never blocks
 * the coordinator.
 */
public final class ApprovalHandle {

    private final String requestId;
    private final RiskAssessmentResult assessment;
    private final CompletableFuture<ApprovalResponse> response;
    private volatile RequestState state = RequestState.CREATED;

    ApprovalHandle(String requestId, RiskAssessmentResult assessment) {
        this.requestId = requestId;
        this.assessment = assessment;
        this.response = new CompletableFuture<>();
    }

    public String requestId() {
        return requestId;
    }

    /** Empty when scoring was skipped because the coordinator is disabled. */
    public Optional<RiskAssessmentResult> assessment() {
        return Optional.ofNullable(assessment);
    }

    public CompletableFuture<ApprovalResponse> response() {
        return response;
    }

    public RequestState state() {
        return state;
    }

    public boolean isPending() {
        return state == RequestState.PENDING;
    }

    void transition(RequestState next) {
        this.state = next;
    }
}

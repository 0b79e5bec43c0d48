package com.gatekeeper.core.events;

/**
 * Event type names and the payload keys each one carries.
 */
public final class EventTypes {

    private EventTypes() {}

    /** Payload: request (ApprovalRequest), assessment (RiskAssessmentResult). */
    public static final String REQUEST_CREATED = "request.created";
    /** Payload: request (ApprovalRequest), response (ApprovalResponse). */
    public static final String REQUEST_RESPONDED = "request.responded";
    /** Payload: request (ApprovalRequest), response (ApprovalResponse). */
    public static final String REQUEST_TIMED_OUT = "request.timed_out";
    /** Payload: request (ApprovalRequest). */
    public static final String REQUEST_CANCELLED = "request.cancelled";
    /** Payload: response (ApprovalResponse), reason (String); assessment, category, context when scored. */
    public static final String AUTO_APPROVAL = "approval.auto";
    /** Payload: oldRank, newRank (TrustRank), reason (String), automatic (Boolean). */
    public static final String TRUST_CHANGED = "trust.changed";

    /** Payload: commit (Commit), branch (String). */
    public static final String COMMIT_CREATED = "commit.created";
    /** Payload: branch (Branch). */
    public static final String BRANCH_CREATED = "branch.created";
    /** Payload: name (String). */
    public static final String BRANCH_DELETED = "branch.deleted";
    /** Payload: mergeRequest (MergeRequest). */
    public static final String MERGE_REQUEST_CREATED = "merge_request.created";
    /** Payload: mergeRequest (MergeRequest). */
    public static final String MERGE_REQUEST_UPDATED = "merge_request.updated";
    /** Payload: sourceBranch, targetBranch (String), mergeCommit (Commit). */
    public static final String MERGE_COMPLETED = "merge.completed";
    /** Payload: name, commitId (String). */
    public static final String TAG_CREATED = "tag.created";
}

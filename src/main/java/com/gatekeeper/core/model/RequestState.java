package com.gatekeeper.core.model;

/**
 * Lifecycle state of an approval request.
 */
public enum RequestState {
    CREATED,
    AUTO_RESOLVED,
    PENDING,
    RESPONDED,
    TIMED_OUT,
    CANCELLED,
    CLOSED
}

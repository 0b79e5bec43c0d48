package com.gatekeeper.core.error;

/**
 * Thrown when an operation is not valid in the current state, e.g. tagging with no commits
 * or merging a branch that is missing.
 */
public class StateException extends GatekeeperException {

    public StateException(String message) {
        super(message);
    }

    public StateException(String message, Throwable cause) {
        super(message, cause);
    }
}

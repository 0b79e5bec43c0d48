package com.gatekeeper.core.error;

/**
 * Thrown when a request id, branch, commit, merge request or tag does not exist.
 */
public class NotFoundException extends GatekeeperException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException request(String requestId) {
        return new NotFoundException("Approval request " + requestId + " not found");
    }

    public static NotFoundException branch(String name) {
        return new NotFoundException("Branch '" + name + "' does not exist");
    }

    public static NotFoundException commit(String commitId) {
        return new NotFoundException("Commit '" + commitId + "' not found");
    }

    public static NotFoundException mergeRequest(String id) {
        return new NotFoundException("Merge request '" + id + "' not found");
    }

    public static NotFoundException tag(String name) {
        return new NotFoundException("Tag '" + name + "' not found");
    }
}

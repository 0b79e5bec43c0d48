package com.gatekeeper.core.error;

/**
 * Base for the logic errors raised by the approval coordinator and the history store.
 * These are never retried; the caller decides how to surface them.
 */
public abstract class GatekeeperException extends RuntimeException {

    protected GatekeeperException(String message) {
        super(message);
    }

    protected GatekeeperException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.gatekeeper.core.error;

/**
 * Thrown on a name collision without force, or when a protected or default branch would be removed.
 */
public class ConflictException extends GatekeeperException {

    public ConflictException(String message) {
        super(message);
    }
}

package com.gatekeeper.history.model;

import java.io.Serializable;

/**
 * Who recorded a commit.
 */
public record Author(String name, String email) implements Serializable {

    /** Renders as {@code name <email>}. */
    public String identity() {
        return name + " <" + email + ">";
    }
}

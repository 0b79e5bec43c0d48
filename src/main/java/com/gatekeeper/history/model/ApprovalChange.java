package com.gatekeeper.history.model;

import java.io.Serializable;

/**
 * One entry in a commit's change list.
 *
 * @param path        the state field touched, e.g. {@code trust-level}
 * @param operation   add, remove or modify
 * @param oldValue    previous value rendered as text (nullable)
 * @param newValue    new value rendered as text (nullable)
 * @param description human-readable line, joined into the diff summary
 */
public record ApprovalChange(
    String path,
    ChangeOperation operation,
    String oldValue,
    String newValue,
    String description
) implements Serializable {}

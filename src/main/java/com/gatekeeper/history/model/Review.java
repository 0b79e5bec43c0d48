package com.gatekeeper.history.model;

import java.io.Serializable;
import java.time.Instant;

public record Review(
    String id,
    String reviewer,
    ReviewStatus status,
    String comment,
    Instant timestamp
) implements Serializable {}

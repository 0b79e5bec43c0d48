package com.gatekeeper.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How much autonomy a requester has earned, lowest to highest.
 * <p>
 * Ordering is defined by an explicit {@code level}, never by declaration order.
 */
public enum TrustRank {
    NOVICE("novice", 0),
    LEARNING("learning", 1),
    COLLABORATIVE("collaborative", 2),
    TRUSTED("trusted", 3),
    AUTONOMOUS("autonomous", 4);

    private final String label;
    private final int level;

    TrustRank(String label, int level) {
        this.label = label;
        this.level = level;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int level() {
        return level;
    }

    public int compareRank(TrustRank other) {
        return Integer.compare(level, other.level);
    }

    public boolean isAtLeast(TrustRank other) {
        return compareRank(other) >= 0;
    }

    public boolean isAbove(TrustRank other) {
        return compareRank(other) > 0;
    }

    @JsonCreator
    public static TrustRank fromLabel(String value) {
        for (TrustRank rank : values()) {
            if (rank.label.equalsIgnoreCase(value) || rank.name().equalsIgnoreCase(value)) {
                return rank;
            }
        }
        throw new IllegalArgumentException("Unknown trust rank: " + value);
    }
}

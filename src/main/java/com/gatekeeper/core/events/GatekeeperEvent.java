package com.gatekeeper.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle notification published by the approval coordinator or the history store.
 *
 * @param eventType one of the {@link EventTypes} constants
 * @param subjectId what the event is about: a request id, a branch name, or a commit id
 * @param payload   typed values for the event kind; see {@link EventTypes} for the keys
 * @param timestamp when the event occurred
 */
public record GatekeeperEvent(
    String eventType,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public GatekeeperEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    /**
     * Typed payload lookup. Returns null when the key is absent.
     */
    public <T> T get(String key, Class<T> type) {
        Object value = payload.get(key);
        return value != null ? type.cast(value) : null;
    }
}

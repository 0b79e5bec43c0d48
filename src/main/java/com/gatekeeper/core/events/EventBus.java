package com.gatekeeper.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub channel for approval and history notifications.
 * <p>
 * Supports per-subject subscriptions (a request id or a branch name) and global
 * subscriptions that receive every event. Thread-safe for concurrent publish and subscribe.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-subject subscribers keyed by subjectId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<GatekeeperEvent>>> subjectSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<GatekeeperEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (subject-specific first, then global).
     */
    public void publish(GatekeeperEvent event) {
        log.debug("Publishing event: {} for {}", event.eventType(), event.subjectId());

        List<Consumer<GatekeeperEvent>> subjectSubs = event.subjectId() != null
                ? subjectSubscribers.get(event.subjectId())
                : null;
        if (subjectSubs != null) {
            for (Consumer<GatekeeperEvent> subscriber : subjectSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<GatekeeperEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public void publish(String eventType, String subjectId, Map<String, Object> payload) {
        publish(new GatekeeperEvent(eventType, subjectId, payload, Instant.now()));
    }

    /**
     * Subscribe to events for one subject.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String subjectId, Consumer<GatekeeperEvent> consumer) {
        subjectSubscribers.computeIfAbsent(subjectId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to {}", subjectId);
        return () -> subjectSubscribers.computeIfPresent(subjectId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Subscribe to every event regardless of subject.
     */
    public Subscription subscribeAll(Consumer<GatekeeperEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<GatekeeperEvent> subscriber, GatekeeperEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}

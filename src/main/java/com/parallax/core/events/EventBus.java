package com.parallax.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-memory event log with pub/sub delivery.
 * <p>
 * Assigns a global, strictly increasing sequence to every appended event,
 * retains each session's events in append order, and notifies per-session and
 * global subscribers. Thread-safe for concurrent append and subscribe.
 */
@Service
public class EventBus implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final AtomicLong sequence = new AtomicLong();

    /** Event history keyed by session id. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<ParallaxEvent>> history =
            new ConcurrentHashMap<>();

    /** Per-session subscribers keyed by session id. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ParallaxEvent>>> sessionSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all sessions. */
    private final CopyOnWriteArrayList<Consumer<ParallaxEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    @Override
    public ParallaxEvent append(String aggregateId, String eventType, Map<String, Object> payload) {
        var sessionLog = history.computeIfAbsent(aggregateId, k -> new CopyOnWriteArrayList<>());
        ParallaxEvent event;
        // sequence assignment and history append must happen together so history stays ordered
        synchronized (sessionLog) {
            event = new ParallaxEvent(sequence.incrementAndGet(), aggregateId, eventType, payload, Instant.now());
            sessionLog.add(event);
        }
        log.debug("Appended event #{} {} for session {}", event.sequence(), eventType, aggregateId);

        List<Consumer<ParallaxEvent>> sessionSubs = sessionSubscribers.get(aggregateId);
        if (sessionSubs != null) {
            for (Consumer<ParallaxEvent> subscriber : sessionSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<ParallaxEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
        return event;
    }

    /**
     * Events appended for a session, in sequence order.
     */
    public List<ParallaxEvent> history(String aggregateId) {
        var sessionLog = history.get(aggregateId);
        return sessionLog != null ? List.copyOf(sessionLog) : List.of();
    }

    /**
     * Subscribe to events for a specific session.
     *
     * @param aggregateId the session to subscribe to
     * @param consumer    callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String aggregateId, Consumer<ParallaxEvent> consumer) {
        sessionSubscribers.computeIfAbsent(aggregateId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to session {}", aggregateId);
        return () -> {
            CopyOnWriteArrayList<Consumer<ParallaxEvent>> subs = sessionSubscribers.get(aggregateId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all sessions.
     */
    public Subscription subscribeAll(Consumer<ParallaxEvent> consumer) {
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

    private void deliverSafely(Consumer<ParallaxEvent> subscriber, ParallaxEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}

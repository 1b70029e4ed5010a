package com.parallax.core.ledger;

import com.parallax.core.events.EventStore;
import com.parallax.core.events.ParallaxEvent;

import java.util.Map;

/**
 * Appends a node's events for one session and folds each one into the
 * node's working copy of the ledger as it is emitted.
 */
public class SessionEvents {

    private final EventStore eventStore;
    private final String sessionId;
    private ExecutionLedger ledger;

    public SessionEvents(EventStore eventStore, String sessionId, ExecutionLedger ledger) {
        this.eventStore = eventStore;
        this.sessionId = sessionId;
        this.ledger = ledger != null ? ledger : ExecutionLedger.empty(sessionId);
    }

    public synchronized ParallaxEvent emit(String eventType, Map<String, Object> payload) {
        var event = eventStore.append(sessionId, eventType, payload);
        ledger = ledger.apply(event);
        return event;
    }

    public synchronized ExecutionLedger ledger() {
        return ledger;
    }
}

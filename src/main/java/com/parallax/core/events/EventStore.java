package com.parallax.core.events;

import java.util.Map;

/**
 * Write-only event log as seen by the engine. The engine never reads events
 * back; they exist for external observers.
 */
public interface EventStore {

    /**
     * Appends an event, assigning it the next sequence number.
     *
     * @param aggregateId session id
     * @param eventType   dotted event type
     * @param payload     JSON-serializable payload
     * @return the appended event
     */
    ParallaxEvent append(String aggregateId, String eventType, Map<String, Object> payload);
}

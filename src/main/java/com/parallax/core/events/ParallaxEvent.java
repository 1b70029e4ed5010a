package com.parallax.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An immutable event appended during session execution.
 *
 * @param sequence    monotonically increasing position in the event log
 * @param aggregateId the session this event belongs to
 * @param eventType   dotted event type, e.g. "level.started", "item.accepted"
 * @param payload     JSON-serializable data (strings, numbers, booleans, lists and maps of those)
 * @param timestamp   when the event was appended
 */
public record ParallaxEvent(
    long sequence,
    String aggregateId,
    String eventType,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public ParallaxEvent {
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    /** Reads an integer payload field, or -1 when absent. */
    public int intValue(String key) {
        Object value = payload.get(key);
        return value instanceof Number n ? n.intValue() : -1;
    }

    public String stringValue(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : "";
    }
}

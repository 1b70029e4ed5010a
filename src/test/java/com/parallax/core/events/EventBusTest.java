package com.parallax.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
    }

    @Test
    @DisplayName("Sequences increase strictly across sessions")
    void sequencesIncrease() {
        var a = bus.append("s1", EventTypes.SESSION_STARTED, Map.of("itemCount", 2));
        var b = bus.append("s2", EventTypes.SESSION_STARTED, Map.of("itemCount", 1));
        var c = bus.append("s1", EventTypes.LEVEL_STARTED, Map.of("levelNumber", 0));

        assertTrue(a.sequence() < b.sequence());
        assertTrue(b.sequence() < c.sequence());
        assertEquals(List.of(a, c), bus.history("s1"));
        assertEquals("s1", c.aggregateId());
        assertNotNull(c.timestamp());
    }

    @Test
    @DisplayName("Session subscribers only see their session; global subscribers see all")
    void subscriptions() {
        var session = new ArrayList<ParallaxEvent>();
        var global = new ArrayList<ParallaxEvent>();
        bus.subscribe("s1", session::add);
        bus.subscribeAll(global::add);

        bus.append("s1", EventTypes.ITEM_STARTED, Map.of());
        bus.append("s2", EventTypes.ITEM_STARTED, Map.of());

        assertEquals(1, session.size());
        assertEquals(2, global.size());
    }

    @Test
    @DisplayName("Unsubscribed consumers receive nothing further")
    void unsubscribe() {
        var received = new ArrayList<ParallaxEvent>();
        var subscription = bus.subscribe("s1", received::add);
        bus.append("s1", EventTypes.ITEM_STARTED, Map.of());

        subscription.unsubscribe();
        bus.append("s1", EventTypes.ITEM_ACCEPTED, Map.of());

        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("A throwing subscriber does not block the others")
    void throwingSubscriber() {
        var received = new ArrayList<ParallaxEvent>();
        bus.subscribe("s1", e -> { throw new IllegalStateException("boom"); });
        bus.subscribe("s1", received::add);

        bus.append("s1", EventTypes.ITEM_STARTED, Map.of());

        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("Payloads may carry null values and are immutable")
    void payloadCopy() {
        var payload = new HashMap<String, Object>();
        payload.put("reason", null);
        payload.put("itemIndex", 1);

        var event = bus.append("s1", EventTypes.ITEM_SKIPPED, payload);
        payload.put("itemIndex", 5);

        assertEquals(1, event.intValue("itemIndex"));
        assertEquals("", event.stringValue("reason"));
        assertThrows(UnsupportedOperationException.class, () -> event.payload().put("x", 1));
    }

    @Test
    @DisplayName("Concurrent appends keep session history in sequence order")
    void concurrentAppends() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        var latch = new CountDownLatch(400);
        var errors = new CopyOnWriteArrayList<Throwable>();
        for (int i = 0; i < 400; i++) {
            pool.submit(() -> {
                try {
                    bus.append("s1", EventTypes.ITEM_COMPLETED, Map.of());
                } catch (Throwable t) {
                    errors.add(t);
                } finally {
                    latch.countDown();
                }
            });
        }
        assertTrue(latch.await(10, TimeUnit.SECONDS));
        pool.shutdownNow();

        var history = bus.history("s1");
        assertTrue(errors.isEmpty());
        assertEquals(400, history.size());
        for (int i = 1; i < history.size(); i++) {
            assertTrue(history.get(i - 1).sequence() < history.get(i).sequence());
        }
    }
}

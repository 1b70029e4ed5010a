package com.parallax.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions whose cancellation was requested. Nodes poll it between and
 * during external calls.
 */
@Component
public class CancellationRegistry {

    private static final Logger log = LoggerFactory.getLogger(CancellationRegistry.class);

    private final Set<String> cancelled = ConcurrentHashMap.newKeySet();

    public void cancel(String sessionId) {
        if (cancelled.add(sessionId)) {
            log.info("Cancellation requested for session {}", sessionId);
        }
    }

    public boolean isCancelled(String sessionId) {
        return cancelled.contains(sessionId);
    }

    public void clear(String sessionId) {
        cancelled.remove(sessionId);
    }
}

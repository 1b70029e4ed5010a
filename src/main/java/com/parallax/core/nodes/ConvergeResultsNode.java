package com.parallax.core.nodes;

import com.parallax.core.engine.CancellationRegistry;
import com.parallax.core.events.EventStore;
import com.parallax.core.events.EventTypes;
import com.parallax.core.ledger.SessionEvents;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.model.ItemStatus;
import com.parallax.core.model.SessionMetrics;
import com.parallax.core.model.SessionStatus;
import com.parallax.core.state.ParallaxState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Final node. Derives the session status from the ledger, computes the
 * session metrics and emits the closing event.
 */
@Component
public class ConvergeResultsNode {

    private static final Logger log = LoggerFactory.getLogger(ConvergeResultsNode.class);

    private final EventStore eventStore;
    private final CancellationRegistry cancellations;
    private final ParallaxMetrics metrics;

    @Autowired
    public ConvergeResultsNode(EventStore eventStore, CancellationRegistry cancellations,
                               @Autowired(required = false) ParallaxMetrics metrics) {
        this.eventStore = eventStore;
        this.cancellations = cancellations;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ParallaxState state) {
        String sessionId = state.sessionId();
        var events = new SessionEvents(eventStore, sessionId, state.ledger());
        var ledger = events.ledger();

        int total = ledger.items().size();
        int accepted = ledger.indicesWithStatus(ItemStatus.ACCEPTED).size();
        int failed = ledger.indicesWithStatus(ItemStatus.FAILED).size();
        int skipped = ledger.indicesWithStatus(ItemStatus.SKIPPED).size();
        int detected = 0;
        int resolved = 0;
        for (var context : state.levelContexts()) {
            if (context.review() != null) {
                detected += context.review().conflicts().size();
                resolved += (int) context.review().resolvedCount();
            }
        }
        long started = state.startedAtMillis();
        long duration = started > 0 ? System.currentTimeMillis() - started : 0;
        var sessionMetrics = new SessionMetrics(total, accepted, failed, skipped, ledger.levelsCompleted(),
                ledger.totalAttempts(), detected, resolved, duration);

        SessionStatus status;
        if (cancellations.isCancelled(sessionId)) {
            status = SessionStatus.CANCELLED;
            events.emit(EventTypes.SESSION_CANCELLED, Map.of(
                    "accepted", accepted,
                    "levelNumber", state.levelNumber()));
        } else {
            if (accepted == total) {
                status = SessionStatus.COMPLETED;
            } else if (accepted > 0) {
                status = SessionStatus.PARTIAL;
            } else {
                status = SessionStatus.FAILED;
            }
            events.emit(EventTypes.SESSION_COMPLETED, Map.of(
                    "status", status.name(),
                    "accepted", accepted,
                    "failed", failed,
                    "skipped", skipped,
                    "levels", ledger.levelsCompleted(),
                    "attempts", ledger.totalAttempts(),
                    "durationMs", duration));
        }
        if (metrics != null) {
            metrics.recordSessionResult(status.name());
        }
        log.info("Session {} {}: {}/{} accepted, {} failed, {} skipped, {} attempt(s), {} conflict(s) ({} resolved) in {}ms",
                sessionId, status, accepted, total, failed, skipped, ledger.totalAttempts(),
                detected, resolved, duration);

        return Map.of(
                "status", status.name(),
                "metrics", sessionMetrics,
                "ledger", events.ledger());
    }
}

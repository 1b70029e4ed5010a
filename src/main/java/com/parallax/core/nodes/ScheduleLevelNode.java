package com.parallax.core.nodes;

import com.parallax.core.events.EventStore;
import com.parallax.core.events.EventTypes;
import com.parallax.core.execution.ExecutionProperties;
import com.parallax.core.ledger.SessionEvents;
import com.parallax.core.logging.MdcContext;
import com.parallax.core.model.DependencyGraph;
import com.parallax.core.model.ItemStatus;
import com.parallax.core.model.LevelContext;
import com.parallax.core.state.ParallaxState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Advances to the next level that has runnable items.
 * <p>
 * Items whose prerequisites ended FAILED or SKIPPED are skipped; a level left
 * with nothing to run is passed over. Past the last level, or once the
 * iteration cap is reached, no items are scheduled and the graph converges.
 */
@Component
public class ScheduleLevelNode {

    private static final Logger log = LoggerFactory.getLogger(ScheduleLevelNode.class);

    private final EventStore eventStore;
    private final int maxLevelPasses;

    @Autowired
    public ScheduleLevelNode(EventStore eventStore, ExecutionProperties properties) {
        this(eventStore, properties.getMaxLevelPasses());
    }

    ScheduleLevelNode(EventStore eventStore, int maxLevelPasses) {
        this.eventStore = eventStore;
        this.maxLevelPasses = maxLevelPasses;
    }

    public Map<String, Object> apply(ParallaxState state) {
        String sessionId = state.sessionId();
        var graph = state.dependencyGraph()
                .orElseThrow(() -> new IllegalStateException("No dependency graph for session " + sessionId));
        var events = new SessionEvents(eventStore, sessionId, state.ledger());

        var updates = new HashMap<String, Object>();
        updates.put("levelTraces", List.of());
        updates.put("executionFailures", Map.of());

        int next = state.levelNumber() + 1;
        if (next < graph.levelCount() && state.levelPasses() >= maxLevelPasses) {
            log.warn("Session {}: iteration cap of {} level passes reached before level {}",
                    sessionId, maxLevelPasses, next);
            ItemTransitions.failNonTerminal(events, ItemTransitions.ITERATION_CAP_REACHED);
            next = graph.levelCount();
        }

        List<Integer> runnable = List.of();
        while (next < graph.levelCount()) {
            runnable = runnableItems(graph, next, events);
            if (!runnable.isEmpty()) {
                break;
            }
            log.info("Session {}: level {} has nothing left to run, moving on", sessionId, next);
            next++;
        }

        updates.put("levelNumber", next);
        updates.put("pendingItems", runnable);
        updates.put("currentLevelContext", new LevelContext(next, List.of(), null));
        if (!runnable.isEmpty()) {
            MdcContext.setLevel(sessionId, next);
            events.emit(EventTypes.LEVEL_STARTED, Map.of(
                    "levelNumber", next,
                    "items", runnable));
            log.info("Session {}: level {} scheduled with items {}", sessionId, next, runnable);
        } else {
            log.info("Session {}: no levels left to schedule", sessionId);
        }
        updates.put("ledger", events.ledger());
        return updates;
    }

    private List<Integer> runnableItems(DependencyGraph graph, int levelNumber, SessionEvents events) {
        var runnable = new ArrayList<Integer>();
        for (int index : graph.levels().get(levelNumber)) {
            var ledger = events.ledger();
            if (ledger.item(index).status() != ItemStatus.PENDING) {
                continue;
            }
            Integer blocker = null;
            for (int dep : graph.node(index).dependsOn()) {
                var depStatus = ledger.item(dep).status();
                if (depStatus == ItemStatus.FAILED || depStatus == ItemStatus.SKIPPED) {
                    blocker = dep;
                    break;
                }
            }
            if (blocker != null) {
                String reason = "Prerequisite item " + blocker + " ended " + ledger.item(blocker).status();
                log.info("Item {} DENIED: {}", index, reason);
                events.emit(EventTypes.ITEM_SKIPPED, Map.of(
                        "itemIndex", index,
                        "blockedBy", blocker,
                        "reason", reason));
            } else {
                runnable.add(index);
            }
        }
        return runnable;
    }
}

package com.parallax.core.nodes;

import com.parallax.core.coordination.LevelCoordinator;
import com.parallax.core.engine.CancellationRegistry;
import com.parallax.core.state.ParallaxState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Coordinates the traces of the level pass that just finished and merges the
 * result into the level's running context. Conflict resolution runs at most
 * once per level, however many retry passes the level takes.
 */
@Component
public class CoordinateLevelNode {

    private static final Logger log = LoggerFactory.getLogger(CoordinateLevelNode.class);

    private final LevelCoordinator coordinator;
    private final CancellationRegistry cancellations;

    public CoordinateLevelNode(LevelCoordinator coordinator, CancellationRegistry cancellations) {
        this.coordinator = coordinator;
        this.cancellations = cancellations;
    }

    public Map<String, Object> apply(ParallaxState state) {
        String sessionId = state.sessionId();
        int level = state.levelNumber();
        if (cancellations.isCancelled(sessionId)) {
            log.info("Session {} cancelled, skipping coordination of level {}", sessionId, level);
            return Map.of();
        }

        var spec = state.specification();
        var traces = state.levelTraces();
        var itemTexts = new HashMap<Integer, String>();
        for (var trace : traces) {
            itemTexts.put(trace.itemIndex(), spec.workItem(trace.itemIndex()));
        }
        boolean allowResolution = !state.resolvedLevels().contains(level);

        var context = coordinator.coordinate(sessionId, level, traces, itemTexts, allowResolution);
        var merged = state.currentLevelContext().mergedWith(context);

        var updates = new HashMap<String, Object>();
        updates.put("currentLevelContext", merged);
        if (context.hasReview() && allowResolution) {
            updates.put("resolvedLevels", List.of(level));
        }
        return updates;
    }
}

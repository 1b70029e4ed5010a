package com.parallax.core.nodes;

import com.parallax.core.events.EventBus;
import com.parallax.core.events.EventTypes;
import com.parallax.core.ledger.SessionEvents;
import com.parallax.core.model.DependencyGraph;
import com.parallax.core.model.WorkItemNode;
import com.parallax.core.model.Specification;
import com.parallax.core.state.ParallaxState;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds node input states over a real event bus so the ledger is always a
 * fold of emitted events.
 */
final class Sessions {

    static final String SESSION = "s1";

    private Sessions() {}

    /** Diamond: 0 -> {1, 2} -> 3. */
    static DependencyGraph diamond(Specification spec) {
        return new DependencyGraph(List.of(
                new WorkItemNode(0, spec.workItem(0), Set.of()),
                new WorkItemNode(1, spec.workItem(1), Set.of(0)),
                new WorkItemNode(2, spec.workItem(2), Set.of(0)),
                new WorkItemNode(3, spec.workItem(3), Set.of(1, 2))),
                List.of(List.of(0), List.of(1, 2), List.of(3)), false);
    }

    static SessionEvents started(EventBus bus, int itemCount) {
        var events = new SessionEvents(bus, SESSION, null);
        events.emit(EventTypes.SESSION_STARTED, Map.of("itemCount", itemCount));
        return events;
    }

    static void attempt(SessionEvents events, int item, int attempt) {
        events.emit(EventTypes.ITEM_STARTED, Map.of("itemIndex", item, "attempt", attempt, "lateralThinking", false));
    }

    static void rejected(SessionEvents events, int item, int attempt, String reason) {
        events.emit(EventTypes.ITEM_REJECTED, Map.of("itemIndex", item, "attempt", attempt, "stage", 2,
                "reasons", List.of(reason)));
    }

    static ParallaxState state(Specification spec, DependencyGraph graph, SessionEvents events,
                               Map<String, Object> extra) {
        var data = new HashMap<String, Object>();
        data.put("sessionId", SESSION);
        data.put("specification", spec);
        data.put("dependencyGraph", graph);
        data.put("ledger", events.ledger());
        data.putAll(extra);
        return new ParallaxState(data);
    }
}

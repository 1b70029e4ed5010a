package com.parallax.core.nodes;

import com.parallax.core.events.EventStore;
import com.parallax.core.events.EventTypes;
import com.parallax.core.ledger.SessionEvents;
import com.parallax.core.logging.MdcContext;
import com.parallax.core.model.SessionStatus;
import com.parallax.core.scheduler.DependencyAnalyzer;
import com.parallax.core.state.ParallaxState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Infers the dependency graph of the specification's work items.
 */
@Component
public class AnalyzeDependenciesNode {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeDependenciesNode.class);

    private final DependencyAnalyzer analyzer;
    private final EventStore eventStore;

    public AnalyzeDependenciesNode(DependencyAnalyzer analyzer, EventStore eventStore) {
        this.analyzer = analyzer;
        this.eventStore = eventStore;
    }

    public Map<String, Object> apply(ParallaxState state) {
        String sessionId = state.sessionId();
        MdcContext.setSession(sessionId);
        var spec = state.specification();
        var events = new SessionEvents(eventStore, sessionId, state.ledger());

        var graph = analyzer.analyze(spec.workItems());
        if (graph.degraded()) {
            events.emit(EventTypes.DEPENDENCY_ANALYSIS_DEGRADED, Map.of(
                    "itemCount", spec.workItems().size(),
                    "reason", "dependency analysis unavailable, all items in one level"));
        }
        events.emit(EventTypes.DEPENDENCY_GRAPH_BUILT, Map.of(
                "itemCount", spec.workItems().size(),
                "levelCount", graph.levelCount(),
                "levels", graph.levels(),
                "degraded", graph.degraded()));
        log.info("Session {}: {} item(s) in {} level(s){}", sessionId, spec.workItems().size(),
                graph.levelCount(), graph.degraded() ? " (degraded)" : "");

        return Map.of(
                "dependencyGraph", graph,
                "ledger", events.ledger(),
                "status", SessionStatus.EXECUTING.name());
    }
}

package com.parallax.core.engine;

import com.parallax.core.events.EventStore;
import com.parallax.core.events.EventTypes;
import com.parallax.core.graph.ParallaxGraph;
import com.parallax.core.ledger.ExecutionLedger;
import com.parallax.core.ledger.SessionEvents;
import com.parallax.core.logging.MdcContext;
import com.parallax.core.model.SessionStatus;
import com.parallax.core.model.Specification;
import com.parallax.core.spec.SpecificationValidator;
import com.parallax.core.state.ParallaxState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for running a specification: validates it, opens the session's
 * event stream and drives the compiled graph to completion.
 */
@Service
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);
    private static final AtomicInteger SESSION_COUNTER = new AtomicInteger(0);

    private final ParallaxGraph graph;
    private final SpecificationValidator validator;
    private final EventStore eventStore;
    private final CancellationRegistry cancellations;

    public ExecutionEngine(ParallaxGraph graph, SpecificationValidator validator, EventStore eventStore,
                           CancellationRegistry cancellations) {
        this.graph = graph;
        this.validator = validator;
        this.eventStore = eventStore;
        this.cancellations = cancellations;
    }

    public ParallaxState run(Specification spec) {
        return run(generateSessionId(), spec);
    }

    /**
     * Runs a specification under the given session id.
     *
     * @return the final graph state
     * @throws com.parallax.core.spec.InvalidSpecificationException when the specification is incomplete
     */
    public ParallaxState run(String sessionId, Specification spec) {
        validator.validate(spec);
        MdcContext.setSession(sessionId);
        try {
            log.info("Starting session {} for spec '{}' ({} items, kind {})", sessionId, spec.specId(),
                    spec.workItems().size(), spec.taskKind());
            var events = new SessionEvents(eventStore, sessionId, ExecutionLedger.empty(sessionId));
            events.emit(EventTypes.SESSION_STARTED, Map.of(
                    "specId", spec.specId(),
                    "itemCount", spec.workItems().size(),
                    "taskKind", spec.taskKind().name()));

            var stateMap = new HashMap<String, Object>();
            stateMap.put("sessionId", sessionId);
            stateMap.put("specification", spec);
            stateMap.put("ledger", events.ledger());
            stateMap.put("status", SessionStatus.ANALYZING.name());
            stateMap.put("startedAtMillis", System.currentTimeMillis());

            var config = RunnableConfig.builder()
                    .threadId(sessionId)
                    .build();

            var result = graph.getCompiledGraph().invoke(Map.copyOf(stateMap), config);
            return result.orElseThrow(() ->
                    new IllegalStateException("Graph execution returned empty state for session " + sessionId));
        } finally {
            cancellations.clear(sessionId);
            MdcContext.clear();
        }
    }

    /**
     * Requests cancellation. The in-flight level stops waiting, late results
     * are discarded and the session ends CANCELLED.
     */
    public void cancel(String sessionId) {
        cancellations.cancel(sessionId);
    }

    /**
     * Generates a session id in the format PLX-YYYY-NNNN.
     */
    public String generateSessionId() {
        int count = SESSION_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("PLX-%d-%04d", year, count);
    }
}

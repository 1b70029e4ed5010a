package com.parallax.core.nodes;

import com.parallax.core.engine.CancellationRegistry;
import com.parallax.core.evaluation.EvaluationContext;
import com.parallax.core.evaluation.EvaluationPipeline;
import com.parallax.core.events.EventStore;
import com.parallax.core.events.EventTypes;
import com.parallax.core.execution.ExecutionProperties;
import com.parallax.core.ledger.SessionEvents;
import com.parallax.core.logging.MdcContext;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.model.EvaluationVerdict;
import com.parallax.core.model.ItemStatus;
import com.parallax.core.scheduler.FailurePatternDetector;
import com.parallax.core.state.ParallaxState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Runs the evaluation pipeline over every trace of the level pass and decides
 * each item's fate: accepted, retried within its attempt budget, or failed
 * with every reason gathered across its attempts. Items that will be retried
 * become the next pass of the same level; otherwise the level is closed.
 */
@Component
public class EvaluateLevelNode {

    private static final Logger log = LoggerFactory.getLogger(EvaluateLevelNode.class);

    private final EvaluationPipeline pipeline;
    private final EventStore eventStore;
    private final CancellationRegistry cancellations;
    private final int maxAttempts;
    private final int maxLevelPasses;
    private final ParallaxMetrics metrics;

    @Autowired
    public EvaluateLevelNode(EvaluationPipeline pipeline, EventStore eventStore, CancellationRegistry cancellations,
                             ExecutionProperties properties,
                             @Autowired(required = false) ParallaxMetrics metrics) {
        this(pipeline, eventStore, cancellations, properties.getMaxAttempts(), properties.getMaxLevelPasses(), metrics);
    }

    EvaluateLevelNode(EvaluationPipeline pipeline, EventStore eventStore, CancellationRegistry cancellations,
                      int maxAttempts, int maxLevelPasses, ParallaxMetrics metrics) {
        this.pipeline = pipeline;
        this.eventStore = eventStore;
        this.cancellations = cancellations;
        this.maxAttempts = maxAttempts;
        this.maxLevelPasses = maxLevelPasses;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ParallaxState state) {
        String sessionId = state.sessionId();
        int level = state.levelNumber();
        if (cancellations.isCancelled(sessionId)) {
            log.info("Session {} cancelled, skipping evaluation of level {}", sessionId, level);
            return Map.of("pendingItems", List.of());
        }
        MdcContext.setLevel(sessionId, level);
        var spec = state.specification();
        var events = new SessionEvents(eventStore, sessionId, state.ledger());
        var failures = state.executionFailures();

        var toDecide = new TreeSet<>(failures.keySet());
        for (var trace : state.levelTraces()) {
            int index = trace.itemIndex();
            if (failures.containsKey(index)) {
                continue;
            }
            var record = events.ledger().item(index);
            var context = new EvaluationContext(sessionId, spec, index, spec.workItem(index), trace,
                    record.attempts(), record.history(), record.lateralThinking(), null, null);
            var verdict = pipeline.evaluate(context);
            if (verdict.approved()) {
                events.emit(EventTypes.ITEM_ACCEPTED, Map.of(
                        "itemIndex", index,
                        "attempt", record.attempts(),
                        "stage", verdict.highestStageCompleted().number(),
                        "reducedConfidence", verdict.reducedConfidence()));
                if (metrics != null) {
                    metrics.recordAttempts(record.attempts());
                }
            } else {
                events.emit(EventTypes.ITEM_REJECTED, rejectionPayload(verdict, record.attempts()));
                toDecide.add(index);
            }
        }

        var retries = new ArrayList<Integer>();
        for (int index : toDecide) {
            var record = events.ledger().item(index);
            if (record.attempts() < maxAttempts) {
                boolean lateral = FailurePatternDetector.needsLateralThinking(record.history());
                var last = record.history().isEmpty() ? null : record.history().get(record.history().size() - 1);
                String reason = last != null && !last.reasons().isEmpty() ? last.reasons().get(0) : "not accepted";
                events.emit(EventTypes.ITEM_RETRY_SCHEDULED, Map.of(
                        "itemIndex", index,
                        "nextAttempt", record.attempts() + 1,
                        "lateralThinking", lateral,
                        "reason", reason));
                if (lateral) {
                    log.info("Item {} failing the same way repeatedly, switching to lateral thinking", index);
                }
                if (metrics != null) {
                    metrics.incrementRetries(last != null ? last.stageReached().name().toLowerCase() : "execution");
                }
                retries.add(index);
            } else {
                String exhausted = "Attempt budget exhausted (" + record.attempts() + "/" + maxAttempts + ")";
                log.warn("Item {} DENIED permanently: {}; reasons: {}", index, exhausted, record.reasons());
                events.emit(EventTypes.ITEM_FAILED, Map.of(
                        "itemIndex", index,
                        "reasons", List.of(exhausted)));
                if (metrics != null) {
                    metrics.recordAttempts(record.attempts());
                }
            }
        }

        var updates = new HashMap<String, Object>();
        if (!retries.isEmpty() && state.levelPasses() >= maxLevelPasses) {
            log.warn("Session {}: iteration cap of {} level passes reached with items {} still retrying",
                    sessionId, maxLevelPasses, retries);
            ItemTransitions.failNonTerminal(events, ItemTransitions.ITERATION_CAP_REACHED);
            retries.clear();
        }

        if (retries.isEmpty()) {
            closeLevel(state, events, level);
            updates.put("levelContexts", List.of(state.currentLevelContext()));
        } else {
            log.info("Level {}: retrying items {}", level, retries);
        }
        updates.put("pendingItems", retries);
        updates.put("ledger", events.ledger());
        return updates;
    }

    private void closeLevel(ParallaxState state, SessionEvents events, int level) {
        var ledger = events.ledger();
        var levelItems = state.dependencyGraph().map(g -> g.levels().get(level)).orElse(List.of());
        int accepted = 0;
        int failed = 0;
        for (int index : levelItems) {
            var status = ledger.item(index).status();
            if (status == ItemStatus.ACCEPTED) {
                accepted++;
            } else if (status == ItemStatus.FAILED || status == ItemStatus.SKIPPED) {
                failed++;
            }
        }
        var review = state.currentLevelContext().review();
        events.emit(EventTypes.LEVEL_COMPLETED, Map.of(
                "levelNumber", level,
                "accepted", accepted,
                "failed", failed,
                "conflicts", review != null ? review.conflicts().size() : 0));
        log.info("Level {} complete: {} accepted, {} failed or skipped", level, accepted, failed);
    }

    private static Map<String, Object> rejectionPayload(EvaluationVerdict verdict, int attempt) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("itemIndex", verdict.itemIndex());
        payload.put("attempt", attempt);
        payload.put("stage", verdict.highestStageCompleted().number());
        payload.put("status", verdict.status().name());
        payload.put("reasons", verdict.reasons());
        if (verdict.semantic() != null) {
            payload.put("satisfaction", verdict.semantic().satisfaction());
            payload.put("uncertainty", verdict.semantic().uncertainty());
        }
        return payload;
    }
}

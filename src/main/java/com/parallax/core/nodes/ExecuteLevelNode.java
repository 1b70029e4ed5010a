package com.parallax.core.nodes;

import com.parallax.core.agent.AgentException;
import com.parallax.core.engine.CancellationRegistry;
import com.parallax.core.events.EventStore;
import com.parallax.core.events.EventTypes;
import com.parallax.core.execution.ExecutionProperties;
import com.parallax.core.execution.WorkItemExecutor;
import com.parallax.core.execution.WorkItemRequest;
import com.parallax.core.ledger.SessionEvents;
import com.parallax.core.logging.MdcContext;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.model.ExecutionTrace;
import com.parallax.core.state.ParallaxState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every pending item of the current level concurrently, bounded by a
 * semaphore at {@code maxParallel}, and waits for all of them before
 * returning. A timed-out item counts as a failed attempt. When the session is
 * cancelled mid-level the node stops waiting and discards whatever the
 * in-flight sessions return.
 */
@Component
public class ExecuteLevelNode {

    private static final Logger log = LoggerFactory.getLogger(ExecuteLevelNode.class);

    private static final long CANCEL_POLL_MILLIS = 200;

    private final WorkItemExecutor executor;
    private final EventStore eventStore;
    private final CancellationRegistry cancellations;
    private final ExecutorService pool;
    private final int maxParallel;
    private final Duration itemTimeout;
    private final ParallaxMetrics metrics;

    @Autowired
    public ExecuteLevelNode(WorkItemExecutor executor, EventStore eventStore, CancellationRegistry cancellations,
                            @Qualifier("parallaxExecutor") ExecutorService pool, ExecutionProperties properties,
                            @Autowired(required = false) ParallaxMetrics metrics) {
        this(executor, eventStore, cancellations, pool, properties.getMaxParallel(),
                Duration.ofSeconds(properties.getItemTimeoutSeconds()), metrics);
    }

    ExecuteLevelNode(WorkItemExecutor executor, EventStore eventStore, CancellationRegistry cancellations,
                     ExecutorService pool, int maxParallel, Duration itemTimeout, ParallaxMetrics metrics) {
        this.executor = executor;
        this.eventStore = eventStore;
        this.cancellations = cancellations;
        this.pool = pool;
        this.maxParallel = Math.max(1, maxParallel);
        this.itemTimeout = itemTimeout;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ParallaxState state) {
        String sessionId = state.sessionId();
        int level = state.levelNumber();
        MdcContext.setLevel(sessionId, level);
        var spec = state.specification();
        var graph = state.dependencyGraph()
                .orElseThrow(() -> new IllegalStateException("No dependency graph for session " + sessionId));
        var pending = state.pendingItems();
        var events = new SessionEvents(eventStore, sessionId, state.ledger());

        if (cancellations.isCancelled(sessionId)) {
            log.info("Session {} cancelled, level {} not dispatched", sessionId, level);
            return Map.of("levelTraces", List.of(), "pendingItems", List.of());
        }

        var contexts = new ArrayList<>(state.levelContexts());
        var semaphore = new Semaphore(maxParallel);
        var futures = new TreeMap<Integer, CompletableFuture<ExecutionTrace>>();
        var attempts = new HashMap<Integer, Integer>();
        long start = System.currentTimeMillis();

        for (int index : pending) {
            var record = events.ledger().item(index);
            int attempt = record.attempts() + 1;
            attempts.put(index, attempt);
            events.emit(EventTypes.ITEM_STARTED, Map.of(
                    "itemIndex", index,
                    "attempt", attempt,
                    "levelNumber", level,
                    "lateralThinking", record.lateralThinking()));
            var request = new WorkItemRequest(sessionId, spec, graph.node(index), contexts,
                    ItemTransitions.renderRetryFeedback(record.history()), record.lateralThinking(), attempt);
            log.info("Dispatching item {} (attempt {}{})", index, attempt,
                    record.lateralThinking() ? ", lateral thinking" : "");

            futures.put(index, CompletableFuture.supplyAsync(() -> {
                try {
                    semaphore.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CompletionException(e);
                }
                try {
                    // the deadline starts once the item holds a permit
                    return CompletableFuture.supplyAsync(() -> {
                        MdcContext.setItem(sessionId, index, spec.taskKind().name());
                        try {
                            return executor.execute(request);
                        } finally {
                            MdcContext.clear();
                        }
                    }, pool).orTimeout(itemTimeout.toMillis(), TimeUnit.MILLISECONDS).join();
                } finally {
                    semaphore.release();
                }
            }, pool));
        }

        if (!awaitAll(sessionId, futures.values())) {
            log.warn("Session {} cancelled during level {}, discarding {} in-flight result(s)",
                    sessionId, level, futures.size());
            return Map.of(
                    "levelTraces", List.of(),
                    "pendingItems", List.of(),
                    "levelPasses", state.levelPasses() + 1,
                    "ledger", events.ledger());
        }

        var traces = new ArrayList<ExecutionTrace>();
        var failures = new HashMap<Integer, String>();
        for (var entry : futures.entrySet()) {
            int index = entry.getKey();
            int attempt = attempts.get(index);
            try {
                var trace = entry.getValue().join();
                traces.add(trace);
                events.emit(EventTypes.ITEM_COMPLETED, Map.of(
                        "itemIndex", index,
                        "attempt", attempt,
                        "success", trace.success(),
                        "filesModified", trace.filesModified(),
                        "subItems", trace.subTraces().size(),
                        "durationMs", trace.durationMs()));
                if (!trace.success()) {
                    recordFailure(events, failures, index, attempt, "Agent session reported failure", false);
                }
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                boolean timedOut = cause instanceof TimeoutException;
                String reason = timedOut
                        ? "Execution timed out after " + itemTimeout.toSeconds() + "s"
                        : "Execution failed: " + cause.getMessage();
                if (cause instanceof AgentException agent && !agent.getPartialTraces().isEmpty()) {
                    // sub-items that did finish may have written files; keep them visible to the coordinator
                    traces.add(new ExecutionTrace(index, null, List.of(), "", "partial result of failed item",
                            false, agent.getPartialTraces(), 0));
                }
                log.warn("Item {} attempt {} failed: {}", index, attempt, reason);
                recordFailure(events, failures, index, attempt, reason, timedOut);
            }
        }

        long elapsed = System.currentTimeMillis() - start;
        if (metrics != null) {
            metrics.recordLevelDuration(pending.size(), elapsed);
        }
        log.info("Level {} pass complete: {} trace(s), {} failure(s) in {}ms",
                level, traces.size(), failures.size(), elapsed);

        return Map.of(
                "levelTraces", traces,
                "executionFailures", failures,
                "levelPasses", state.levelPasses() + 1,
                "ledger", events.ledger());
    }

    /**
     * Waits for every future. Returns false when the session was cancelled first.
     */
    private boolean awaitAll(String sessionId, Iterable<CompletableFuture<ExecutionTrace>> futures) {
        var all = new ArrayList<CompletableFuture<ExecutionTrace>>();
        futures.forEach(all::add);
        var barrier = CompletableFuture.allOf(all.toArray(new CompletableFuture[0]));
        while (true) {
            if (cancellations.isCancelled(sessionId)) {
                return false;
            }
            try {
                barrier.get(CANCEL_POLL_MILLIS, TimeUnit.MILLISECONDS);
                return true;
            } catch (TimeoutException e) {
                log.trace("Level still running");
            } catch (ExecutionException e) {
                // individual failures are read per item afterwards
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for level items", e);
            }
        }
    }

    private static void recordFailure(SessionEvents events, Map<Integer, String> failures,
                                      int index, int attempt, String reason, boolean timedOut) {
        failures.put(index, reason);
        events.emit(EventTypes.ITEM_EXECUTION_FAILED, Map.of(
                "itemIndex", index,
                "attempt", attempt,
                "reason", reason,
                "timedOut", timedOut));
    }
}

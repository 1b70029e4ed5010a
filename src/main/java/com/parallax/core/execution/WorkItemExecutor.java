package com.parallax.core.execution;

import com.parallax.core.agent.AgentException;
import com.parallax.core.agent.AgentInvoker;
import com.parallax.core.agent.AgentRequest;
import com.parallax.core.agent.PromptInput;
import com.parallax.core.agent.TaskKindProfile;
import com.parallax.core.agent.TaskKindRegistry;
import com.parallax.core.events.EventStore;
import com.parallax.core.events.EventTypes;
import com.parallax.core.llm.LlmService;
import com.parallax.core.logging.MdcContext;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.model.ExecutionTrace;
import com.parallax.core.model.LevelContext;
import com.parallax.core.resilience.BackendCalls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Executes one work item through the external agent.
 * <p>
 * Asks the backend whether the item is atomic. Atomic items run as a single
 * agent session; otherwise each of the 2 to 5 sub-items runs as its own
 * concurrent session and the traces are merged under the parent item's
 * index, keeping per-sub-item attribution. Sub-items are never decomposed
 * again. All file-system writes happen inside the agent sessions.
 */
@Service
public class WorkItemExecutor {

    private static final Logger log = LoggerFactory.getLogger(WorkItemExecutor.class);

    private static final String DECOMPOSITION_SYSTEM_PROMPT =
            "You decide whether a work item is atomic. An item is atomic when one focused agent session can "
            + "complete it. Otherwise split it into 2 to 5 independent sub-items that can run at the same time "
            + "without editing the same files. Prefer atomic when in doubt.";

    private final AgentInvoker agentInvoker;
    private final LlmService llmService;
    private final BackendCalls backendCalls;
    private final TaskKindRegistry registry;
    private final EventStore eventStore;
    private final ExecutorService executor;
    private final ExecutionProperties properties;
    private final ParallaxMetrics metrics;

    @Autowired
    public WorkItemExecutor(AgentInvoker agentInvoker, LlmService llmService, BackendCalls backendCalls,
                            TaskKindRegistry registry, EventStore eventStore,
                            @Qualifier("parallaxExecutor") ExecutorService executor,
                            ExecutionProperties properties,
                            @Autowired(required = false) ParallaxMetrics metrics) {
        this.agentInvoker = agentInvoker;
        this.llmService = llmService;
        this.backendCalls = backendCalls;
        this.registry = registry;
        this.eventStore = eventStore;
        this.executor = executor;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Runs one attempt of a work item.
     *
     * @return the item's trace; for a decomposed item, a parent trace holding the sub-traces
     * @throws AgentException when an agent session fails
     */
    public ExecutionTrace execute(WorkItemRequest request) {
        var item = request.item();
        var spec = request.specification();
        var profile = registry.profileFor(spec.taskKind());
        var promptInput = new PromptInput(spec, item.index(), item.text(), null,
                LevelContext.renderAll(request.levelContexts()), List.of(),
                request.retryFeedback(), request.lateralThinking());

        var decision = decide(request);
        if (decision.atomic()) {
            log.info("Item {} is atomic, dispatching one agent session (attempt {})", item.index(), request.attempt());
            return runSession(request, profile, promptInput, null);
        }

        var subItems = decision.subItems();
        log.info("Item {} decomposed into {} sub-items", item.index(), subItems.size());
        eventStore.append(request.sessionId(), EventTypes.ITEM_DECOMPOSED, Map.of(
                "itemIndex", item.index(),
                "subItems", subItems,
                "reasoning", decision.reasoning()));
        return executeSubItems(request, profile, promptInput, subItems);
    }

    /**
     * Asks the backend whether to split the item. Any failure, or an answer
     * outside the allowed sub-item range, counts as atomic.
     */
    DecompositionDecision decide(WorkItemRequest request) {
        var decomposition = properties.getDecomposition();
        if (!decomposition.isEnabled()) {
            return DecompositionDecision.atomic("decomposition disabled");
        }
        String prompt = "Goal: " + request.specification().goal() + "\n\nWork item:\n" + request.item().text()
                + "\n\nIs this item atomic? If not, give between " + decomposition.getMinSubItems()
                + " and " + decomposition.getMaxSubItems() + " sub-items.";
        DecompositionDecision decision;
        try {
            decision = backendCalls.call("decomposition",
                    () -> llmService.structuredCall(DECOMPOSITION_SYSTEM_PROMPT, prompt, DecompositionDecision.class));
        } catch (RuntimeException e) {
            log.warn("Decomposition check failed for item {} ({}), treating as atomic",
                    request.item().index(), e.getMessage());
            if (metrics != null) {
                metrics.recordDegradedMode("decomposition");
            }
            return DecompositionDecision.atomic("decomposition check failed: " + e.getMessage());
        }
        if (decision == null || decision.atomic()) {
            return decision != null ? decision : DecompositionDecision.atomic("no answer");
        }
        var subItems = decision.subItems().stream().filter(s -> s != null && !s.isBlank()).toList();
        if (subItems.size() < decomposition.getMinSubItems() || subItems.size() > decomposition.getMaxSubItems()) {
            log.info("Item {} split into {} sub-items, outside {}..{}; treating as atomic",
                    request.item().index(), subItems.size(),
                    decomposition.getMinSubItems(), decomposition.getMaxSubItems());
            return DecompositionDecision.atomic("sub-item count " + subItems.size() + " out of range");
        }
        return new DecompositionDecision(false, subItems, decision.reasoning());
    }

    private ExecutionTrace executeSubItems(WorkItemRequest request, TaskKindProfile profile,
                                           PromptInput parentInput, List<String> subItems) {
        int itemIndex = request.item().index();
        var futures = new ArrayList<CompletableFuture<ExecutionTrace>>();
        for (int i = 0; i < subItems.size(); i++) {
            final int subIndex = i;
            var siblings = new ArrayList<>(subItems);
            siblings.remove(subIndex);
            var subInput = parentInput.forSubItem(subItems.get(subIndex), siblings);
            futures.add(CompletableFuture.supplyAsync(() -> {
                MdcContext.setItem(request.sessionId(), itemIndex, profile.kind().name());
                try {
                    return runSession(request, profile, subInput, subIndex);
                } finally {
                    MdcContext.clear();
                }
            }, executor));
        }

        var traces = new ArrayList<ExecutionTrace>();
        var failures = new ArrayList<String>();
        Throwable firstFailure = null;
        for (int i = 0; i < futures.size(); i++) {
            try {
                traces.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                failures.add("sub-item " + (i + 1) + ": " + cause.getMessage());
                if (firstFailure == null) {
                    firstFailure = cause;
                }
            }
        }
        if (!failures.isEmpty()) {
            throw new AgentException("Item " + itemIndex + " sub-item session(s) failed: "
                    + String.join("; ", failures), firstFailure, traces);
        }
        return merge(itemIndex, subItems, traces);
    }

    /**
     * Parent trace for a decomposed item: no invocations of its own, one
     * sub-trace per sub-item, outputs concatenated under headings.
     */
    static ExecutionTrace merge(int itemIndex, List<String> subItems, List<ExecutionTrace> subTraces) {
        var output = new StringBuilder();
        boolean success = true;
        long duration = 0;
        for (int i = 0; i < subTraces.size(); i++) {
            var sub = subTraces.get(i);
            output.append("### Sub-item ").append(i + 1).append(": ").append(subItems.get(i)).append('\n')
                    .append(sub.finalOutput()).append("\n\n");
            success &= sub.success();
            duration = Math.max(duration, sub.durationMs());
        }
        return new ExecutionTrace(itemIndex, null, List.of(), output.toString().strip(),
                "Decomposed into " + subTraces.size() + " sub-items", success, subTraces, duration);
    }

    private ExecutionTrace runSession(WorkItemRequest request, TaskKindProfile profile,
                                      PromptInput input, Integer subIndex) {
        var agentRequest = new AgentRequest(
                request.sessionId(), request.item().index(), subIndex,
                profile.systemPrompt(), profile.renderItemPrompt(input), profile.capabilities(),
                input.levelContext(), Duration.ofSeconds(properties.getItemTimeoutSeconds()));
        long start = System.currentTimeMillis();
        var trace = agentInvoker.invoke(agentRequest);
        if (metrics != null) {
            metrics.recordItemExecution(profile.kind().name(), System.currentTimeMillis() - start);
        }
        if (trace.itemIndex() != request.item().index()) {
            trace = trace.withItemIndex(request.item().index());
        }
        return trace;
    }
}

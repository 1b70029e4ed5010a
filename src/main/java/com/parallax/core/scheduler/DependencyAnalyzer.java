package com.parallax.core.scheduler;

import com.parallax.core.llm.LlmService;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.model.DependencyGraph;
import com.parallax.core.model.WorkItemNode;
import com.parallax.core.resilience.BackendCalls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Infers prerequisites between work items with one backend call and layers
 * the resulting graph into execution levels.
 * <p>
 * Level 0 holds every item without prerequisites; level k holds the items
 * whose prerequisites all sit in levels below k. Within a level items keep
 * their original order. When the backend call fails or its answer cannot be
 * parsed, every item goes into a single level (degraded mode).
 */
@Service
public class DependencyAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DependencyAnalyzer.class);

    private static final String SYSTEM_PROMPT =
            "You analyze dependencies between work items of one software task. An item depends on another "
            + "when it needs that item's output: it uses a file, type, endpoint or result the other creates. "
            + "Items that merely touch the same area are independent. Only list real prerequisites.";

    private final LlmService llmService;
    private final BackendCalls backendCalls;
    private final ParallaxMetrics metrics;

    @Autowired
    public DependencyAnalyzer(LlmService llmService, BackendCalls backendCalls,
                              @Autowired(required = false) ParallaxMetrics metrics) {
        this.llmService = llmService;
        this.backendCalls = backendCalls;
        this.metrics = metrics;
    }

    /**
     * Builds the dependency graph for the given ordered items.
     */
    public DependencyGraph analyze(List<String> workItems) {
        if (workItems.size() <= 1) {
            log.info("{} work item(s), no dependency analysis needed", workItems.size());
            return DependencyGraph.singleLevel(workItems, false);
        }

        DependencyResponse response;
        try {
            response = backendCalls.call("dependency-analysis",
                    () -> llmService.structuredCall(SYSTEM_PROMPT, buildPrompt(workItems), DependencyResponse.class));
        } catch (RuntimeException e) {
            log.warn("Dependency analysis failed ({}), degrading to a single level of {} items",
                    e.getMessage(), workItems.size());
            if (metrics != null) {
                metrics.recordDegradedMode("dependency_analysis");
            }
            return DependencyGraph.singleLevel(workItems, true);
        }
        if (response == null || response.dependencies() == null) {
            log.warn("Dependency analysis returned no dependency list, degrading to a single level");
            if (metrics != null) {
                metrics.recordDegradedMode("dependency_analysis");
            }
            return DependencyGraph.singleLevel(workItems, true);
        }

        var dependencies = sanitize(response, workItems.size());
        var graph = layer(workItems, dependencies);
        log.info("Dependency graph built: {} items in {} level(s): {}",
                workItems.size(), graph.levelCount(), graph.levels());
        return graph;
    }

    private static String buildPrompt(List<String> workItems) {
        var sb = new StringBuilder("Work items (0-based index):\n\n");
        for (int i = 0; i < workItems.size(); i++) {
            sb.append(i).append(": ").append(workItems.get(i)).append('\n');
        }
        sb.append("\nFor every item, list the indices of the items it depends on. ")
                .append("Use an empty list for independent items.");
        return sb.toString();
    }

    /**
     * Drops self references, out-of-range indices and duplicates. Items the
     * backend did not mention have no prerequisites.
     */
    static Map<Integer, Set<Integer>> sanitize(DependencyResponse response, int itemCount) {
        var result = new HashMap<Integer, Set<Integer>>();
        for (int i = 0; i < itemCount; i++) {
            result.put(i, new TreeSet<>());
        }
        for (var entry : response.dependencies()) {
            if (entry == null || entry.itemIndex() < 0 || entry.itemIndex() >= itemCount) {
                log.debug("Ignoring dependency entry for unknown item: {}", entry);
                continue;
            }
            if (entry.dependsOn() == null) {
                continue;
            }
            for (Integer dep : entry.dependsOn()) {
                if (dep == null || dep < 0 || dep >= itemCount || dep == entry.itemIndex()) {
                    log.debug("Ignoring invalid dependency {} of item {}", dep, entry.itemIndex());
                    continue;
                }
                result.get(entry.itemIndex()).add(dep);
            }
        }
        return result;
    }

    /**
     * Topological layering. A cycle puts every remaining item into one final
     * level and drops their prerequisites on each other.
     */
    static DependencyGraph layer(List<String> workItems, Map<Integer, Set<Integer>> dependencies) {
        var remaining = new LinkedHashSet<Integer>();
        for (int i = 0; i < workItems.size(); i++) {
            remaining.add(i);
        }
        var placed = new HashSet<Integer>();
        var levels = new ArrayList<List<Integer>>();
        var effective = new HashMap<Integer, Set<Integer>>(dependencies);

        while (!remaining.isEmpty()) {
            var ready = new ArrayList<Integer>();
            for (int index : remaining) {
                if (placed.containsAll(dependencies.getOrDefault(index, Set.of()))) {
                    ready.add(index);
                }
            }
            if (ready.isEmpty()) {
                log.warn("Dependency cycle among items {}, placing them in one final level", remaining);
                var cyclic = new ArrayList<>(remaining);
                for (int index : cyclic) {
                    var kept = new TreeSet<>(dependencies.getOrDefault(index, Set.of()));
                    kept.retainAll(placed);
                    effective.put(index, kept);
                }
                levels.add(cyclic);
                break;
            }
            levels.add(ready);
            placed.addAll(ready);
            ready.forEach(remaining::remove);
        }

        var nodes = new ArrayList<WorkItemNode>();
        for (int i = 0; i < workItems.size(); i++) {
            nodes.add(new WorkItemNode(i, workItems.get(i), effective.getOrDefault(i, Set.of())));
        }
        return new DependencyGraph(nodes, levels, false);
    }
}

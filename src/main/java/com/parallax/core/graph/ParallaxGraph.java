package com.parallax.core.graph;

import com.parallax.core.engine.CancellationRegistry;
import com.parallax.core.execution.ExecutionProperties;
import com.parallax.core.nodes.AnalyzeDependenciesNode;
import com.parallax.core.nodes.ConvergeResultsNode;
import com.parallax.core.nodes.CoordinateLevelNode;
import com.parallax.core.nodes.EvaluateLevelNode;
import com.parallax.core.nodes.ExecuteLevelNode;
import com.parallax.core.nodes.ScheduleLevelNode;
import com.parallax.core.state.ParallaxState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that runs a
 * session level by level.
 * <pre>
 *   START -> analyze_dependencies -> schedule_level -> [routeAfterSchedule]
 *            -> execute_level -> coordinate_level -> evaluate_level -> [routeAfterEvaluate]
 *               -> execute_level   (retry items of the same level)
 *               -> schedule_level  (next level)
 *               -> converge -> END
 *            -> converge -> END   (no levels left)
 * </pre>
 */
@Component
public class ParallaxGraph {

    private static final Logger log = LoggerFactory.getLogger(ParallaxGraph.class);

    static final int MIN_RECURSION_LIMIT = 100;

    private final CompiledGraph<ParallaxState> compiledGraph;
    private final CancellationRegistry cancellations;

    @Autowired
    public ParallaxGraph(
            AnalyzeDependenciesNode analyzeNode,
            ScheduleLevelNode scheduleNode,
            ExecuteLevelNode executeNode,
            CoordinateLevelNode coordinateNode,
            EvaluateLevelNode evaluateNode,
            ConvergeResultsNode convergeNode,
            CancellationRegistry cancellations,
            ExecutionProperties properties,
            @Autowired(required = false) BaseCheckpointSaver checkpointSaver) throws Exception {
        this(analyzeNode, scheduleNode, executeNode, coordinateNode, evaluateNode, convergeNode,
                cancellations, checkpointSaver, recursionLimitFor(properties.getMaxLevelPasses()));
    }

    public ParallaxGraph(
            AnalyzeDependenciesNode analyzeNode,
            ScheduleLevelNode scheduleNode,
            ExecuteLevelNode executeNode,
            CoordinateLevelNode coordinateNode,
            EvaluateLevelNode evaluateNode,
            ConvergeResultsNode convergeNode,
            CancellationRegistry cancellations,
            BaseCheckpointSaver checkpointSaver,
            int recursionLimit) throws Exception {
        this.cancellations = cancellations;

        var graph = new StateGraph<>(ParallaxState.SCHEMA, ParallaxState::new)
                .addNode("analyze_dependencies", node_async(analyzeNode::apply))
                .addNode("schedule_level", node_async(scheduleNode::apply))
                .addNode("execute_level", node_async(executeNode::apply))
                .addNode("coordinate_level", node_async(coordinateNode::apply))
                .addNode("evaluate_level", node_async(evaluateNode::apply))
                .addNode("converge", node_async(convergeNode::apply))
                .addEdge(START, "analyze_dependencies")
                .addEdge("analyze_dependencies", "schedule_level")
                .addConditionalEdges("schedule_level",
                        edge_async(this::routeAfterSchedule),
                        Map.of("execute_level", "execute_level",
                                "converge", "converge"))
                .addEdge("execute_level", "coordinate_level")
                .addEdge("coordinate_level", "evaluate_level")
                .addConditionalEdges("evaluate_level",
                        edge_async(this::routeAfterEvaluate),
                        Map.of("execute_level", "execute_level",
                                "schedule_level", "schedule_level",
                                "converge", "converge"))
                .addEdge("converge", END);

        var configBuilder = CompileConfig.builder();
        if (checkpointSaver != null) {
            configBuilder.checkpointSaver(checkpointSaver);
            log.info("Graph compiled with checkpoint saver: {}", checkpointSaver.getClass().getSimpleName());
        } else {
            log.info("Graph compiled without checkpoint saver (state will not be persisted)");
        }
        this.compiledGraph = graph.compile(configBuilder.build());
        this.compiledGraph.setMaxIterations(Math.max(MIN_RECURSION_LIMIT, recursionLimit));
    }

    /**
     * A level pass is at most four steps (schedule, execute, coordinate,
     * evaluate); a few more cover analysis and convergence.
     */
    static int recursionLimitFor(int maxLevelPasses) {
        return Math.max(MIN_RECURSION_LIMIT, 4 * maxLevelPasses + 10);
    }

    /**
     * Nothing scheduled means every level is done (or the cap was hit).
     */
    String routeAfterSchedule(ParallaxState state) {
        if (cancellations.isCancelled(state.sessionId()) || state.pendingItems().isEmpty()) {
            return "converge";
        }
        return "execute_level";
    }

    /**
     * Pending items are retries of the current level; otherwise move on, or
     * converge once every item has reached a terminal status.
     */
    String routeAfterEvaluate(ParallaxState state) {
        if (cancellations.isCancelled(state.sessionId())) {
            return "converge";
        }
        if (!state.pendingItems().isEmpty()) {
            return "execute_level";
        }
        if (state.ledger().allTerminal()) {
            return "converge";
        }
        return "schedule_level";
    }

    public CompiledGraph<ParallaxState> getCompiledGraph() {
        return compiledGraph;
    }
}

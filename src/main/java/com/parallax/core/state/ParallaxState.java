package com.parallax.core.state;

import com.parallax.core.ledger.ExecutionLedger;
import com.parallax.core.model.DependencyGraph;
import com.parallax.core.model.ExecutionTrace;
import com.parallax.core.model.LevelContext;
import com.parallax.core.model.SessionMetrics;
import com.parallax.core.model.SessionStatus;
import com.parallax.core.model.Specification;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one execution session.
 * <p>
 * Per-item statuses live in the {@link ExecutionLedger}, which nodes only
 * change by emitting events. The remaining channels carry the level being
 * worked on: the items of the current pass, their traces and the context
 * accumulated for the level. Finished level contexts accumulate in an
 * appender channel.
 */
public class ParallaxState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Session ──────────────────────────────────────────────────
        Map.entry("sessionId",           Channels.base(() -> "")),
        Map.entry("specification",       Channels.base((Reducer<Specification>) null)),
        Map.entry("dependencyGraph",     Channels.base((Reducer<DependencyGraph>) null)),
        Map.entry("ledger",              Channels.base((Reducer<ExecutionLedger>) null)),
        Map.entry("status",              Channels.base(() -> SessionStatus.ANALYZING.name())),
        Map.entry("startedAtMillis",     Channels.base(() -> 0L)),
        Map.entry("metrics",             Channels.base((Reducer<SessionMetrics>) null)),

        // ── Current level ────────────────────────────────────────────
        Map.entry("levelNumber",         Channels.base(() -> -1)),
        Map.entry("levelPasses",         Channels.base(() -> 0)),
        Map.entry("pendingItems",        Channels.base((Supplier<List<Integer>>) List::of)),
        Map.entry("levelTraces",         Channels.base((Supplier<List<ExecutionTrace>>) List::of)),
        Map.entry("executionFailures",   Channels.base((Supplier<Map<Integer, String>>) Map::of)),
        Map.entry("currentLevelContext", Channels.base((Reducer<LevelContext>) null)),

        // ── Appender channels ────────────────────────────────────────
        Map.entry("levelContexts",       Channels.appender(ArrayList::new)),
        Map.entry("resolvedLevels",      Channels.appender(ArrayList::new)),
        Map.entry("errors",              Channels.appender(ArrayList::new))
    );

    public ParallaxState(Map<String, Object> initData) {
        super(initData);
    }

    public String sessionId() {
        return this.<String>value("sessionId").orElse("");
    }

    public Specification specification() {
        return this.<Specification>value("specification")
                .orElseThrow(() -> new IllegalStateException("No specification in state"));
    }

    public Optional<DependencyGraph> dependencyGraph() {
        return value("dependencyGraph");
    }

    public ExecutionLedger ledger() {
        return this.<ExecutionLedger>value("ledger").orElseGet(() -> ExecutionLedger.empty(sessionId()));
    }

    public SessionStatus status() {
        String raw = this.<String>value("status").orElse(SessionStatus.ANALYZING.name());
        return SessionStatus.valueOf(raw);
    }

    public long startedAtMillis() {
        return this.<Long>value("startedAtMillis").orElse(0L);
    }

    public Optional<SessionMetrics> metrics() {
        return value("metrics");
    }

    public int levelNumber() {
        return this.<Integer>value("levelNumber").orElse(-1);
    }

    public int levelPasses() {
        return this.<Integer>value("levelPasses").orElse(0);
    }

    public List<Integer> pendingItems() {
        return this.<List<Integer>>value("pendingItems").orElse(List.of());
    }

    public List<ExecutionTrace> levelTraces() {
        return this.<List<ExecutionTrace>>value("levelTraces").orElse(List.of());
    }

    public Map<Integer, String> executionFailures() {
        return this.<Map<Integer, String>>value("executionFailures").orElse(Map.of());
    }

    public LevelContext currentLevelContext() {
        return this.<LevelContext>value("currentLevelContext")
                .orElseGet(() -> new LevelContext(levelNumber(), List.of(), null));
    }

    public List<LevelContext> levelContexts() {
        return this.<List<LevelContext>>value("levelContexts").orElse(List.of());
    }

    public List<Integer> resolvedLevels() {
        return this.<List<Integer>>value("resolvedLevels").orElse(List.of());
    }

    public List<String> errors() {
        return this.<List<String>>value("errors").orElse(List.of());
    }
}

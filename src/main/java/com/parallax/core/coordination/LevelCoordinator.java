package com.parallax.core.coordination;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parallax.core.agent.AgentInvoker;
import com.parallax.core.agent.AgentRequest;
import com.parallax.core.agent.AgentTool;
import com.parallax.core.events.EventStore;
import com.parallax.core.events.EventTypes;
import com.parallax.core.execution.ExecutionProperties;
import com.parallax.core.llm.LlmService;
import com.parallax.core.logging.MdcContext;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.model.CoordinatorReview;
import com.parallax.core.model.ExecutionTrace;
import com.parallax.core.model.FileConflict;
import com.parallax.core.model.ItemSummary;
import com.parallax.core.model.LevelContext;
import com.parallax.core.model.ToolInvocation;
import com.parallax.core.resilience.BackendCalls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Runs after every trace of a level has returned.
 * <p>
 * Detects files written by more than one item, and only when there is at
 * least one conflict starts a single bounded agent session that inspects the
 * files and reconciles the divergent writes. Conflict-free levels cost no
 * agent calls. The result is the {@link LevelContext} handed to the next level.
 */
@Service
public class LevelCoordinator {

    private static final Logger log = LoggerFactory.getLogger(LevelCoordinator.class);

    static final int FALLBACK_SUMMARY_CHARS = 500;

    private static final String SYSTEM_PROMPT =
            "You are the level coordinator. Several agents worked on the same files in parallel. "
            + "Inspect the current state of every conflicting file (use git diff or read the files), "
            + "reconcile the divergent changes so every item's intent survives, and edit the files in place. "
            + "Do not start new work.";

    private final AgentInvoker agentInvoker;
    private final BackendCalls backendCalls;
    private final EventStore eventStore;
    private final ExecutionProperties properties;
    private final ParallaxMetrics metrics;
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    @Autowired
    public LevelCoordinator(AgentInvoker agentInvoker, BackendCalls backendCalls, EventStore eventStore,
                            ExecutionProperties properties,
                            @Autowired(required = false) ParallaxMetrics metrics) {
        this.agentInvoker = agentInvoker;
        this.backendCalls = backendCalls;
        this.eventStore = eventStore;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Coordinates one finished level pass.
     *
     * @param sessionId       execution session
     * @param levelNumber     level being coordinated
     * @param traces          every trace the level produced
     * @param itemTexts       work item text by index
     * @param allowResolution false when this level already had its resolution session
     * @return the context for the next level
     */
    public LevelContext coordinate(String sessionId, int levelNumber, List<ExecutionTrace> traces,
                                   Map<Integer, String> itemTexts, boolean allowResolution) {
        MdcContext.setLevel(sessionId, levelNumber);
        var ordered = new ArrayList<>(traces);
        ordered.sort(Comparator.comparingInt(ExecutionTrace::itemIndex));

        var summaries = new ArrayList<ItemSummary>();
        for (var trace : ordered) {
            summaries.add(ItemSummary.of(itemTexts.getOrDefault(trace.itemIndex(), ""), trace));
        }

        var conflicts = ConflictDetector.detect(ordered);
        if (conflicts.isEmpty()) {
            log.info("Level {}: no conflicts across {} trace(s), skipping review", levelNumber, ordered.size());
            return new LevelContext(levelNumber, summaries, null);
        }

        for (var conflict : conflicts) {
            log.warn("Level {}: conflict on {} between items {}", levelNumber, conflict.path(), conflict.itemIndices());
            eventStore.append(sessionId, EventTypes.CONFLICT_DETECTED, Map.of(
                    "levelNumber", levelNumber,
                    "path", conflict.path(),
                    "itemIndices", conflict.itemIndices()));
        }

        CoordinatorReview review;
        if (!allowResolution) {
            log.warn("Level {}: DENIED conflict resolution, already ran once for this level", levelNumber);
            review = new CoordinatorReview(levelNumber, conflicts,
                    "Conflict resolution already ran for level " + levelNumber + "; conflicts left unresolved",
                    List.of(), List.of(unresolvedWarning(conflicts)), false);
        } else {
            log.info("Level {}: GRANTED conflict resolution for {} conflict(s)", levelNumber, conflicts.size());
            review = resolve(sessionId, levelNumber, conflicts, ordered, itemTexts);
        }

        if (metrics != null) {
            metrics.recordConflicts(conflicts.size(), (int) review.resolvedCount());
        }
        return new LevelContext(levelNumber, summaries, review);
    }

    private CoordinatorReview resolve(String sessionId, int levelNumber, List<FileConflict> conflicts,
                                      List<ExecutionTrace> traces, Map<Integer, String> itemTexts) {
        eventStore.append(sessionId, EventTypes.REVIEW_STARTED, Map.of(
                "levelNumber", levelNumber,
                "conflictCount", conflicts.size()));

        var request = new AgentRequest(sessionId, -1, null, SYSTEM_PROMPT,
                buildPrompt(levelNumber, conflicts, traces, itemTexts), AgentTool.COORDINATOR_TOOLS, "",
                Duration.ofSeconds(properties.getCoordinatorTimeoutSeconds()));
        ExecutionTrace trace;
        try {
            trace = backendCalls.call("conflict-resolution",
                    () -> agentInvoker.invoke(request), request.deadline());
        } catch (RuntimeException e) {
            log.warn("Level {}: coordinator review failed ({}), proceeding with unresolved conflicts",
                    levelNumber, e.getMessage());
            if (metrics != null) {
                metrics.recordDegradedMode("conflict_resolution");
            }
            eventStore.append(sessionId, EventTypes.REVIEW_FAILED, Map.of(
                    "levelNumber", levelNumber,
                    "reason", String.valueOf(e.getMessage())));
            return new CoordinatorReview(levelNumber, conflicts, "Coordinator review failed: " + e.getMessage(),
                    List.of(), List.of(unresolvedWarning(conflicts)), false);
        }

        var review = parseReview(levelNumber, conflicts, trace.finalOutput());
        eventStore.append(sessionId, EventTypes.REVIEW_COMPLETED, Map.of(
                "levelNumber", levelNumber,
                "summary", review.summary(),
                "fixesApplied", review.fixesApplied(),
                "warnings", review.warnings()));
        for (var conflict : review.conflicts()) {
            if (conflict.resolved()) {
                eventStore.append(sessionId, EventTypes.CONFLICT_RESOLVED, Map.of(
                        "levelNumber", levelNumber,
                        "path", conflict.path(),
                        "itemIndices", conflict.itemIndices(),
                        "resolution", conflict.resolutionDescription()));
            }
        }
        log.info("Level {}: review complete, {}/{} conflict(s) resolved",
                levelNumber, review.resolvedCount(), conflicts.size());
        return review;
    }

    /**
     * Reads the session's structured answer. Listed paths are resolved; an
     * empty list means the session covered every conflict. Output that is not
     * JSON becomes the summary and marks every conflict resolved.
     */
    CoordinatorReview parseReview(int levelNumber, List<FileConflict> conflicts, String output) {
        ReviewResponse response;
        try {
            response = mapper.readValue(LlmService.stripFences(output), ReviewResponse.class);
        } catch (Exception e) {
            log.debug("Coordinator output is not structured ({}), using raw text: {}", e.getMessage(), output);
            String summary = output.length() > FALLBACK_SUMMARY_CHARS
                    ? output.substring(0, FALLBACK_SUMMARY_CHARS) : output;
            var resolved = conflicts.stream().map(c -> c.resolve(summary.strip())).toList();
            return new CoordinatorReview(levelNumber, resolved, summary.strip(), List.of(), List.of(), true);
        }

        var resolvedPaths = new HashSet<String>();
        for (var path : response.conflictsResolved()) {
            if (path != null) {
                resolvedPaths.add(ToolInvocation.normalizePath(path));
            }
        }
        var updated = new ArrayList<FileConflict>();
        var warnings = new ArrayList<>(response.warningsForNextLevel());
        for (var conflict : conflicts) {
            if (resolvedPaths.isEmpty() || resolvedPaths.contains(conflict.path())) {
                updated.add(conflict.resolve(describe(conflict, response)));
            } else {
                updated.add(conflict);
                warnings.add("Conflict on " + conflict.path() + " between items "
                        + conflict.itemIndices() + " was not resolved");
            }
        }
        return new CoordinatorReview(levelNumber, updated, response.reviewSummary(),
                response.fixesApplied(), warnings, true);
    }

    private static String describe(FileConflict conflict, ReviewResponse response) {
        var fixes = response.fixesApplied().stream()
                .filter(f -> f.contains(conflict.path()))
                .toList();
        if (!fixes.isEmpty()) {
            return String.join("; ", fixes);
        }
        if (!response.reviewSummary().isBlank()) {
            return response.reviewSummary();
        }
        return "Reconciled by coordinator session";
    }

    private static String unresolvedWarning(List<FileConflict> conflicts) {
        var paths = conflicts.stream().map(FileConflict::path).toList();
        return "Unresolved write conflicts on " + paths + "; check these files before building on them";
    }

    private static String buildPrompt(int levelNumber, List<FileConflict> conflicts,
                                      List<ExecutionTrace> traces, Map<Integer, String> itemTexts) {
        var sb = new StringBuilder();
        sb.append("## Level ").append(levelNumber).append(" Write Conflicts\n\n");
        for (var conflict : conflicts) {
            sb.append("- `").append(conflict.path()).append("` written by items ");
            var labels = new ArrayList<String>();
            for (int index : conflict.itemIndices()) {
                labels.add((index + 1) + " (" + itemTexts.getOrDefault(index, "") + ")");
            }
            sb.append(String.join(", ", labels)).append('\n');
        }
        sb.append("\n## What Each Item Did\n\n");
        for (var trace : traces) {
            sb.append("### Item ").append(trace.itemIndex() + 1).append('\n')
                    .append("Files: ").append(trace.filesModified()).append('\n');
            String output = trace.finalOutput();
            sb.append(output.length() > 600 ? output.substring(output.length() - 600) : output).append("\n\n");
        }
        sb.append("## Response\n")
                .append("When done, reply with JSON only:\n")
                .append("{\"review_summary\": \"what you found\", ")
                .append("\"fixes_applied\": [\"<path>: what you changed\"], ")
                .append("\"warnings_for_next_level\": [\"...\"], ")
                .append("\"conflicts_resolved\": [\"<path>\"]}\n");
        return sb.toString();
    }
}

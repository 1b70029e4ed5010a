package com.parallax.core.events;

/**
 * Event type names emitted by the engine.
 */
public final class EventTypes {

    private EventTypes() {}

    public static final String SESSION_STARTED = "session.started";
    public static final String SESSION_COMPLETED = "session.completed";
    public static final String SESSION_CANCELLED = "session.cancelled";

    public static final String DEPENDENCY_GRAPH_BUILT = "dependency.graph.built";
    public static final String DEPENDENCY_ANALYSIS_DEGRADED = "dependency.analysis.degraded";

    public static final String LEVEL_STARTED = "level.started";
    public static final String LEVEL_COMPLETED = "level.completed";

    public static final String ITEM_STARTED = "item.started";
    public static final String ITEM_COMPLETED = "item.completed";
    public static final String ITEM_EXECUTION_FAILED = "item.execution.failed";
    public static final String ITEM_DECOMPOSED = "item.decomposed";
    public static final String ITEM_RETRY_SCHEDULED = "item.retry.scheduled";
    public static final String ITEM_REJECTED = "item.rejected";
    public static final String ITEM_ACCEPTED = "item.accepted";
    public static final String ITEM_FAILED = "item.failed";
    public static final String ITEM_SKIPPED = "item.skipped";

    public static final String CONFLICT_DETECTED = "coordinator.conflict.detected";
    public static final String CONFLICT_RESOLVED = "coordinator.conflict.resolved";
    public static final String REVIEW_STARTED = "coordinator.review.started";
    public static final String REVIEW_COMPLETED = "coordinator.review.completed";
    public static final String REVIEW_FAILED = "coordinator.review.failed";

    public static final String STAGE1_COMPLETED = "evaluation.stage1.completed";
    public static final String STAGE2_COMPLETED = "evaluation.stage2.completed";
    public static final String CONSENSUS_TRIGGERED = "evaluation.consensus.triggered";
    public static final String STAGE3_COMPLETED = "evaluation.stage3.completed";
    public static final String PIPELINE_COMPLETED = "evaluation.pipeline.completed";
    public static final String VOTE_CAST = "consensus.vote.cast";
}

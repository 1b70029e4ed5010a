package com.parallax.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Evidence from one finished attempt of a work item. Attempt history is
 * append-only and fed to later semantic and consensus evaluations.
 *
 * @param attempt         1-based attempt number
 * @param stageReached    last evaluation stage that ran (NONE when execution itself failed)
 * @param reasons         why the attempt did not succeed, or the acceptance notes
 * @param satisfaction    semantic satisfaction score (null when stage 2 did not run)
 * @param uncertainty     semantic uncertainty (null when stage 2 did not run)
 * @param lateralThinking whether the attempt used the lateral-thinking strategy
 * @param timedOut        whether the execution call hit its deadline
 */
public record AttemptRecord(
    int attempt,
    EvaluationStage stageReached,
    List<String> reasons,
    Double satisfaction,
    Double uncertainty,
    boolean lateralThinking,
    boolean timedOut
) implements Serializable {

    public AttemptRecord {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    /** Single-line key used to spot repeated failures. */
    public String failureKey() {
        return stageReached + ":" + String.join("|", reasons);
    }
}

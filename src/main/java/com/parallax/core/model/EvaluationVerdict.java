package com.parallax.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Final decision of the evaluation pipeline for one attempt of a work item.
 * <p>
 * {@code approved} holds only when every stage up to
 * {@code highestStageCompleted} passed, with the consensus decision standing
 * in for the semantic one when consensus ran.
 *
 * @param itemIndex             evaluated work item
 * @param highestStageCompleted last stage that ran
 * @param approved              whether the artifact is accepted
 * @param status                action signalled to the orchestrator
 * @param reasons               reasons collected from every stage that ran
 * @param checks                mechanical check results
 * @param semantic              semantic result (null when the stage did not run)
 * @param trigger               trigger matrix outcome (null when the matrix was not evaluated)
 * @param consensus             consensus result (null when the stage did not run)
 */
public record EvaluationVerdict(
    int itemIndex,
    EvaluationStage highestStageCompleted,
    boolean approved,
    VerdictStatus status,
    List<String> reasons,
    List<CheckResult> checks,
    SemanticResult semantic,
    TriggerResult trigger,
    ConsensusResult consensus
) implements Serializable {

    public EvaluationVerdict {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
        checks = checks != null ? List.copyOf(checks) : List.of();
    }

    public boolean reducedConfidence() {
        return consensus != null && consensus.reducedConfidence();
    }
}

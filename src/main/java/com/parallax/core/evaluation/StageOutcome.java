package com.parallax.core.evaluation;

import com.parallax.core.model.CheckResult;
import com.parallax.core.model.ConsensusResult;
import com.parallax.core.model.EvaluationStage;
import com.parallax.core.model.SemanticResult;

import java.util.List;

/**
 * Result of one evaluation stage. Only the field matching the stage is set.
 */
public record StageOutcome(
    EvaluationStage stage,
    boolean passed,
    List<String> reasons,
    List<CheckResult> checks,
    SemanticResult semantic,
    ConsensusResult consensus
) {

    public StageOutcome {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
        checks = checks != null ? List.copyOf(checks) : List.of();
    }

    public static StageOutcome mechanical(boolean passed, List<String> reasons, List<CheckResult> checks) {
        return new StageOutcome(EvaluationStage.MECHANICAL, passed, reasons, checks, null, null);
    }

    public static StageOutcome semantic(SemanticResult result, List<String> reasons) {
        return new StageOutcome(EvaluationStage.SEMANTIC, result != null && result.passed(), reasons,
                List.of(), result, null);
    }

    public static StageOutcome consensus(ConsensusResult result, List<String> reasons) {
        return new StageOutcome(EvaluationStage.CONSENSUS, result != null && result.approved(), reasons,
                List.of(), null, result);
    }
}

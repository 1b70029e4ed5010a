package com.parallax.core.evaluation;

import com.parallax.core.model.EvaluationStage;

/**
 * Scores a work item artifact for one stage of the pipeline.
 */
public interface ArtifactEvaluator {

    EvaluationStage stage();

    StageOutcome evaluate(EvaluationContext context);
}

package com.parallax.core.evaluation;

import com.parallax.core.llm.LlmService;
import com.parallax.core.model.DriftBreakdown;
import com.parallax.core.model.EvaluationStage;
import com.parallax.core.model.SemanticResult;
import com.parallax.core.resilience.BackendCalls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Stage 2. One backend call scores the artifact against the item text, the
 * goal and the constraints. Passes when satisfaction reaches the threshold
 * and the acceptance criterion is met; a compliant artifact below the
 * threshold still fails.
 */
@Component
public class SemanticEvaluator implements ArtifactEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SemanticEvaluator.class);

    private static final String SYSTEM_PROMPT =
            "You evaluate the output of a coding agent against its work item. Score:\n"
            + "- score: how fully the artifact satisfies the work item, 0.0 to 1.0\n"
            + "- ac_compliance: true only if the work item's acceptance criterion is met\n"
            + "- goal_drift: how far the artifact strays from the overall goal, 0.0 to 1.0\n"
            + "- constraint_drift: how far it bends or breaks the constraints, 0.0 to 1.0\n"
            + "- ontology_drift: how far it changes the declared data model or schema, 0.0 to 1.0\n"
            + "- uncertainty: how unsure you are of this assessment, 0.0 to 1.0\n"
            + "- schema_altered: true if the artifact changes the declared output schema\n"
            + "- reasoning: two or three sentences\n"
            + "Judge what the artifact does, not what the agent claims it did.";

    private final LlmService llmService;
    private final BackendCalls backendCalls;
    private final EvaluationProperties properties;

    @Autowired
    public SemanticEvaluator(LlmService llmService, BackendCalls backendCalls, EvaluationProperties properties) {
        this.llmService = llmService;
        this.backendCalls = backendCalls;
        this.properties = properties;
    }

    @Override
    public EvaluationStage stage() {
        return EvaluationStage.SEMANTIC;
    }

    @Override
    public StageOutcome evaluate(EvaluationContext context) {
        String prompt = context.renderArtifact();
        SemanticAssessment assessment;
        try {
            assessment = backendCalls.call("semantic-evaluation",
                    () -> llmService.structuredCall(SYSTEM_PROMPT, prompt, SemanticAssessment.class));
        } catch (RuntimeException e) {
            log.warn("Semantic evaluation failed for item {}: {}", context.itemIndex(), e.getMessage());
            return StageOutcome.semantic(null, List.of("Semantic evaluation failed: " + e.getMessage()));
        }
        if (assessment == null) {
            return StageOutcome.semantic(null, List.of("Semantic evaluation returned no assessment"));
        }

        var result = toResult(assessment);
        var reasons = new ArrayList<String>();
        if (!result.passed()) {
            if (result.satisfaction() < properties.getSatisfactionThreshold()) {
                reasons.add(String.format("Satisfaction %.2f below threshold %.2f",
                        result.satisfaction(), properties.getSatisfactionThreshold()));
            }
            if (!result.compliant()) {
                reasons.add("Acceptance criterion not met");
            }
            if (!result.reasoning().isBlank()) {
                reasons.add(result.reasoning());
            }
        }
        log.info("Item {} semantic: satisfaction={} compliant={} uncertainty={} drift={} -> {}",
                context.itemIndex(), String.format("%.2f", result.satisfaction()), result.compliant(),
                String.format("%.2f", result.uncertainty()), String.format("%.2f", result.combinedDrift()),
                result.passed() ? "passed" : "failed");
        return StageOutcome.semantic(result, reasons);
    }

    SemanticResult toResult(SemanticAssessment assessment) {
        var drift = new DriftBreakdown(assessment.goalDrift(), assessment.constraintDrift(), assessment.ontologyDrift());
        var weights = properties.getDriftWeights();
        double combined = drift.combined(weights.getGoal(), weights.getConstraint(), weights.getOntology());
        var partial = new SemanticResult(assessment.score(), assessment.acCompliance(), assessment.uncertainty(),
                drift, combined, assessment.schemaAltered(), assessment.reasoning(), false);
        boolean passed = partial.satisfaction() >= properties.getSatisfactionThreshold() && partial.compliant();
        return new SemanticResult(partial.satisfaction(), partial.compliant(), partial.uncertainty(), drift,
                combined, partial.schemaAltered(), partial.reasoning(), passed);
    }
}

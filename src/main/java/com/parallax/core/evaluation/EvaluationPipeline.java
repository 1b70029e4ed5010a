package com.parallax.core.evaluation;

import com.parallax.core.events.EventStore;
import com.parallax.core.events.EventTypes;
import com.parallax.core.execution.ExecutionProperties;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.model.CheckResult;
import com.parallax.core.model.ConsensusResult;
import com.parallax.core.model.EvaluationStage;
import com.parallax.core.model.EvaluationVerdict;
import com.parallax.core.model.SemanticResult;
import com.parallax.core.model.TriggerResult;
import com.parallax.core.model.VerdictStatus;
import com.parallax.core.model.VoteDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Three-stage verdict for one work item artifact.
 * <p>
 * Stage 1 (mechanical) gates stage 2 (semantic); stage 3 (consensus) runs
 * only when the trigger matrix fires on a compliant stage-2 result, and its decision
 * then replaces stage 2's. A disabled stage is not run and does not count as
 * completed. A mechanical failure is a retry signal while the item still has
 * attempts left.
 */
@Service
public class EvaluationPipeline {

    private static final Logger log = LoggerFactory.getLogger(EvaluationPipeline.class);

    private final Map<EvaluationStage, ArtifactEvaluator> evaluators;
    private final EvaluationProperties properties;
    private final TriggerMatrix triggerMatrix;
    private final EventStore eventStore;
    private final int maxAttempts;
    private final ParallaxMetrics metrics;

    @Autowired
    public EvaluationPipeline(List<ArtifactEvaluator> evaluators, EvaluationProperties properties,
                              EventStore eventStore, ExecutionProperties executionProperties,
                              @Autowired(required = false) ParallaxMetrics metrics) {
        this.evaluators = new EnumMap<>(EvaluationStage.class);
        for (var evaluator : evaluators) {
            if (this.evaluators.put(evaluator.stage(), evaluator) != null) {
                throw new IllegalStateException("Duplicate evaluator for stage " + evaluator.stage());
            }
        }
        this.properties = properties;
        this.triggerMatrix = TriggerMatrix.from(properties);
        this.eventStore = eventStore;
        this.maxAttempts = executionProperties.getMaxAttempts();
        this.metrics = metrics;
    }

    public EvaluationVerdict evaluate(EvaluationContext context) {
        int item = context.itemIndex();
        var highest = EvaluationStage.NONE;
        List<CheckResult> checks = List.of();

        // Stage 1
        if (properties.isStage1Enabled()) {
            var outcome = run(EvaluationStage.MECHANICAL, context);
            highest = EvaluationStage.MECHANICAL;
            checks = outcome.checks();
            eventStore.append(context.sessionId(), EventTypes.STAGE1_COMPLETED, Map.of(
                    "itemIndex", item,
                    "attempt", context.attempt(),
                    "passed", outcome.passed(),
                    "checksRun", outcome.checks().size(),
                    "reasons", outcome.reasons()));
            if (!outcome.passed()) {
                var status = context.attempt() < maxAttempts ? VerdictStatus.RETRY : VerdictStatus.FAILED;
                return finish(context, new EvaluationVerdict(item, highest, false, status,
                        outcome.reasons(), checks, null, null, null));
            }
        }

        // Stage 2
        if (!properties.isStage2Enabled()) {
            return finish(context, new EvaluationVerdict(item, highest, true, VerdictStatus.APPROVED,
                    List.of(), checks, null, null, null));
        }
        var semanticOutcome = run(EvaluationStage.SEMANTIC, context);
        highest = EvaluationStage.SEMANTIC;
        SemanticResult semantic = semanticOutcome.semantic();
        eventStore.append(context.sessionId(), EventTypes.STAGE2_COMPLETED, semanticPayload(context, semanticOutcome));
        if (semantic == null) {
            return finish(context, new EvaluationVerdict(item, highest, false, VerdictStatus.REJECTED,
                    semanticOutcome.reasons(), checks, null, null, null));
        }

        if (!semantic.compliant()) {
            // consensus may only rescue compliant artifacts
            return finish(context, new EvaluationVerdict(item, highest, false, VerdictStatus.REJECTED,
                    semanticOutcome.reasons(), checks, semantic, null, null));
        }

        // Trigger matrix
        TriggerResult trigger = triggerMatrix.evaluate(context.specification(), item, semantic, context.lateralThinking());
        if (!trigger.shouldTrigger() || !properties.isStage3Enabled()) {
            if (trigger.shouldTrigger()) {
                log.info("Item {} trigger {} fired but consensus is disabled", item, trigger.triggerType());
            }
            var status = semantic.passed() ? VerdictStatus.APPROVED : VerdictStatus.REJECTED;
            return finish(context, new EvaluationVerdict(item, highest, semantic.passed(), status,
                    semanticOutcome.reasons(), checks, semantic, trigger, null));
        }

        // Stage 3
        log.info("Item {} escalated to consensus: {}", item, trigger.reason());
        eventStore.append(context.sessionId(), EventTypes.CONSENSUS_TRIGGERED, Map.of(
                "itemIndex", item,
                "attempt", context.attempt(),
                "trigger", trigger.triggerType().name(),
                "reason", trigger.reason()));
        if (metrics != null) {
            metrics.recordConsensusTrigger(trigger.triggerType().name());
        }
        var consensusOutcome = run(EvaluationStage.CONSENSUS, context.withSemantic(semantic).withTrigger(trigger));
        highest = EvaluationStage.CONSENSUS;
        ConsensusResult consensus = consensusOutcome.consensus();
        var payload = new LinkedHashMap<String, Object>();
        payload.put("itemIndex", item);
        payload.put("attempt", context.attempt());
        payload.put("decision", consensus != null ? consensus.decision().name() : VoteDecision.REJECTED.name());
        payload.put("confidence", consensus != null ? consensus.confidence() : 0.0);
        payload.put("reducedConfidence", consensus != null && consensus.reducedConfidence());
        eventStore.append(context.sessionId(), EventTypes.STAGE3_COMPLETED, payload);

        VerdictStatus status;
        if (consensus != null && consensus.approved()) {
            status = VerdictStatus.APPROVED;
        } else if (consensus != null && consensus.decision() == VoteDecision.CONDITIONAL) {
            status = VerdictStatus.CONDITIONAL;
        } else {
            status = VerdictStatus.REJECTED;
        }
        var reasons = new ArrayList<>(consensusOutcome.reasons());
        if (consensus != null && consensus.approved() && consensus.reducedConfidence()) {
            log.warn("Item {} approved by consensus with reduced confidence", item);
        }
        return finish(context, new EvaluationVerdict(item, highest, consensusOutcome.passed(), status,
                reasons, checks, semantic, trigger, consensus));
    }

    private StageOutcome run(EvaluationStage stage, EvaluationContext context) {
        var evaluator = evaluators.get(stage);
        if (evaluator == null) {
            throw new IllegalStateException("No evaluator registered for stage " + stage);
        }
        return evaluator.evaluate(context);
    }

    private Map<String, Object> semanticPayload(EvaluationContext context, StageOutcome outcome) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("itemIndex", context.itemIndex());
        payload.put("attempt", context.attempt());
        payload.put("passed", outcome.passed());
        var semantic = outcome.semantic();
        if (semantic != null) {
            payload.put("satisfaction", semantic.satisfaction());
            payload.put("compliant", semantic.compliant());
            payload.put("uncertainty", semantic.uncertainty());
            payload.put("combinedDrift", semantic.combinedDrift());
            payload.put("schemaAltered", semantic.schemaAltered());
        }
        payload.put("reasons", outcome.reasons());
        return payload;
    }

    private EvaluationVerdict finish(EvaluationContext context, EvaluationVerdict verdict) {
        log.info("Item {} attempt {} verdict: {} at stage {}{}", verdict.itemIndex(), context.attempt(),
                verdict.approved() ? "GRANTED" : "DENIED (" + verdict.status() + ")",
                verdict.highestStageCompleted(), verdict.reasons().isEmpty() ? "" : " " + verdict.reasons());
        eventStore.append(context.sessionId(), EventTypes.PIPELINE_COMPLETED, Map.of(
                "itemIndex", verdict.itemIndex(),
                "attempt", context.attempt(),
                "approved", verdict.approved(),
                "status", verdict.status().name(),
                "highestStage", verdict.highestStageCompleted().number()));
        if (metrics != null) {
            metrics.recordVerdict(verdict.highestStageCompleted().name().toLowerCase(), verdict.approved());
        }
        return verdict;
    }
}

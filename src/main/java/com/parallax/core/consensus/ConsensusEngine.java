package com.parallax.core.consensus;

import com.parallax.core.evaluation.ArtifactEvaluator;
import com.parallax.core.evaluation.EvaluationContext;
import com.parallax.core.evaluation.StageOutcome;
import com.parallax.core.events.EventStore;
import com.parallax.core.events.EventTypes;
import com.parallax.core.llm.LlmService;
import com.parallax.core.model.ConsensusResult;
import com.parallax.core.model.EvaluationStage;
import com.parallax.core.model.Vote;
import com.parallax.core.model.VoteDecision;
import com.parallax.core.model.VoterRole;
import com.parallax.core.resilience.BackendCalls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Stage 3. Two-round deliberation over an artifact the trigger matrix flagged.
 * <p>
 * Round one runs the advocate and the critic concurrently on the same input.
 * Round two starts only after both returned: the judge weighs the positions
 * and rules approved, rejected or conditional. A missing advocate or critic
 * position does not stop the round; the judge is told which side is missing
 * and the result is marked reduced-confidence with its confidence halved.
 */
@Service
public class ConsensusEngine implements ArtifactEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConsensusEngine.class);

    static final String ADVOCATE_PROMPT =
            "You are the advocate. Make the strongest honest case for accepting this artifact: "
            + "what it gets right, which requirements it meets and why its approach is sound. "
            + "Set approved to false only if you cannot defend it.";

    static final String CRITIC_PROMPT =
            "You are the critic. Ask what this artifact really is, and whether it addresses the root "
            + "requirement or only treats a symptom. Look for missed requirements, hidden breakage and "
            + "shortcuts. Set root_cause to true only if it addresses the root requirement.";

    static final String JUDGE_PROMPT =
            "You are the judge. Weigh the positions below against the work item and rule. "
            + "verdict is one of \"approved\", \"rejected\" or \"conditional\". For conditional, list the "
            + "concrete changes required in conditions.";

    private final LlmService llmService;
    private final BackendCalls backendCalls;
    private final EventStore eventStore;
    private final ExecutorService executor;

    @Autowired
    public ConsensusEngine(LlmService llmService, BackendCalls backendCalls, EventStore eventStore,
                           @Qualifier("parallaxExecutor") ExecutorService executor) {
        this.llmService = llmService;
        this.backendCalls = backendCalls;
        this.eventStore = eventStore;
        this.executor = executor;
    }

    @Override
    public EvaluationStage stage() {
        return EvaluationStage.CONSENSUS;
    }

    @Override
    public StageOutcome evaluate(EvaluationContext context) {
        var result = deliberate(context);
        var reasons = new ArrayList<String>();
        if (!result.approved()) {
            reasons.add("Consensus " + result.decision() + ": " + result.rationale());
            for (var condition : result.conditions()) {
                reasons.add("Required change: " + condition);
            }
        }
        return StageOutcome.consensus(result, reasons);
    }

    public ConsensusResult deliberate(EvaluationContext context) {
        String artifact = renderInput(context);

        var advocateFuture = CompletableFuture.supplyAsync(() -> position("advocate", ADVOCATE_PROMPT, artifact), executor);
        var criticFuture = CompletableFuture.supplyAsync(() -> position("critic", CRITIC_PROMPT, artifact), executor);

        // barrier: the judge needs both rounds back
        PositionResponse advocate = await(advocateFuture, VoterRole.ADVOCATE, context.itemIndex());
        PositionResponse critic = await(criticFuture, VoterRole.CRITIC, context.itemIndex());

        var votes = new ArrayList<Vote>();
        if (advocate != null) {
            votes.add(castVote(context, VoterRole.ADVOCATE, advocate));
        }
        if (critic != null) {
            votes.add(castVote(context, VoterRole.CRITIC, critic));
        }
        boolean reducedConfidence = advocate == null || critic == null;
        boolean rootCause = critic != null && Boolean.TRUE.equals(critic.rootCause());

        String judgePrompt = renderJudgePrompt(artifact, advocate, critic);
        JudgmentResponse judgment;
        try {
            judgment = backendCalls.call("consensus-judge",
                    () -> llmService.structuredCall(JUDGE_PROMPT, judgePrompt, JudgmentResponse.class));
        } catch (RuntimeException e) {
            log.warn("Item {} consensus judge failed: {}", context.itemIndex(), e.getMessage());
            return new ConsensusResult(VoteDecision.REJECTED, 0.0, "Judge failed: " + e.getMessage(),
                    List.of(), votes, reducedConfidence, rootCause);
        }
        if (judgment == null) {
            return new ConsensusResult(VoteDecision.REJECTED, 0.0, "Judge returned no ruling",
                    List.of(), votes, reducedConfidence, rootCause);
        }

        double confidence = clamp(judgment.confidence());
        if (reducedConfidence) {
            confidence = confidence / 2.0;
        }
        var judgeVote = new Vote(VoterRole.JUDGE, judgment.decision(), confidence, judgment.reasoning());
        votes.add(judgeVote);
        recordVote(context, judgeVote);

        log.info("Item {} consensus: {} (confidence {}{})", context.itemIndex(), judgment.decision(),
                String.format("%.2f", confidence), reducedConfidence ? ", reduced" : "");
        return new ConsensusResult(judgment.decision(), confidence, judgment.reasoning(),
                judgment.decision() == VoteDecision.CONDITIONAL ? judgment.conditions() : List.of(),
                votes, reducedConfidence, rootCause);
    }

    private PositionResponse position(String role, String systemPrompt, String artifact) {
        return backendCalls.call("consensus-" + role,
                () -> llmService.structuredCall(systemPrompt, artifact, PositionResponse.class));
    }

    private PositionResponse await(CompletableFuture<PositionResponse> future, VoterRole role, int itemIndex) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Item {} {} position unavailable ({}), judging with reduced confidence",
                    itemIndex, role, cause.getMessage());
            return null;
        }
    }

    private Vote castVote(EvaluationContext context, VoterRole role, PositionResponse position) {
        var vote = new Vote(role, position.approved() ? VoteDecision.APPROVED : VoteDecision.REJECTED,
                clamp(position.confidence()), position.reasoning());
        recordVote(context, vote);
        return vote;
    }

    private void recordVote(EvaluationContext context, Vote vote) {
        eventStore.append(context.sessionId(), EventTypes.VOTE_CAST, Map.of(
                "itemIndex", context.itemIndex(),
                "attempt", context.attempt(),
                "role", vote.role().name(),
                "decision", vote.decision().name(),
                "confidence", vote.confidence()));
    }

    private static String renderInput(EvaluationContext context) {
        var sb = new StringBuilder(context.renderArtifact());
        if (context.semantic() != null) {
            var semantic = context.semantic();
            sb.append("## Semantic Evaluation\n")
                    .append(String.format("Satisfaction %.2f, compliant %s, uncertainty %.2f, drift %.2f%n",
                            semantic.satisfaction(), semantic.compliant(), semantic.uncertainty(),
                            semantic.combinedDrift()))
                    .append(semantic.reasoning()).append("\n\n");
        }
        if (context.trigger() != null && context.trigger().shouldTrigger()) {
            sb.append("## Why This Needs Deliberation\n").append(context.trigger().reason()).append("\n\n");
        }
        return sb.toString();
    }

    static String renderJudgePrompt(String artifact, PositionResponse advocate, PositionResponse critic) {
        var sb = new StringBuilder(artifact);
        appendPosition(sb, "Advocate", advocate);
        appendPosition(sb, "Critic", critic);
        if (advocate == null || critic == null) {
            sb.append("## Note\nThe ")
                    .append(advocate == null ? "advocate" : "critic")
                    .append(critic == null && advocate == null ? " and critic positions are" : " position is")
                    .append(" missing because the call failed. Rule on what is available and be conservative.\n");
        }
        return sb.toString();
    }

    private static void appendPosition(StringBuilder sb, String label, PositionResponse position) {
        if (position == null) {
            return;
        }
        sb.append("## ").append(label).append(" Position\n")
                .append("Accept: ").append(position.approved())
                .append(String.format(" (confidence %.2f)%n", clamp(position.confidence())));
        if (position.rootCause() != null) {
            sb.append("Addresses root cause: ").append(position.rootCause()).append('\n');
        }
        sb.append(position.reasoning() != null ? position.reasoning() : "").append("\n\n");
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}

package com.parallax.core.evaluation;

import com.parallax.core.model.AttemptRecord;
import com.parallax.core.model.ExecutionTrace;
import com.parallax.core.model.SemanticResult;
import com.parallax.core.model.Specification;
import com.parallax.core.model.TriggerResult;

import java.util.List;

/**
 * Everything an evaluator needs to judge one work item artifact.
 *
 * @param sessionId       execution session
 * @param specification   the specification being executed
 * @param itemIndex       index of the work item
 * @param itemText        text of the work item
 * @param trace           the artifact's execution trace
 * @param attempt         1-based attempt number
 * @param history         earlier attempts of this item, oldest first
 * @param lateralThinking whether this attempt used a lateral-thinking prompt
 * @param semantic        stage-2 result once available (nullable)
 * @param trigger         trigger that escalated to stage 3 (nullable)
 */
public record EvaluationContext(
    String sessionId,
    Specification specification,
    int itemIndex,
    String itemText,
    ExecutionTrace trace,
    int attempt,
    List<AttemptRecord> history,
    boolean lateralThinking,
    SemanticResult semantic,
    TriggerResult trigger
) {

    public EvaluationContext {
        history = history != null ? List.copyOf(history) : List.of();
    }

    public EvaluationContext withSemantic(SemanticResult result) {
        return new EvaluationContext(sessionId, specification, itemIndex, itemText, trace, attempt,
                history, lateralThinking, result, trigger);
    }

    public EvaluationContext withTrigger(TriggerResult result) {
        return new EvaluationContext(sessionId, specification, itemIndex, itemText, trace, attempt,
                history, lateralThinking, semantic, result);
    }

    /**
     * Acceptance context shared by the semantic and consensus prompts: goal,
     * constraints, exit conditions, the artifact and earlier attempts.
     */
    public String renderArtifact() {
        var spec = specification;
        var sb = new StringBuilder();
        sb.append("## Goal\n").append(spec.goal()).append("\n\n");
        if (!spec.constraints().isEmpty()) {
            sb.append("## Constraints\n");
            spec.constraints().forEach(c -> sb.append("- ").append(c).append('\n'));
            sb.append('\n');
        }
        if (!spec.exitConditions().isEmpty()) {
            sb.append("## Exit Conditions\n");
            for (var condition : spec.exitConditions()) {
                sb.append("- **").append(condition.name()).append("**: ").append(condition.description());
                if (condition.criteria() != null && !condition.criteria().isBlank()) {
                    sb.append(" (").append(condition.criteria()).append(')');
                }
                sb.append('\n');
            }
            sb.append('\n');
        }
        if (!spec.evaluationPrinciples().isEmpty()) {
            sb.append("## Evaluation Principles\n");
            for (var principle : spec.evaluationPrinciples()) {
                sb.append("- ").append(principle.name()).append(" (weight ").append(principle.weight())
                        .append("): ").append(principle.description()).append('\n');
            }
            sb.append('\n');
        }
        if (spec.outputSchema() != null) {
            sb.append("## Declared Output Schema: ").append(spec.outputSchema().name()).append('\n');
            for (var field : spec.outputSchema().fields()) {
                sb.append("- ").append(field.name()).append(": ").append(field.type()).append('\n');
            }
            sb.append('\n');
        }
        sb.append("## Work Item ").append(itemIndex + 1).append('\n').append(itemText).append("\n\n");
        sb.append("## Artifact (attempt ").append(attempt).append(")\n");
        sb.append("Files modified: ").append(trace.filesModified()).append('\n');
        sb.append("Tools used: ").append(trace.toolsUsed()).append("\n\n");
        sb.append(trace.finalOutput()).append("\n\n");
        if (!history.isEmpty()) {
            sb.append("## Earlier Attempts\n");
            for (var record : history) {
                sb.append("- Attempt ").append(record.attempt()).append(" stopped at ")
                        .append(record.stageReached());
                if (record.satisfaction() != null) {
                    sb.append(String.format(", satisfaction %.2f", record.satisfaction()));
                }
                if (record.uncertainty() != null) {
                    sb.append(String.format(", uncertainty %.2f", record.uncertainty()));
                }
                sb.append(": ").append(String.join("; ", record.reasons())).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}

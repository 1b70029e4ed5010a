package com.parallax.core.agent;

import com.parallax.core.model.TaskKind;

import java.util.Set;

/**
 * Per-kind agent behaviour: which tools a session gets and how the work item
 * is put to the agent. Exactly one profile exists per {@link TaskKind}.
 */
public interface TaskKindProfile {

    TaskKind kind();

    Set<AgentTool> capabilities();

    String systemPrompt();

    /** Kind-specific instructions appended to every item prompt. */
    String instructions();

    /**
     * Renders the full item prompt: goal, constraints, the item, background
     * context, sibling awareness, retry feedback and the kind's instructions.
     */
    default String renderItemPrompt(PromptInput input) {
        var spec = input.specification();
        var sb = new StringBuilder();
        sb.append("## Goal\n").append(spec.goal()).append("\n\n");
        if (!spec.constraints().isEmpty()) {
            sb.append("## Constraints\n");
            for (var constraint : spec.constraints()) {
                sb.append("- ").append(constraint).append('\n');
            }
            sb.append('\n');
        }
        if (input.parentText() != null) {
            sb.append("## Parent Work Item ").append(input.itemIndex() + 1).append('\n')
                    .append(input.parentText()).append("\n\n")
                    .append("## Your Sub-Item\n").append(input.itemText()).append("\n\n");
        } else {
            sb.append("## Work Item ").append(input.itemIndex() + 1)
                    .append(" of ").append(spec.workItems().size()).append('\n')
                    .append(input.itemText()).append("\n\n");
        }
        if (!input.siblings().isEmpty()) {
            sb.append("## Running In Parallel\n")
                    .append("Other agents are working on these at the same time. Do not touch their files.\n");
            for (var sibling : input.siblings()) {
                sb.append("- ").append(sibling).append('\n');
            }
            sb.append('\n');
        }
        if (!input.levelContext().isBlank()) {
            sb.append(input.levelContext()).append('\n');
        }
        if (!input.retryFeedback().isBlank()) {
            sb.append(input.retryFeedback()).append('\n');
        }
        if (input.lateralThinking()) {
            sb.append("## Change Of Approach\n")
                    .append("Earlier attempts kept failing the same way. Step back, question the assumptions ")
                    .append("behind them and take a fundamentally different approach.\n\n");
        }
        sb.append("## Instructions\n").append(instructions()).append('\n');
        return sb.toString();
    }
}

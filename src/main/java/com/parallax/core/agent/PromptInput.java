package com.parallax.core.agent;

import com.parallax.core.model.Specification;

import java.util.List;

/**
 * Data a task-kind profile renders into an item prompt.
 *
 * @param specification   the specification being executed
 * @param itemIndex       index of the work item
 * @param itemText        text of the work item or sub-item
 * @param parentText      parent item text when rendering a sub-item (nullable)
 * @param levelContext    rendered context of earlier levels (may be empty)
 * @param siblings        texts of concurrently running sibling sub-items
 * @param retryFeedback   feedback from earlier attempts (may be empty)
 * @param lateralThinking whether to ask for a fundamentally different approach
 */
public record PromptInput(
    Specification specification,
    int itemIndex,
    String itemText,
    String parentText,
    String levelContext,
    List<String> siblings,
    String retryFeedback,
    boolean lateralThinking
) {

    public PromptInput {
        levelContext = levelContext != null ? levelContext : "";
        siblings = siblings != null ? List.copyOf(siblings) : List.of();
        retryFeedback = retryFeedback != null ? retryFeedback : "";
    }

    public PromptInput forSubItem(String subItemText, List<String> otherSubItems) {
        return new PromptInput(specification, itemIndex, subItemText, itemText, levelContext,
                otherSubItems, retryFeedback, lateralThinking);
    }
}

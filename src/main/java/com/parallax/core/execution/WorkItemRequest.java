package com.parallax.core.execution;

import com.parallax.core.model.LevelContext;
import com.parallax.core.model.Specification;
import com.parallax.core.model.WorkItemNode;

import java.util.List;

/**
 * One attempt at executing a work item.
 *
 * @param sessionId       execution session
 * @param specification   specification the item belongs to
 * @param item            the work item
 * @param levelContexts   contexts of every finished level so far
 * @param retryFeedback   rendered feedback from earlier attempts (may be empty)
 * @param lateralThinking whether this attempt asks for a different approach
 * @param attempt         1-based attempt number
 */
public record WorkItemRequest(
    String sessionId,
    Specification specification,
    WorkItemNode item,
    List<LevelContext> levelContexts,
    String retryFeedback,
    boolean lateralThinking,
    int attempt
) {

    public WorkItemRequest {
        levelContexts = levelContexts != null ? List.copyOf(levelContexts) : List.of();
        retryFeedback = retryFeedback != null ? retryFeedback : "";
    }
}

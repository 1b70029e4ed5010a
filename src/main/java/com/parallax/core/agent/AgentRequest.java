package com.parallax.core.agent;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Everything an agent session needs: prompts, granted tools, background
 * context and a deadline.
 *
 * @param sessionId    execution session the call belongs to
 * @param itemIndex    owning work item, or -1 for coordinator sessions
 * @param subItemIndex sub-item index within the item (nullable)
 * @param systemPrompt role instructions
 * @param prompt       the task prompt
 * @param capabilities tools the session may use
 * @param context      background context (may be empty)
 * @param deadline     how long the session may run
 */
public record AgentRequest(
    String sessionId,
    int itemIndex,
    Integer subItemIndex,
    String systemPrompt,
    String prompt,
    Set<AgentTool> capabilities,
    String context,
    Duration deadline
) {

    public AgentRequest {
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(AgentTool.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        context = context != null ? context : "";
    }
}

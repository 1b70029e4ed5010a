package com.parallax.core.agent;

import com.parallax.core.model.ExecutionTrace;

/**
 * Narrow contract to the external coding agent: prompt text in, structured
 * trace out. How the agent picks a model is not the engine's concern.
 */
public interface AgentInvoker {

    /**
     * Runs one agent session.
     *
     * @param request prompts, capabilities, context and deadline
     * @return the full trace of the session
     * @throws AgentException when the session fails
     */
    ExecutionTrace invoke(AgentRequest request);
}

package com.parallax.core.agent;

import com.parallax.core.model.ExecutionTrace;

import java.util.List;

/**
 * Thrown when an agent session cannot complete. Carries whatever traces were
 * produced before the failure so callers can still account for them.
 */
public class AgentException extends RuntimeException {

    private final List<ExecutionTrace> partialTraces;

    public AgentException(String message) {
        this(message, null, List.of());
    }

    public AgentException(String message, Throwable cause) {
        this(message, cause, List.of());
    }

    public AgentException(String message, Throwable cause, List<ExecutionTrace> partialTraces) {
        super(message, cause);
        this.partialTraces = partialTraces != null ? List.copyOf(partialTraces) : List.of();
    }

    public List<ExecutionTrace> getPartialTraces() {
        return partialTraces;
    }
}

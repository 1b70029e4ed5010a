package com.parallax.core.resilience;

import java.time.Duration;

/**
 * Thrown when an external call does not return before its deadline.
 */
public class BackendTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration deadline;

    public BackendTimeoutException(String operation, Duration deadline) {
        super(operation + " timed out after " + deadline.toSeconds() + "s");
        this.operation = operation;
        this.deadline = deadline;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getDeadline() {
        return deadline;
    }
}

package com.parallax.core.model;

/**
 * Lifecycle status of an execution session.
 */
public enum SessionStatus {
    ANALYZING,
    EXECUTING,
    COMPLETED,
    PARTIAL,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIAL || this == FAILED || this == CANCELLED;
    }
}

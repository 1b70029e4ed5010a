package com.parallax.core.model;

/**
 * Lifecycle status of a work item within a session.
 */
public enum ItemStatus {
    PENDING,
    RUNNING,
    RETRYING,
    ACCEPTED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == ACCEPTED || this == FAILED || this == SKIPPED;
    }
}

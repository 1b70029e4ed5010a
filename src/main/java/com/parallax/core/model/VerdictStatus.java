package com.parallax.core.model;

/**
 * What the pipeline tells the orchestrator to do with an attempt.
 */
public enum VerdictStatus {
    /** Every stage that ran passed. */
    APPROVED,
    /** Mechanical checks failed and the attempt budget allows another try. */
    RETRY,
    /** Semantic or consensus stage rejected the artifact. */
    REJECTED,
    /** Consensus approved only with required changes. */
    CONDITIONAL,
    /** Mechanical checks failed on the last allowed attempt. */
    FAILED
}

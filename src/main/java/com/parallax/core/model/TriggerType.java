package com.parallax.core.model;

/**
 * Conditions that escalate evaluation to consensus, in evaluation order.
 */
public enum TriggerType {
    FINAL_DELIVERABLE,
    SCHEMA_ALTERED,
    ONTOLOGY_AFFECTING,
    DRIFT_EXCEEDED,
    UNCERTAINTY_EXCEEDED,
    LATERAL_THINKING
}

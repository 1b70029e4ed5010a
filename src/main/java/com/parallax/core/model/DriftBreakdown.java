package com.parallax.core.model;

import java.io.Serializable;

/**
 * Measured deviation of an artifact from the specification, per dimension.
 * Each score is in [0, 1].
 */
public record DriftBreakdown(
    double goal,
    double constraint,
    double ontology
) implements Serializable {

    public static final double GOAL_WEIGHT = 0.5;
    public static final double CONSTRAINT_WEIGHT = 0.3;
    public static final double ONTOLOGY_WEIGHT = 0.2;

    public DriftBreakdown {
        goal = clamp(goal);
        constraint = clamp(constraint);
        ontology = clamp(ontology);
    }

    public double combined() {
        return combined(GOAL_WEIGHT, CONSTRAINT_WEIGHT, ONTOLOGY_WEIGHT);
    }

    public double combined(double goalWeight, double constraintWeight, double ontologyWeight) {
        return goal * goalWeight + constraint * constraintWeight + ontology * ontologyWeight;
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}

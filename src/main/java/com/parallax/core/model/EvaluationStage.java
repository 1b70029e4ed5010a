package com.parallax.core.model;

/**
 * Ordered stages of the evaluation pipeline.
 */
public enum EvaluationStage {
    NONE(0),
    MECHANICAL(1),
    SEMANTIC(2),
    CONSENSUS(3);

    private final int number;

    EvaluationStage(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }
}

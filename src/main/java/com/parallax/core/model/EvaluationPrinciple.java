package com.parallax.core.model;

import java.io.Serializable;

/**
 * A weighted principle the artifact is judged against.
 *
 * @param weight relative importance in [0, 1]
 */
public record EvaluationPrinciple(
    String name,
    String description,
    double weight
) implements Serializable {}

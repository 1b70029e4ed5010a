package com.parallax.core.consensus;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Advocate or critic position.
 *
 * @param approved   whether this role would accept the artifact
 * @param confidence confidence in the position, 0.0 to 1.0
 * @param reasoning  the argument
 * @param rootCause  critic only: true when the artifact addresses the root requirement, not a symptom
 */
public record PositionResponse(
    boolean approved,
    double confidence,
    String reasoning,
    @JsonProperty("root_cause") Boolean rootCause
) {}

package com.parallax.core.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw stage-2 answer from the backend. Numbers are clamped when converted
 * into a {@link com.parallax.core.model.SemanticResult}.
 */
public record SemanticAssessment(
    double score,
    @JsonProperty("ac_compliance") boolean acCompliance,
    @JsonProperty("goal_drift") double goalDrift,
    @JsonProperty("constraint_drift") double constraintDrift,
    @JsonProperty("ontology_drift") double ontologyDrift,
    double uncertainty,
    @JsonProperty("schema_altered") boolean schemaAltered,
    String reasoning
) {}

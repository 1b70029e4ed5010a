package com.parallax.core.model;

import java.io.Serializable;

/**
 * Verdict of the semantic evaluation stage.
 *
 * @param satisfaction  how well the artifact satisfies the item, in [0, 1]
 * @param compliant     whether the acceptance criterion is met
 * @param uncertainty   evaluator's uncertainty, in [0, 1]
 * @param drift         per-dimension drift
 * @param combinedDrift weighted drift used by the trigger matrix
 * @param schemaAltered whether the artifact changes the declared output schema
 * @param reasoning     evaluator's explanation
 * @param passed        whether the stage passed
 */
public record SemanticResult(
    double satisfaction,
    boolean compliant,
    double uncertainty,
    DriftBreakdown drift,
    double combinedDrift,
    boolean schemaAltered,
    String reasoning,
    boolean passed
) implements Serializable {

    public SemanticResult {
        satisfaction = DriftBreakdown.clamp(satisfaction);
        uncertainty = DriftBreakdown.clamp(uncertainty);
        reasoning = reasoning != null ? reasoning : "";
    }
}

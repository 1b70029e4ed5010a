package com.parallax.core.evaluation;

import com.parallax.core.model.SemanticResult;
import com.parallax.core.model.Specification;
import com.parallax.core.model.TriggerResult;
import com.parallax.core.model.TriggerType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decides whether an artifact needs consensus deliberation. Conditions are
 * checked in a fixed order and the first match wins. Pure.
 */
public class TriggerMatrix {

    private final double driftThreshold;
    private final double uncertaintyThreshold;

    public TriggerMatrix(double driftThreshold, double uncertaintyThreshold) {
        this.driftThreshold = driftThreshold;
        this.uncertaintyThreshold = uncertaintyThreshold;
    }

    public static TriggerMatrix from(EvaluationProperties properties) {
        return new TriggerMatrix(properties.getDriftTriggerThreshold(), properties.getUncertaintyTriggerThreshold());
    }

    public TriggerResult evaluate(Specification spec, int itemIndex, SemanticResult semantic, boolean lateralThinking) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("itemIndex", itemIndex);
        details.put("combinedDrift", semantic.combinedDrift());
        details.put("uncertainty", semantic.uncertainty());
        details.put("lateralThinking", lateralThinking);

        if (spec.isFinalItem(itemIndex)) {
            return fire(TriggerType.FINAL_DELIVERABLE, "Item produces a final deliverable", details);
        }
        if (semantic.schemaAltered()) {
            return fire(TriggerType.SCHEMA_ALTERED, "Artifact alters the output schema", details);
        }
        if (spec.isOntologyAffecting(itemIndex)) {
            return fire(TriggerType.ONTOLOGY_AFFECTING, "Item is marked ontology-affecting", details);
        }
        if (semantic.combinedDrift() > driftThreshold) {
            return fire(TriggerType.DRIFT_EXCEEDED, String.format("Drift %.2f exceeds %.2f",
                    semantic.combinedDrift(), driftThreshold), details);
        }
        if (semantic.uncertainty() > uncertaintyThreshold) {
            return fire(TriggerType.UNCERTAINTY_EXCEEDED, String.format("Uncertainty %.2f exceeds %.2f",
                    semantic.uncertainty(), uncertaintyThreshold), details);
        }
        if (lateralThinking) {
            return fire(TriggerType.LATERAL_THINKING, "Attempt adopted a lateral-thinking strategy", details);
        }
        return TriggerResult.none(details);
    }

    private static TriggerResult fire(TriggerType type, String reason, Map<String, Object> details) {
        return new TriggerResult(true, type, reason, details);
    }
}

package com.parallax.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Outcome of the trigger matrix.
 *
 * @param shouldTrigger whether consensus must run
 * @param triggerType   the first condition that fired (null when none)
 * @param reason        human-readable reason
 * @param details       values the decision was based on
 */
public record TriggerResult(
    boolean shouldTrigger,
    TriggerType triggerType,
    String reason,
    Map<String, Object> details
) implements Serializable {

    public TriggerResult {
        reason = reason != null ? reason : "";
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static TriggerResult none(Map<String, Object> details) {
        return new TriggerResult(false, null, "No trigger conditions met", details);
    }
}

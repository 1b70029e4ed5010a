package com.parallax.core.execution;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Backend answer to "is this item atomic, or should it be split?".
 *
 * @param atomic    true when the item should run as one agent session
 * @param subItems  independent sub-items when not atomic
 * @param reasoning short justification
 */
public record DecompositionDecision(
    boolean atomic,
    @JsonProperty("sub_items") List<String> subItems,
    String reasoning
) {

    public DecompositionDecision {
        subItems = subItems != null ? List.copyOf(subItems) : List.of();
        reasoning = reasoning != null ? reasoning : "";
    }

    public static DecompositionDecision atomic(String reasoning) {
        return new DecompositionDecision(true, List.of(), reasoning);
    }
}

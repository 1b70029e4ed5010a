package com.parallax.core.scheduler;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Backend answer to the dependency question: prerequisites per item.
 */
public record DependencyResponse(List<ItemDependencies> dependencies) {

    public record ItemDependencies(
        @JsonProperty("ac_index") @JsonAlias("item_index") int itemIndex,
        @JsonProperty("depends_on") List<Integer> dependsOn
    ) {}
}

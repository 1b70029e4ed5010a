package com.parallax.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One work item in the dependency graph.
 *
 * @param index     position of the item in the specification
 * @param text      natural-language item text
 * @param dependsOn indices of items that must complete first
 */
public record WorkItemNode(
    int index,
    String text,
    SortedSet<Integer> dependsOn
) implements Serializable {

    public WorkItemNode {
        dependsOn = dependsOn != null
                ? Collections.unmodifiableSortedSet(new TreeSet<>(dependsOn))
                : Collections.emptySortedSet();
    }

    public WorkItemNode(int index, String text, Set<Integer> dependsOn) {
        this(index, text, dependsOn != null ? new TreeSet<>(dependsOn) : null);
    }

    public boolean isIndependent() {
        return dependsOn.isEmpty();
    }
}

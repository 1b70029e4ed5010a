package com.parallax.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable goal contract executed by the engine.
 * <p>
 * Every collection is copied on construction and exposed unmodifiable; the
 * engine only ever reads a specification.
 *
 * @param goal                   what the work must achieve
 * @param taskKind               kind of work, selecting the agent profile
 * @param constraints            constraints every artifact must respect
 * @param workItems              ordered natural-language work items
 * @param outputSchema           declared shape of the output
 * @param evaluationPrinciples   weighted evaluation principles
 * @param exitConditions         conditions marking the work finished
 * @param metadata               provenance and ambiguity score
 * @param finalItems             indices of items whose artifacts are final or irreversible
 * @param ontologyAffectingItems indices of items explicitly marked as changing the ontology
 */
public record Specification(
    String goal,
    TaskKind taskKind,
    List<String> constraints,
    List<String> workItems,
    OutputSchema outputSchema,
    List<EvaluationPrinciple> evaluationPrinciples,
    List<ExitCondition> exitConditions,
    SpecificationMetadata metadata,
    Set<Integer> finalItems,
    Set<Integer> ontologyAffectingItems
) implements Serializable {

    public Specification {
        taskKind = taskKind != null ? taskKind : TaskKind.CODE;
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        workItems = workItems != null ? Collections.unmodifiableList(new ArrayList<>(workItems)) : null;
        evaluationPrinciples = evaluationPrinciples != null ? List.copyOf(evaluationPrinciples) : List.of();
        exitConditions = exitConditions != null ? List.copyOf(exitConditions) : List.of();
        finalItems = finalItems != null ? Collections.unmodifiableSortedSet(new TreeSet<>(finalItems)) : Set.of();
        ontologyAffectingItems = ontologyAffectingItems != null
                ? Collections.unmodifiableSortedSet(new TreeSet<>(ontologyAffectingItems)) : Set.of();
    }

    public String specId() {
        return metadata != null && metadata.specId() != null ? metadata.specId() : "";
    }

    public boolean isFinalItem(int index) {
        return finalItems.contains(index);
    }

    public boolean isOntologyAffecting(int index) {
        return ontologyAffectingItems.contains(index);
    }

    public String workItem(int index) {
        return workItems.get(index);
    }
}

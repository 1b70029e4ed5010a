package com.parallax.core.spec;

import com.parallax.core.model.Specification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks that a specification carries every field the engine needs before
 * any work is dispatched.
 * <p>
 * Required: {@code goal}, a non-empty {@code work_items} list,
 * {@code output_schema} and {@code metadata.ambiguity_score}. Scores and
 * weights must lie in [0, 1] and item markers must reference existing items.
 * The ambiguity threshold itself is enforced upstream.
 */
@Component
public class SpecificationValidator {

    private static final Logger log = LoggerFactory.getLogger(SpecificationValidator.class);

    public List<String> violations(Specification spec) {
        var violations = new ArrayList<String>();
        if (spec == null) {
            violations.add("specification is missing");
            return violations;
        }
        if (spec.goal() == null || spec.goal().isBlank()) {
            violations.add("goal is required");
        }
        if (spec.workItems() == null || spec.workItems().isEmpty()) {
            violations.add("work_items is required and must not be empty");
        } else {
            for (int i = 0; i < spec.workItems().size(); i++) {
                String item = spec.workItems().get(i);
                if (item == null || item.isBlank()) {
                    violations.add("work_items[" + i + "] is blank");
                }
            }
        }
        if (spec.outputSchema() == null) {
            violations.add("output_schema is required");
        } else {
            var fields = spec.outputSchema().fields();
            for (int i = 0; i < fields.size(); i++) {
                var field = fields.get(i);
                if (field.name() == null || field.name().isBlank()) {
                    violations.add("output_schema.fields[" + i + "].name is required");
                }
                if (field.type() == null || field.type().isBlank()) {
                    violations.add("output_schema.fields[" + i + "].type is required");
                }
            }
        }
        if (spec.metadata() == null || spec.metadata().ambiguityScore() == null) {
            violations.add("metadata.ambiguity_score is required");
        } else if (!inUnitRange(spec.metadata().ambiguityScore())) {
            violations.add("metadata.ambiguity_score must be between 0 and 1");
        }
        for (var principle : spec.evaluationPrinciples()) {
            if (!inUnitRange(principle.weight())) {
                violations.add("evaluation_principles." + principle.name() + ".weight must be between 0 and 1");
            }
        }
        for (var condition : spec.exitConditions()) {
            if (condition.name() == null || condition.name().isBlank()) {
                violations.add("exit_conditions entries need a name");
            }
        }
        int itemCount = spec.workItems() != null ? spec.workItems().size() : 0;
        checkMarkers("final_items", spec.finalItems(), itemCount, violations);
        checkMarkers("ontology_affecting_items", spec.ontologyAffectingItems(), itemCount, violations);
        return violations;
    }

    /**
     * @throws InvalidSpecificationException listing every violation
     */
    public Specification validate(Specification spec) {
        var violations = violations(spec);
        if (!violations.isEmpty()) {
            log.warn("Specification rejected with {} violation(s): {}", violations.size(), violations);
            throw new InvalidSpecificationException(violations);
        }
        log.info("Specification {} accepted: {} work item(s), kind {}",
                spec.specId(), spec.workItems().size(), spec.taskKind());
        return spec;
    }

    private static void checkMarkers(String name, Set<Integer> markers, int itemCount, List<String> violations) {
        for (int index : markers) {
            if (index < 0 || index >= itemCount) {
                violations.add(name + " references unknown item " + index);
            }
        }
    }

    private static boolean inUnitRange(double value) {
        return value >= 0.0 && value <= 1.0;
    }
}

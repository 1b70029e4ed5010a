package com.parallax.core.evaluation;

import com.parallax.core.model.CheckResult;
import com.parallax.core.model.EvaluationStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stage 1. Runs every configured check in order; the stage passes only when
 * all of them pass. Costs no backend calls.
 */
@Component
public class MechanicalVerifier implements ArtifactEvaluator {

    private static final Logger log = LoggerFactory.getLogger(MechanicalVerifier.class);

    private final CheckRunner checkRunner;
    private final Map<String, EvaluationProperties.Check> checks;

    @Autowired
    public MechanicalVerifier(CheckRunner checkRunner, EvaluationProperties properties) {
        this(checkRunner, properties.getMechanical().getChecks());
    }

    public MechanicalVerifier(CheckRunner checkRunner, Map<String, EvaluationProperties.Check> checks) {
        this.checkRunner = checkRunner;
        this.checks = new LinkedHashMap<>(checks);
    }

    @Override
    public EvaluationStage stage() {
        return EvaluationStage.MECHANICAL;
    }

    @Override
    public StageOutcome evaluate(EvaluationContext context) {
        var results = new ArrayList<CheckResult>();
        for (var entry : checks.entrySet()) {
            var check = entry.getValue();
            var result = checkRunner.run(entry.getKey(), check.getType(), check.getCommand());
            log.debug("Item {} check {} ({}): {}", context.itemIndex(), entry.getKey(), check.getType(),
                    result.passed() ? "passed" : result.message());
            results.add(result);
        }
        List<String> reasons = results.stream()
                .filter(r -> !r.passed())
                .map(r -> "Check '" + r.name() + "' (" + r.type() + ") failed: " + r.message())
                .toList();
        boolean passed = reasons.isEmpty();
        log.info("Item {} mechanical checks: {}/{} passed", context.itemIndex(),
                results.size() - reasons.size(), results.size());
        return StageOutcome.mechanical(passed, reasons, results);
    }
}

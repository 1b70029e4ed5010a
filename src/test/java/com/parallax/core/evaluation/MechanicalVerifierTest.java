package com.parallax.core.evaluation;

import com.parallax.core.Fixtures;
import com.parallax.core.model.CheckResult;
import com.parallax.core.model.CheckType;
import com.parallax.core.model.EvaluationStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MechanicalVerifierTest {

    private final CheckRunner runner = mock(CheckRunner.class);

    private static Map<String, EvaluationProperties.Check> checks() {
        var checks = new LinkedHashMap<String, EvaluationProperties.Check>();
        checks.put("lint", new EvaluationProperties.Check(CheckType.LINT, "ruff check ."));
        checks.put("build", new EvaluationProperties.Check(CheckType.BUILD, "mvn -q compile"));
        checks.put("test", new EvaluationProperties.Check(CheckType.TEST, "mvn -q test"));
        return checks;
    }

    private static EvaluationContext context() {
        return new EvaluationContext("s1", Fixtures.spec("A"), 0, "A", Fixtures.trace(0, true),
                1, List.of(), false, null, null);
    }

    @Test
    @DisplayName("Runs every check in configured order and passes when all pass")
    void allPass() {
        when(runner.run(anyString(), any(), anyString()))
                .thenAnswer(inv -> new CheckResult(inv.getArgument(1), inv.getArgument(0), true, "Passed", ""));

        var outcome = new MechanicalVerifier(runner, checks()).evaluate(context());

        assertEquals(EvaluationStage.MECHANICAL, outcome.stage());
        assertTrue(outcome.passed());
        assertEquals(List.of("lint", "build", "test"), outcome.checks().stream().map(CheckResult::name).toList());
        InOrder order = inOrder(runner);
        order.verify(runner).run("lint", CheckType.LINT, "ruff check .");
        order.verify(runner).run("build", CheckType.BUILD, "mvn -q compile");
        order.verify(runner).run("test", CheckType.TEST, "mvn -q test");
    }

    @Test
    @DisplayName("One failing check fails the stage with a reason naming it")
    void oneFails() {
        when(runner.run(anyString(), any(), anyString()))
                .thenAnswer(inv -> new CheckResult(inv.getArgument(1), inv.getArgument(0), true, "Passed", ""));
        when(runner.run(eq("test"), any(), anyString()))
                .thenReturn(new CheckResult(CheckType.TEST, "test", false, "Exit code 1", "1 failed"));

        var outcome = new MechanicalVerifier(runner, checks()).evaluate(context());

        assertFalse(outcome.passed());
        assertEquals(List.of("Check 'test' (TEST) failed: Exit code 1"), outcome.reasons());
        assertEquals(3, outcome.checks().size());
    }

    @Test
    @DisplayName("No configured checks pass trivially")
    void noChecks() {
        var outcome = new MechanicalVerifier(runner, Map.of()).evaluate(context());

        assertTrue(outcome.passed());
        verifyNoInteractions(runner);
    }
}

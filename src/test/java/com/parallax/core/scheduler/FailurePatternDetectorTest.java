package com.parallax.core.scheduler;

import com.parallax.core.model.AttemptRecord;
import com.parallax.core.model.EvaluationStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FailurePatternDetectorTest {

    private static AttemptRecord failure(int attempt, String reason) {
        return new AttemptRecord(attempt, EvaluationStage.MECHANICAL, List.of(reason), null, null, false, false);
    }

    @Test
    @DisplayName("Too little history never shows a pattern")
    void shortHistory() {
        assertFalse(FailurePatternDetector.needsLateralThinking(List.of()));
        assertFalse(FailurePatternDetector.needsLateralThinking(List.of(failure(1, "A"))));
    }

    @Test
    @DisplayName("The same failure twice in a row is stagnation")
    void stagnation() {
        var history = List.of(failure(1, "tests fail"), failure(2, "tests fail"));

        assertTrue(FailurePatternDetector.isStagnating(history));
        assertTrue(FailurePatternDetector.needsLateralThinking(history));
    }

    @Test
    @DisplayName("A-B-A is oscillation")
    void oscillation() {
        var history = List.of(failure(1, "A"), failure(2, "B"), failure(3, "A"));

        assertTrue(FailurePatternDetector.isOscillating(history));
        assertFalse(FailurePatternDetector.isStagnating(history));
    }

    @Test
    @DisplayName("Different failures each time show no pattern")
    void noPattern() {
        var history = List.of(failure(1, "A"), failure(2, "B"), failure(3, "C"));

        assertFalse(FailurePatternDetector.needsLateralThinking(history));
    }

    @Test
    @DisplayName("Failures at different stages with the same reason differ")
    void stageIsPartOfTheKey() {
        var semantic = new AttemptRecord(2, EvaluationStage.SEMANTIC, List.of("tests fail"), 0.5, 0.1, false, false);

        assertFalse(FailurePatternDetector.isStagnating(List.of(failure(1, "tests fail"), semantic)));
    }
}

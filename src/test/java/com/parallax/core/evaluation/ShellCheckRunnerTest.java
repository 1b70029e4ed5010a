package com.parallax.core.evaluation;

import com.parallax.core.model.CheckType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ShellCheckRunnerTest {

    @TempDir
    Path workspace;

    private ShellCheckRunner runner(Duration timeout) {
        return new ShellCheckRunner(workspace, timeout, 0.7);
    }

    private ShellCheckRunner runner() {
        return runner(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("Exit code 0 passes and keeps the output")
    void passes() {
        var result = runner().run("build", CheckType.BUILD, "echo compiled");

        assertTrue(result.passed());
        assertEquals("Passed", result.message());
        assertTrue(result.details().contains("compiled"));
    }

    @Test
    @DisplayName("Output that is not valid UTF-8 does not fail a passing command")
    void latin1Output() {
        var result = runner().run("build", CheckType.BUILD, "printf 'caf\\351 built\\n'; exit 0");

        assertTrue(result.passed());
        assertEquals("Passed", result.message());
        assertTrue(result.details().contains("built"));
    }

    @Test
    @DisplayName("A non-zero exit fails with the exit code")
    void nonZeroExit() {
        var result = runner().run("test", CheckType.TEST, "echo 2 failures; exit 3");

        assertFalse(result.passed());
        assertEquals("Exit code 3", result.message());
        assertTrue(result.details().contains("2 failures"));
    }

    @Test
    @DisplayName("An unknown command is reported as not found")
    void commandNotFound() {
        var result = runner().run("lint", CheckType.LINT, "parallax-no-such-linter --all");

        assertFalse(result.passed());
        assertTrue(result.message().startsWith("Command not found"));
    }

    @Test
    @DisplayName("A blank command is skipped and counts as passed")
    void blankSkipped() {
        var result = runner().run("static", CheckType.STATIC, "  ");

        assertTrue(result.passed());
        assertTrue(result.message().startsWith("Skipped"));
    }

    @Test
    @DisplayName("Commands run in the working directory")
    void workingDirectory() throws Exception {
        Files.writeString(workspace.resolve("marker.txt"), "here");

        assertTrue(runner().run("build", CheckType.BUILD, "test -f marker.txt").passed());
    }

    @Test
    @DisplayName("A command past its timeout fails")
    void timeout() {
        var result = runner(Duration.ofMillis(300)).run("test", CheckType.TEST, "sleep 5");

        assertFalse(result.passed());
        assertTrue(result.message().startsWith("Timed out"));
    }

    @Nested
    @DisplayName("Coverage")
    class Coverage {

        @Test
        @DisplayName("A TOTAL line above the threshold passes")
        void totalAbove() {
            var result = runner().run("coverage", CheckType.COVERAGE, "echo 'TOTAL    120     12    90%'");

            assertTrue(result.passed());
            assertTrue(result.message().startsWith("Coverage 90.0%"));
        }

        @Test
        @DisplayName("A labelled figure below the threshold fails")
        void labelBelow() {
            var result = runner().run("coverage", CheckType.COVERAGE, "echo 'Coverage: 55.5%'");

            assertFalse(result.passed());
        }

        @Test
        @DisplayName("Output without a figure fails")
        void missingFigure() {
            var result = runner().run("coverage", CheckType.COVERAGE, "echo done");

            assertFalse(result.passed());
            assertEquals("No coverage figure found in output", result.message());
        }

        @Test
        @DisplayName("Parses both report styles")
        void parse() {
            assertEquals(81.0, ShellCheckRunner.parseCoverage("Name  Stmts Miss Cover\nTOTAL 100 19 81%").getAsDouble());
            assertEquals(72.25, ShellCheckRunner.parseCoverage("Coverage: 72.25%").getAsDouble());
            assertTrue(ShellCheckRunner.parseCoverage("nothing here").isEmpty());
        }
    }
}

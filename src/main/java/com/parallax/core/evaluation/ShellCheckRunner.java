package com.parallax.core.evaluation;

import com.parallax.core.model.CheckResult;
import com.parallax.core.model.CheckType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs a check command through {@code sh -c} in the configured working
 * directory. Exit code 0 passes; coverage checks additionally compare the
 * reported percentage with the threshold.
 */
@Component
public class ShellCheckRunner implements CheckRunner {

    private static final Logger log = LoggerFactory.getLogger(ShellCheckRunner.class);

    /** coverage.py / pytest-cov style: "TOTAL  120  12  90%" */
    static final Pattern COVERAGE_TOTAL = Pattern.compile("TOTAL\\s+\\d+\\s+\\d+\\s+(\\d+)%");

    /** Generic: "Coverage: 87.5%" */
    static final Pattern COVERAGE_LABEL = Pattern.compile("Coverage:\\s*(\\d+(?:\\.\\d+)?)%");

    private static final int COMMAND_NOT_FOUND = 127;
    private static final int MAX_DETAIL_CHARS = 4000;

    private final Path workingDirectory;
    private final Duration timeout;
    private final double coverageThreshold;

    @Autowired
    public ShellCheckRunner(EvaluationProperties properties) {
        this(Path.of(properties.getMechanical().getWorkingDirectory()),
                Duration.ofSeconds(properties.getMechanical().getTimeoutSeconds()),
                properties.getMechanical().getCoverageThreshold());
    }

    public ShellCheckRunner(Path workingDirectory, Duration timeout, double coverageThreshold) {
        this.workingDirectory = workingDirectory;
        this.timeout = timeout;
        this.coverageThreshold = coverageThreshold;
    }

    @Override
    public CheckResult run(String name, CheckType type, String command) {
        if (command == null || command.isBlank()) {
            return new CheckResult(type, name, true, "Skipped: no command configured", "");
        }
        Path outputFile = null;
        try {
            outputFile = Files.createTempFile("parallax-check-", ".log");
            var process = new ProcessBuilder(List.of("sh", "-c", command))
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile())
                    .start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Check {} timed out after {}s", name, timeout.toSeconds());
                return new CheckResult(type, name, false,
                        "Timed out after " + timeout.toSeconds() + "s", tail(read(outputFile)));
            }
            String output = read(outputFile);
            int exitCode = process.exitValue();
            if (exitCode == COMMAND_NOT_FOUND) {
                return new CheckResult(type, name, false, "Command not found: " + command, tail(output));
            }
            if (exitCode != 0) {
                return new CheckResult(type, name, false, "Exit code " + exitCode, tail(output));
            }
            if (type == CheckType.COVERAGE) {
                return coverageResult(name, output);
            }
            return new CheckResult(type, name, true, "Passed", tail(output));
        } catch (IOException e) {
            log.warn("Check {} could not be started: {}", name, e.getMessage());
            return new CheckResult(type, name, false, "Could not run command: " + e.getMessage(), "");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new CheckResult(type, name, false, "Interrupted", "");
        } finally {
            deleteQuietly(outputFile);
        }
    }

    CheckResult coverageResult(String name, String output) {
        var coverage = parseCoverage(output);
        if (coverage.isEmpty()) {
            return new CheckResult(CheckType.COVERAGE, name, false, "No coverage figure found in output", tail(output));
        }
        double percent = coverage.getAsDouble();
        boolean passed = percent >= coverageThreshold * 100.0;
        String message = String.format("Coverage %.1f%% (threshold %.1f%%)", percent, coverageThreshold * 100.0);
        return new CheckResult(CheckType.COVERAGE, name, passed, message, tail(output));
    }

    static OptionalDouble parseCoverage(String output) {
        Matcher total = COVERAGE_TOTAL.matcher(output);
        if (total.find()) {
            return OptionalDouble.of(Double.parseDouble(total.group(1)));
        }
        Matcher label = COVERAGE_LABEL.matcher(output);
        if (label.find()) {
            return OptionalDouble.of(Double.parseDouble(label.group(1)));
        }
        return OptionalDouble.empty();
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static String tail(String output) {
        return output.length() > MAX_DETAIL_CHARS ? output.substring(output.length() - MAX_DETAIL_CHARS) : output;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete check output {}: {}", file, e.getMessage());
        }
    }
}

package com.parallax.dispatch.cli;

import com.parallax.core.model.Specification;
import com.parallax.core.spec.InvalidSpecificationException;
import com.parallax.core.spec.SpecificationLoader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads a specification file for a command, reporting problems on the console.
 */
final class SpecFiles {

    static final int EXIT_INVALID = 2;

    private SpecFiles() {
    }

    static Optional<Specification> load(SpecificationLoader loader, Path path) {
        try {
            return Optional.of(loader.load(path));
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + path + ": " + e.getMessage());
        } catch (InvalidSpecificationException e) {
            ConsoleOutput.error("Invalid specification " + path + ":");
            if (e.getViolations().isEmpty()) {
                ConsoleOutput.error("  " + e.getMessage());
            }
            for (String violation : e.getViolations()) {
                ConsoleOutput.error("  " + violation);
            }
        }
        return Optional.empty();
    }
}

package com.parallax.dispatch.cli;

import com.parallax.core.spec.SpecificationLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: parallax validate &lt;spec-file&gt;
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate a specification file")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Specification file (JSON or YAML)")
    private Path specFile;

    private final SpecificationLoader loader;

    public ValidateCommand(SpecificationLoader loader) {
        this.loader = loader;
    }

    @Override
    public Integer call() {
        return SpecFiles.load(loader, specFile)
                .map(spec -> {
                    ConsoleOutput.success(String.format("Valid: %s (%d work items, kind %s)",
                            spec.specId(), spec.workItems().size(), spec.taskKind()));
                    return 0;
                })
                .orElse(SpecFiles.EXIT_INVALID);
    }
}

package com.parallax.dispatch.cli;

import com.parallax.core.scheduler.DependencyAnalyzer;
import com.parallax.core.spec.SpecificationLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: parallax graph &lt;spec-file&gt;
 * <p>
 * Infers the dependency graph of a specification's work items and prints
 * the execution levels without running anything.
 */
@Command(name = "graph", mixinStandardHelpOptions = true, description = "Print the inferred execution levels")
@Component
public class GraphCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Specification file (JSON or YAML)")
    private Path specFile;

    private final SpecificationLoader loader;
    private final DependencyAnalyzer analyzer;

    public GraphCommand(SpecificationLoader loader, DependencyAnalyzer analyzer) {
        this.loader = loader;
        this.analyzer = analyzer;
    }

    @Override
    public Integer call() {
        var loaded = SpecFiles.load(loader, specFile);
        if (loaded.isEmpty()) {
            return SpecFiles.EXIT_INVALID;
        }
        var spec = loaded.get();
        ConsoleOutput.info("Analyzing dependencies of " + spec.workItems().size() + " work items...");
        var graph = analyzer.analyze(spec.workItems());
        if (graph.degraded()) {
            ConsoleOutput.warn("Dependency analysis failed; all items run in one level");
        }
        for (int level = 0; level < graph.levelCount(); level++) {
            ConsoleOutput.level(level, graph.levels().get(level), spec.workItems());
        }
        for (var node : graph.nodes()) {
            if (!node.isIndependent()) {
                System.out.printf("  %d depends on %s%n", node.index() + 1,
                        node.dependsOn().stream().map(i -> String.valueOf(i + 1)).toList());
            }
        }
        return 0;
    }
}

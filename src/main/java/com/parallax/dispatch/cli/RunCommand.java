package com.parallax.dispatch.cli;

import com.parallax.core.engine.ExecutionEngine;
import com.parallax.core.model.SessionStatus;
import com.parallax.core.spec.SpecificationLoader;
import com.parallax.core.state.ParallaxState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: parallax run &lt;spec-file&gt; [--session-id ID]
 * <p>
 * Loads, validates and executes a specification, then prints per-item
 * outcomes and session metrics. Exits non-zero unless every item was accepted.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Execute a specification")
@Component
public class RunCommand implements Callable<Integer> {

    static final int EXIT_INCOMPLETE = 1;

    @Parameters(index = "0", description = "Specification file (JSON or YAML)")
    private Path specFile;

    @Option(names = {"--session-id", "-s"}, description = "Session id to run under (generated when omitted)")
    private String sessionId;

    private final SpecificationLoader loader;
    private final ExecutionEngine engine;

    public RunCommand(SpecificationLoader loader, ExecutionEngine engine) {
        this.loader = loader;
        this.engine = engine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var loaded = SpecFiles.load(loader, specFile);
        if (loaded.isEmpty()) {
            return SpecFiles.EXIT_INVALID;
        }
        var spec = loaded.get();
        String id = sessionId != null && !sessionId.isBlank() ? sessionId : engine.generateSessionId();
        ConsoleOutput.info("Session " + id + ": " + spec.goal());

        ParallaxState finalState;
        try {
            finalState = engine.run(id, spec);
        } catch (Exception e) {
            ConsoleOutput.error("Session failed: " + rootCauseMessage(e));
            return EXIT_INCOMPLETE;
        }
        print(finalState);
        return finalState.status() == SessionStatus.COMPLETED ? 0 : EXIT_INCOMPLETE;
    }

    private static void print(ParallaxState state) {
        var spec = state.specification();
        state.dependencyGraph().ifPresent(graph -> {
            if (graph.degraded()) {
                ConsoleOutput.warn("Dependency analysis degraded: all items ran in one level");
            }
            for (int level = 0; level < graph.levelCount(); level++) {
                ConsoleOutput.level(level, graph.levels().get(level), spec.workItems());
            }
        });

        System.out.println();
        System.out.println("OUTCOMES:");
        for (var item : state.ledger().items().values()) {
            ConsoleOutput.itemOutcome(item, spec.workItems().get(item.index()));
        }

        for (var context : state.levelContexts()) {
            if (context.hasReview()) {
                for (String warning : context.review().warnings()) {
                    ConsoleOutput.warn("Level " + context.levelNumber() + ": " + warning);
                }
            }
        }

        var errors = state.errors();
        if (!errors.isEmpty()) {
            System.out.println();
            ConsoleOutput.error("Errors (" + errors.size() + "):");
            for (var e : errors) {
                ConsoleOutput.error("  " + e);
            }
        }

        state.metrics().ifPresent(ConsoleOutput::metrics);

        System.out.println();
        switch (state.status()) {
            case COMPLETED -> ConsoleOutput.success("Session complete.");
            case PARTIAL -> ConsoleOutput.warn("Session partially complete.");
            case CANCELLED -> ConsoleOutput.warn("Session cancelled.");
            default -> ConsoleOutput.error("Session status: " + state.status());
        }
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

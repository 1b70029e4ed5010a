package com.parallax.core;

import com.parallax.core.model.ExecutionTrace;
import com.parallax.core.model.ExitCondition;
import com.parallax.core.model.OutputField;
import com.parallax.core.model.OutputSchema;
import com.parallax.core.model.Specification;
import com.parallax.core.model.SpecificationMetadata;
import com.parallax.core.model.TaskKind;
import com.parallax.core.model.ToolInvocation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared builders for test specifications and traces.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Specification spec(String... items) {
        return spec(Set.of(), Set.of(), items);
    }

    public static Specification spec(Set<Integer> finalItems, Set<Integer> ontologyItems, String... items) {
        return new Specification(
                "Build a todo service",
                TaskKind.CODE,
                List.of("Use Java 17"),
                List.of(items),
                new OutputSchema("TodoService", "REST service",
                        List.of(new OutputField("endpoints", "list", "HTTP endpoints", true))),
                List.of(),
                List.of(new ExitCondition("tests-pass", "All tests pass", "mvn test exits 0")),
                new SpecificationMetadata("spec-1", "1.0", Instant.parse("2026-01-01T00:00:00Z"), 0.1, null, null),
                finalItems,
                ontologyItems);
    }

    public static ToolInvocation write(String path) {
        return new ToolInvocation("write_file", Map.of("path", path), path, true);
    }

    public static ToolInvocation read(String path) {
        return new ToolInvocation("read_file", Map.of("path", path), path, true);
    }

    public static ExecutionTrace trace(int itemIndex, boolean success, String... writtenPaths) {
        var invocations = new ArrayList<ToolInvocation>();
        for (String path : writtenPaths) {
            invocations.add(write(path));
        }
        return new ExecutionTrace(itemIndex, null, invocations, "done " + itemIndex, "", success, List.of(), 10);
    }

    public static ExecutionTrace subTrace(int itemIndex, int subIndex, String... writtenPaths) {
        var invocations = new ArrayList<ToolInvocation>();
        for (String path : writtenPaths) {
            invocations.add(write(path));
        }
        return new ExecutionTrace(itemIndex, subIndex, invocations, "sub " + subIndex, "", true, List.of(), 10);
    }
}

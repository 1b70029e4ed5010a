package com.parallax.core.coordination;

import com.parallax.core.model.ExecutionTrace;
import com.parallax.core.model.FileConflict;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Finds resources written by more than one work item in a level.
 * <p>
 * Every write is attributed to the top-level item that owns the trace, so two
 * sub-items of the same item writing one path never conflict, while sub-items
 * of different items always do. Pure; no external calls.
 */
public final class ConflictDetector {

    private ConflictDetector() {}

    /**
     * @return one unresolved conflict per contested path, ordered by path
     */
    public static List<FileConflict> detect(List<ExecutionTrace> traces) {
        Map<String, Set<Integer>> writersByPath = new TreeMap<>();
        for (var trace : traces) {
            for (var invocation : trace.allInvocations()) {
                if (invocation.isWrite()) {
                    writersByPath.computeIfAbsent(invocation.resourcePath(), p -> new TreeSet<>())
                            .add(trace.itemIndex());
                }
            }
        }
        var conflicts = new ArrayList<FileConflict>();
        writersByPath.forEach((path, writers) -> {
            if (writers.size() >= 2) {
                conflicts.add(FileConflict.detected(path, new ArrayList<>(writers)));
            }
        });
        return conflicts;
    }
}

package com.parallax.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Structured record of everything one agent invocation did.
 * <p>
 * A decomposed work item produces a parent trace whose {@code subTraces} hold
 * one trace per sub-item; the parent's own invocation list is empty.
 *
 * @param itemIndex        index of the owning top-level work item
 * @param subItemIndex     index of the sub-item within its parent (null for a top-level trace)
 * @param toolInvocations  ordered tool calls made in this session
 * @param finalOutput      the agent's final textual output
 * @param reasoningSummary short summary of the agent's reasoning (may be empty)
 * @param success          whether the session completed successfully
 * @param subTraces        per-sub-item traces for a decomposed item
 * @param durationMs       wall-clock duration of the session
 */
public record ExecutionTrace(
    int itemIndex,
    Integer subItemIndex,
    List<ToolInvocation> toolInvocations,
    String finalOutput,
    String reasoningSummary,
    boolean success,
    List<ExecutionTrace> subTraces,
    long durationMs
) implements Serializable {

    public ExecutionTrace {
        toolInvocations = toolInvocations != null ? List.copyOf(toolInvocations) : List.of();
        finalOutput = finalOutput != null ? finalOutput : "";
        reasoningSummary = reasoningSummary != null ? reasoningSummary : "";
        subTraces = subTraces != null ? List.copyOf(subTraces) : List.of();
    }

    public boolean isDecomposed() {
        return !subTraces.isEmpty();
    }

    /**
     * Every invocation in this trace and its sub-traces, parent first.
     */
    public List<ToolInvocation> allInvocations() {
        var all = new ArrayList<>(toolInvocations);
        for (var sub : subTraces) {
            all.addAll(sub.allInvocations());
        }
        return all;
    }

    /** Distinct paths written by this trace, in first-write order. */
    public List<String> filesModified() {
        var files = new LinkedHashSet<String>();
        for (var invocation : allInvocations()) {
            if (invocation.isWrite()) {
                files.add(invocation.resourcePath());
            }
        }
        return List.copyOf(files);
    }

    /** Distinct tool names used, in first-use order. */
    public List<String> toolsUsed() {
        var tools = new LinkedHashSet<String>();
        for (var invocation : allInvocations()) {
            tools.add(invocation.toolName());
        }
        return List.copyOf(tools);
    }

    public ExecutionTrace withItemIndex(int index) {
        return new ExecutionTrace(index, subItemIndex, toolInvocations, finalOutput,
                reasoningSummary, success, subTraces, durationMs);
    }
}

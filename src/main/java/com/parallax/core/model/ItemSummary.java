package com.parallax.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One-line account of what a work item accomplished in a level.
 *
 * @param index         work item index
 * @param text          work item text
 * @param success       whether the item's session succeeded
 * @param toolsUsed     distinct tool names used
 * @param filesModified distinct files written
 * @param keyOutput     tail of the agent's final output
 */
public record ItemSummary(
    int index,
    String text,
    boolean success,
    List<String> toolsUsed,
    List<String> filesModified,
    String keyOutput
) implements Serializable {

    public static final int KEY_OUTPUT_CHARS = 200;

    public ItemSummary {
        toolsUsed = toolsUsed != null ? List.copyOf(toolsUsed) : List.of();
        filesModified = filesModified != null ? List.copyOf(filesModified) : List.of();
        keyOutput = keyOutput != null ? keyOutput : "";
    }

    public static ItemSummary of(String text, ExecutionTrace trace) {
        String output = trace.finalOutput();
        String tail = output.length() > KEY_OUTPUT_CHARS
                ? output.substring(output.length() - KEY_OUTPUT_CHARS)
                : output;
        return new ItemSummary(trace.itemIndex(), text, trace.success(),
                trace.toolsUsed(), trace.filesModified(), tail.strip());
    }
}

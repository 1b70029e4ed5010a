package com.parallax.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One atomic action taken by an agent during a session.
 *
 * @param toolName     name of the tool the agent called
 * @param input        structured input payload as sent by the agent
 * @param resourcePath file the call touched, normalized and workspace-relative (nullable)
 * @param success      whether the tool call completed without error
 */
public record ToolInvocation(
    String toolName,
    Map<String, Object> input,
    String resourcePath,
    boolean success
) implements Serializable {

    /** Tool names that change the target file tree. */
    public static final Set<String> WRITE_TOOLS =
            Set.of("write_file", "edit_file", "Write", "Edit", "MultiEdit", "NotebookEdit");

    public ToolInvocation {
        input = input != null ? Collections.unmodifiableMap(new LinkedHashMap<>(input)) : Map.of();
        resourcePath = resourcePath != null ? normalizePath(resourcePath) : null;
    }

    public boolean isWrite() {
        return WRITE_TOOLS.contains(toolName) && resourcePath != null && !resourcePath.isBlank();
    }

    /**
     * Strips a leading "./" and collapses backslashes so the same file
     * reported in different shapes groups under one key.
     */
    public static String normalizePath(String path) {
        String normalized = path.trim().replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }
}

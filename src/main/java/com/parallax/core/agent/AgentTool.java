package com.parallax.core.agent;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Tools an agent session can be granted.
 */
public enum AgentTool {
    READ("read_file", false),
    WRITE("write_file", true),
    EDIT("edit_file", true),
    BASH("bash", false),
    GLOB("glob", false),
    GREP("grep", false),
    WEB_FETCH("web_fetch", false);

    /** Capability set of the conflict-resolution session. */
    public static final Set<AgentTool> COORDINATOR_TOOLS =
            Collections.unmodifiableSet(EnumSet.of(READ, BASH, EDIT, GREP, GLOB));

    private final String toolName;
    private final boolean writes;

    AgentTool(String toolName, boolean writes) {
        this.toolName = toolName;
        this.writes = writes;
    }

    public String toolName() {
        return toolName;
    }

    public boolean writes() {
        return writes;
    }
}

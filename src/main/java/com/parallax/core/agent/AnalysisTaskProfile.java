package com.parallax.core.agent;

import com.parallax.core.model.TaskKind;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

@Component
public class AnalysisTaskProfile implements TaskKindProfile {

    private static final Set<AgentTool> CAPABILITIES = Collections.unmodifiableSet(EnumSet.of(
            AgentTool.READ, AgentTool.GLOB, AgentTool.GREP, AgentTool.BASH));

    @Override
    public TaskKind kind() {
        return TaskKind.ANALYSIS;
    }

    @Override
    public Set<AgentTool> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public String systemPrompt() {
        return "You are an analyst. Inspect the material in the workspace, run read-only commands where "
                + "useful, and produce a structured analysis. Do not modify files.";
    }

    @Override
    public String instructions() {
        return "Produce the analysis the work item asks for, organised under clear headings, "
                + "with the evidence each conclusion rests on.";
    }
}

package com.parallax.core.agent;

import com.parallax.core.model.TaskKind;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

@Component
public class ResearchTaskProfile implements TaskKindProfile {

    private static final Set<AgentTool> CAPABILITIES = Collections.unmodifiableSet(EnumSet.of(
            AgentTool.READ, AgentTool.GLOB, AgentTool.GREP, AgentTool.WEB_FETCH));

    @Override
    public TaskKind kind() {
        return TaskKind.RESEARCH;
    }

    @Override
    public Set<AgentTool> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public String systemPrompt() {
        return "You are a researcher. Gather evidence from the sources available to you and report "
                + "findings with their sources. Do not modify files.";
    }

    @Override
    public String instructions() {
        return "Answer the work item with findings backed by sources. "
                + "State what remains uncertain.";
    }
}

package com.parallax.core.agent;

import com.parallax.core.model.TaskKind;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

@Component
public class CodeTaskProfile implements TaskKindProfile {

    private static final Set<AgentTool> CAPABILITIES = Collections.unmodifiableSet(EnumSet.of(
            AgentTool.READ, AgentTool.WRITE, AgentTool.EDIT, AgentTool.BASH, AgentTool.GLOB, AgentTool.GREP));

    @Override
    public TaskKind kind() {
        return TaskKind.CODE;
    }

    @Override
    public Set<AgentTool> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public String systemPrompt() {
        return "You are a software engineer working in a shared repository. Implement exactly the work item "
                + "you are given, read existing files before changing them, and keep changes minimal.";
    }

    @Override
    public String instructions() {
        return "Implement the work item. Build and test what you change. "
                + "Finish with a short summary of the files you changed and why.";
    }
}

package com.parallax.core.agent;

import com.parallax.core.Fixtures;
import com.parallax.core.model.TaskKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskKindRegistryTest {

    @Test
    @DisplayName("Every task kind resolves to its own profile")
    void everyKindHasProfile() {
        var registry = TaskKindRegistry.defaults();

        for (var kind : TaskKind.values()) {
            assertEquals(kind, registry.profileFor(kind).kind());
        }
    }

    @Test
    @DisplayName("Capability sets differ per kind")
    void capabilities() {
        var registry = TaskKindRegistry.defaults();

        assertEquals(EnumSet.of(AgentTool.READ, AgentTool.WRITE, AgentTool.EDIT, AgentTool.BASH,
                AgentTool.GLOB, AgentTool.GREP), registry.profileFor(TaskKind.CODE).capabilities());
        assertEquals(EnumSet.of(AgentTool.READ, AgentTool.GLOB, AgentTool.GREP, AgentTool.WEB_FETCH),
                registry.profileFor(TaskKind.RESEARCH).capabilities());
        assertEquals(EnumSet.of(AgentTool.READ, AgentTool.GLOB, AgentTool.GREP, AgentTool.BASH),
                registry.profileFor(TaskKind.ANALYSIS).capabilities());
    }

    @Test
    @DisplayName("A missing profile fails construction")
    void missingProfile() {
        var ex = assertThrows(IllegalStateException.class,
                () -> new TaskKindRegistry(List.of(new CodeTaskProfile(), new ResearchTaskProfile())));
        assertTrue(ex.getMessage().contains("ANALYSIS"));
    }

    @Test
    @DisplayName("Two profiles for one kind fail construction")
    void duplicateProfile() {
        assertThrows(IllegalStateException.class, () -> new TaskKindRegistry(List.of(
                new CodeTaskProfile(), new CodeTaskProfile(), new ResearchTaskProfile(), new AnalysisTaskProfile())));
    }

    @Test
    @DisplayName("Item prompts carry goal, item, siblings, feedback and the lateral-thinking request")
    void itemPrompt() {
        var spec = Fixtures.spec("Create the model", "Create the API");
        var input = new PromptInput(spec, 1, "Create the API", null, "## Previous Work Context\n- Item 1",
                List.of(), "## Previous Attempts\nAttempt 1 failed", true);

        String prompt = TaskKindRegistry.defaults().profileFor(TaskKind.CODE).renderItemPrompt(input);

        assertTrue(prompt.contains("## Goal\nBuild a todo service"));
        assertTrue(prompt.contains("- Use Java 17"));
        assertTrue(prompt.contains("## Work Item 2 of 2\nCreate the API"));
        assertTrue(prompt.contains("## Previous Work Context"));
        assertTrue(prompt.contains("Attempt 1 failed"));
        assertTrue(prompt.contains("## Change Of Approach"));

        String subPrompt = TaskKindRegistry.defaults().profileFor(TaskKind.CODE)
                .renderItemPrompt(input.forSubItem("Controller", List.of("Repository")));
        assertTrue(subPrompt.contains("## Your Sub-Item\nController"));
        assertTrue(subPrompt.contains("## Running In Parallel"));
        assertTrue(subPrompt.contains("- Repository"));
    }
}

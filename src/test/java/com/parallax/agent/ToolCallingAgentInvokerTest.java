package com.parallax.agent;

import com.parallax.core.agent.AgentException;
import com.parallax.core.agent.AgentRequest;
import com.parallax.core.agent.AgentTool;
import com.parallax.core.llm.LlmService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.ai.tool.ToolCallback;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ToolCallingAgentInvokerTest {

    @TempDir
    Path root;

    private LlmService llmService;
    private WorkspaceTools tools;
    private ToolCallingAgentInvoker invoker;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        tools = new WorkspaceTools(root, 20000, Duration.ofSeconds(5));
        invoker = new ToolCallingAgentInvoker(llmService, () -> tools);
    }

    private static AgentRequest request(String context) {
        return new AgentRequest("s1", 2, null, "You are a coder.", "Create the model class.",
                EnumSet.of(AgentTool.READ, AgentTool.WRITE), context, Duration.ofMinutes(10));
    }

    @Test
    @DisplayName("tool calls made during the session end up in the trace")
    void traceCarriesInvocations() {
        when(llmService.textCall(anyString(), anyString(), any(ToolCallback[].class))).thenAnswer(inv -> {
            tools.writeFile("src/Model.java", "class Model {}");
            return "Created Model.\n\nDetails follow.";
        });

        var trace = invoker.invoke(request(""));

        assertTrue(trace.success());
        assertEquals(2, trace.itemIndex());
        assertEquals(1, trace.toolInvocations().size());
        assertEquals("src/Model.java", trace.toolInvocations().get(0).resourcePath());
        assertEquals("Created Model.\n\nDetails follow.", trace.finalOutput());
        assertEquals("Created Model.", trace.reasoningSummary());
    }

    @Test
    @DisplayName("only the granted tools are offered to the model")
    void grantedToolsOnly() {
        when(llmService.textCall(anyString(), anyString(), any(ToolCallback[].class))).thenAnswer(inv -> {
            ToolCallback[] offered = (ToolCallback[]) inv.getRawArguments()[2];
            assertEquals(2, offered.length);
            return "done";
        });

        invoker.invoke(request(""));

        verify(llmService).textCall(eq("You are a coder."), eq("Create the model class."), any(ToolCallback[].class));
    }

    @Test
    @DisplayName("a failed session keeps the tool calls made before the failure")
    void failureKeepsPartialTrace() {
        when(llmService.textCall(anyString(), anyString(), any(ToolCallback[].class))).thenAnswer(inv -> {
            tools.writeFile("half.txt", "partial");
            throw new IllegalStateException("model went away");
        });

        var ex = assertThrows(AgentException.class, () -> invoker.invoke(request("")));

        assertTrue(ex.getMessage().contains("model went away"));
        assertEquals(1, ex.getPartialTraces().size());
        var partial = ex.getPartialTraces().get(0);
        assertFalse(partial.success());
        assertEquals("half.txt", partial.toolInvocations().get(0).resourcePath());
    }

    @Test
    @DisplayName("background context is appended unless the prompt already has it")
    void userPrompt() {
        assertEquals("Create the model class.", ToolCallingAgentInvoker.userPrompt(request("")));
        assertEquals("Create the model class.\n\n## Background\nLevel 1 built the schema.",
                ToolCallingAgentInvoker.userPrompt(request("Level 1 built the schema.")));

        var embedded = new AgentRequest("s1", 0, null, "sys", "Do it.\nLevel 1 built the schema.",
                EnumSet.of(AgentTool.READ), "Level 1 built the schema.", Duration.ofMinutes(1));
        assertEquals("Do it.\nLevel 1 built the schema.", ToolCallingAgentInvoker.userPrompt(embedded));
    }

    @Test
    @DisplayName("summary is the first paragraph, capped")
    void summarize() {
        assertEquals("Short answer.", ToolCallingAgentInvoker.summarize("  Short answer.\n\nMore.  "));

        String longParagraph = "x".repeat(400);
        String summary = ToolCallingAgentInvoker.summarize(longParagraph);
        assertEquals(ToolCallingAgentInvoker.SUMMARY_CHARS + 3, summary.length());
        assertTrue(summary.endsWith("..."));
    }
}

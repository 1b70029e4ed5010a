package com.parallax.agent;

import com.parallax.core.agent.AgentException;
import com.parallax.core.agent.AgentInvoker;
import com.parallax.core.agent.AgentRequest;
import com.parallax.core.llm.LlmService;
import com.parallax.core.model.ExecutionTrace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs an agent session as a Spring AI tool-calling conversation. The model
 * works through {@link WorkspaceTools} limited to the request's capabilities;
 * the recorded tool calls and the final answer become the trace.
 */
@Service
public class ToolCallingAgentInvoker implements AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(ToolCallingAgentInvoker.class);

    static final int SUMMARY_CHARS = 300;

    private final LlmService llmService;
    private final Supplier<WorkspaceTools> toolsFactory;

    @Autowired
    public ToolCallingAgentInvoker(LlmService llmService, AgentProperties properties) {
        this(llmService, () -> new WorkspaceTools(Path.of(properties.getWorkspace()),
                properties.getMaxOutputChars(), Duration.ofSeconds(properties.getBashTimeoutSeconds())));
    }

    ToolCallingAgentInvoker(LlmService llmService, Supplier<WorkspaceTools> toolsFactory) {
        this.llmService = llmService;
        this.toolsFactory = toolsFactory;
    }

    @Override
    public ExecutionTrace invoke(AgentRequest request) {
        var tools = toolsFactory.get();
        List<ToolCallback> callbacks = tools.callbacks(request.capabilities());
        log.info("Agent session for item {}{} started with {} tool(s)", request.itemIndex(),
                request.subItemIndex() != null ? "." + request.subItemIndex() : "", callbacks.size());

        long start = System.currentTimeMillis();
        String output;
        try {
            output = llmService.textCall(request.systemPrompt(), userPrompt(request),
                    callbacks.toArray(new ToolCallback[0]));
        } catch (RuntimeException e) {
            long elapsed = System.currentTimeMillis() - start;
            var partial = new ExecutionTrace(request.itemIndex(), request.subItemIndex(), tools.invocations(),
                    "", "", false, List.of(), elapsed);
            throw new AgentException("Agent session failed: " + e.getMessage(), e, List.of(partial));
        }
        long elapsed = System.currentTimeMillis() - start;

        var invocations = tools.invocations();
        log.info("Agent session for item {} finished in {}ms ({} tool call(s))",
                request.itemIndex(), elapsed, invocations.size());
        return new ExecutionTrace(request.itemIndex(), request.subItemIndex(), invocations, output,
                summarize(output), true, List.of(), elapsed);
    }

    static String userPrompt(AgentRequest request) {
        String context = request.context();
        if (context.isBlank() || request.prompt().contains(context)) {
            return request.prompt();
        }
        return request.prompt() + "\n\n## Background\n" + context;
    }

    /** First paragraph of the answer, capped. */
    static String summarize(String output) {
        String trimmed = output.strip();
        int paragraphEnd = trimmed.indexOf("\n\n");
        String first = paragraphEnd > 0 ? trimmed.substring(0, paragraphEnd) : trimmed;
        return first.length() > SUMMARY_CHARS ? first.substring(0, SUMMARY_CHARS) + "..." : first;
    }
}

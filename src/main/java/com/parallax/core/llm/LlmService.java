package com.parallax.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Reasoning backend used by the engine. Wraps Spring AI's {@link ChatClient}
 * to produce structured (typed) output or free text from model calls.
 * <p>
 * Structured calls use {@link BeanOutputConverter} to append a JSON schema for
 * the target class to the user prompt and to deserialize the response, with a
 * lenient Jackson fallback for responses wrapped in Markdown fences.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final ObjectMapper lenientMapper;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.lenientMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .registerModule(new ParameterNamesModule());
        log.info("LlmService initialized, base-url: {}", baseUrl);
    }

    /**
     * Sends a system + user prompt to the model and returns the response
     * deserialized into the given {@code outputType}.
     *
     * @param systemPrompt instructions for the model's role
     * @param userPrompt   the request text
     * @param outputType   the record or POJO to deserialize into
     * @param <T>          target type
     * @return an instance of {@code T} populated from the model's JSON response
     * @throws LlmEmptyResponseException when the model returns no content
     * @throws LlmParseException         when the response is not valid JSON for {@code T}
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        return structuredCallWithTools(systemPrompt, userPrompt, outputType);
    }

    /**
     * Like {@link #structuredCall}, but also exposes tools to the model.
     * Falls back to the tool-less path when no tools are supplied.
     */
    public <T> T structuredCallWithTools(String systemPrompt, String userPrompt,
                                         Class<T> outputType, ToolCallback... tools) {
        log.info("LLM call started → {} ({} tool(s))", outputType.getSimpleName(),
                tools != null ? tools.length : 0);
        var converter = new BeanOutputConverter<>(outputType);
        String response = call(systemPrompt, userPrompt + "\n\n" + converter.getFormat(), tools);
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName()
                    + ". Check that the model is running and supports structured JSON output.");
        }
        try {
            return converter.convert(response);
        } catch (Exception e) {
            log.warn("Failed to parse LLM response to {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseWithJackson(response, outputType);
        }
    }

    /**
     * Free-text call, optionally with tools. Returns the model's final content.
     *
     * @throws LlmEmptyResponseException when the model returns no content
     */
    public String textCall(String systemPrompt, String userPrompt, ToolCallback... tools) {
        String response = call(systemPrompt, userPrompt, tools);
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for a text call");
        }
        return response;
    }

    private String call(String systemPrompt, String userPrompt, ToolCallback... tools) {
        long start = System.currentTimeMillis();
        var request = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt);
        if (tools != null && tools.length > 0) {
            request = request.toolCallbacks(tools);
        }
        String response = request.call().content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        return response;
    }

    /**
     * Fallback JSON parsing with lenient settings and Markdown fence stripping.
     */
    <T> T parseWithJackson(String json, Class<T> outputType) {
        try {
            String cleaned = stripFences(json);
            T result = lenientMapper.readValue(cleaned, outputType);
            log.info("Jackson fallback parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e) {
            log.error("Jackson fallback parsing FAILED for {}: {}", outputType.getSimpleName(), e.getMessage());
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), json, e);
        }
    }

    /**
     * Removes surrounding ```json fences and any prose before the first
     * brace or after the last one.
     */
    public static String stripFences(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start >= 0 && end > start && !cleaned.startsWith("[")) {
            cleaned = cleaned.substring(start, end + 1);
        }
        return cleaned;
    }
}

package com.parallax.core.llm;

/**
 * Thrown when LLM output cannot be parsed into the expected type.
 * Carries the raw response for diagnosis.
 */
public class LlmParseException extends RuntimeException {

    private final String rawResponse;

    public LlmParseException(String message) {
        this(message, null, null);
    }

    public LlmParseException(String message, String rawResponse, Throwable cause) {
        super(message, cause);
        this.rawResponse = rawResponse != null ? rawResponse : "";
    }

    public String getRawResponse() {
        return rawResponse;
    }
}

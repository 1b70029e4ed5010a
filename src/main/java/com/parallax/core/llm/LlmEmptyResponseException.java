package com.parallax.core.llm;

/**
 * Thrown when the model returns no content at all.
 */
public class LlmEmptyResponseException extends RuntimeException {
    public LlmEmptyResponseException(String message) {
        super(message);
    }
}

package com.parallax.core.resilience;

/**
 * Thrown when an external call fails with a checked or otherwise unexpected cause.
 */
public class BackendUnavailableException extends RuntimeException {
    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

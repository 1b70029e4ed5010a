package com.parallax.core.resilience;

import com.parallax.core.llm.LlmParseException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs external calls with a per-attempt deadline and retries transient and
 * parse failures with exponential backoff.
 * <p>
 * Non-transient failures (bad requests, invalid arguments) are not retried.
 * When the attempt budget is spent the last failure is rethrown so callers
 * can fall back to a degraded mode where one exists.
 */
@Component
public class BackendCalls {

    private static final Logger log = LoggerFactory.getLogger(BackendCalls.class);

    private final ExecutorService executor;
    private final Duration defaultDeadline;
    private final RetryConfig retryConfig;

    @Autowired
    public BackendCalls(BackendProperties properties,
                        @Qualifier("parallaxExecutor") ExecutorService executor) {
        this(executor, Duration.ofSeconds(properties.getCallTimeoutSeconds()), properties.getMaxAttempts(),
                Duration.ofMillis(properties.getInitialBackoffMillis()), properties.getBackoffMultiplier());
    }

    public BackendCalls(ExecutorService executor, Duration defaultDeadline, int maxAttempts,
                        Duration initialBackoff, double backoffMultiplier) {
        this.executor = executor;
        this.defaultDeadline = defaultDeadline;
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, backoffMultiplier))
                .retryOnException(BackendCalls::isTransient)
                .build();
    }

    /**
     * Calls with the default deadline.
     */
    public <T> T call(String operation, Supplier<T> supplier) {
        return call(operation, supplier, defaultDeadline);
    }

    /**
     * Calls with retries, each attempt bounded by {@code deadline}.
     *
     * @throws RuntimeException the last failure once the attempt budget is spent
     */
    public <T> T call(String operation, Supplier<T> supplier, Duration deadline) {
        Retry retry = Retry.of(operation, retryConfig);
        retry.getEventPublisher().onRetry(event -> {
            Throwable cause = event.getLastThrowable();
            log.warn("{} attempt {} failed ({}), retrying in {}ms", operation,
                    event.getNumberOfRetryAttempts(), cause != null ? cause.getMessage() : "unknown",
                    event.getWaitInterval().toMillis());
            if (cause instanceof LlmParseException parse) {
                log.warn("{} raw response: {}", operation, abbreviate(parse.getRawResponse()));
            }
        });
        Supplier<T> attempt = () -> callOnce(operation, supplier, deadline);
        return Retry.decorateSupplier(retry, attempt).get();
    }

    /**
     * Single attempt bounded by {@code deadline}, no retry. A call that misses
     * its deadline is abandoned; its eventual result is discarded.
     *
     * @throws BackendTimeoutException when the deadline passes
     */
    public <T> T callOnce(String operation, Supplier<T> supplier, Duration deadline) {
        var future = CompletableFuture.supplyAsync(supplier, executor)
                .orTimeout(deadline.toMillis(), TimeUnit.MILLISECONDS);
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                future.cancel(true);
                throw new BackendTimeoutException(operation, deadline);
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new BackendUnavailableException(operation + " failed: " + cause.getMessage(), cause);
        }
    }

    static boolean isTransient(Throwable t) {
        return !(t instanceof NonTransientAiException)
                && !(t instanceof IllegalArgumentException)
                && !(t instanceof IllegalStateException);
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 500 ? text.substring(0, 500) + "..." : text;
    }
}

package com.parallax.core.engine;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared pool for every external call: item sessions, sub-item sessions,
 * consensus votes and backend deadlines. Concurrency per level is bounded by
 * a semaphore in the execute node, not by the pool size.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "parallaxExecutor", destroyMethod = "shutdownNow")
    public ExecutorService parallaxExecutor() {
        var counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            var thread = new Thread(runnable, "parallax-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }
}

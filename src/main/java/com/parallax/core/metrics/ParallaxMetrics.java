package com.parallax.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for session execution.
 */
@Service
public class ParallaxMetrics {

    private final MeterRegistry registry;

    public ParallaxMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLevelDuration(int itemCount, long ms) {
        Timer.builder("parallax.level.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("parallax.level.item_count")
                .description("Number of work items dispatched per level pass")
                .register(registry)
                .record(itemCount);
    }

    public void recordItemExecution(String taskKind, long ms) {
        Timer.builder("parallax.item.duration")
                .tag("kind", taskKind)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordVerdict(String stage, boolean approved) {
        Counter.builder("parallax.evaluation.verdicts")
                .tag("stage", stage)
                .tag("result", approved ? "approved" : "rejected")
                .register(registry)
                .increment();
    }

    public void recordConsensusTrigger(String trigger) {
        Counter.builder("parallax.consensus.triggers")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
    }

    /**
     * Records conflicts found after a level and how many the resolution session reconciled.
     */
    public void recordConflicts(int detected, int resolved) {
        Counter.builder("parallax.conflicts.detected")
                .register(registry)
                .increment(detected);
        Counter.builder("parallax.conflicts.resolved")
                .register(registry)
                .increment(resolved);
    }

    /**
     * Records a fallback to a degraded mode.
     *
     * @param operation "dependency_analysis", "conflict_resolution" or "decomposition"
     */
    public void recordDegradedMode(String operation) {
        Counter.builder("parallax.degraded.total")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void incrementRetries(String reason) {
        Counter.builder("parallax.retries.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAttempts(int attempts) {
        DistributionSummary.builder("parallax.item.attempts")
                .register(registry)
                .record(attempts);
    }

    public void recordSessionResult(String status) {
        Counter.builder("parallax.sessions.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}

package com.parallax.core.model;

import java.io.Serializable;

/**
 * Aggregate figures for a finished session.
 */
public record SessionMetrics(
    int itemsTotal,
    int itemsAccepted,
    int itemsFailed,
    int itemsSkipped,
    int levelsExecuted,
    int totalAttempts,
    int conflictsDetected,
    int conflictsResolved,
    long totalDurationMs
) implements Serializable {}

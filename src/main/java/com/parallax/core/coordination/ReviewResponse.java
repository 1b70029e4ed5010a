package com.parallax.core.coordination;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured summary returned by the conflict-resolution session.
 */
public record ReviewResponse(
    @JsonProperty("review_summary") String reviewSummary,
    @JsonProperty("fixes_applied") List<String> fixesApplied,
    @JsonProperty("warnings_for_next_level") List<String> warningsForNextLevel,
    @JsonProperty("conflicts_resolved") List<String> conflictsResolved
) {

    public ReviewResponse {
        reviewSummary = reviewSummary != null ? reviewSummary : "";
        fixesApplied = fixesApplied != null ? List.copyOf(fixesApplied) : List.of();
        warningsForNextLevel = warningsForNextLevel != null ? List.copyOf(warningsForNextLevel) : List.of();
        conflictsResolved = conflictsResolved != null ? List.copyOf(conflictsResolved) : List.of();
    }
}

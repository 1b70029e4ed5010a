package com.parallax.core.model;

import java.io.Serializable;

/**
 * One consensus participant's opinion.
 *
 * @param role       voter role
 * @param decision   the voter's decision
 * @param confidence confidence in [0, 1]
 * @param rationale  the voter's argument
 */
public record Vote(
    VoterRole role,
    VoteDecision decision,
    double confidence,
    String rationale
) implements Serializable {

    public Vote {
        confidence = DriftBreakdown.clamp(confidence);
        rationale = rationale != null ? rationale : "";
    }

    public boolean approved() {
        return decision == VoteDecision.APPROVED;
    }
}

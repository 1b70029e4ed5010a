package com.parallax.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of the two-round deliberation.
 *
 * @param decision          the judge's final decision
 * @param confidence        final confidence, halved when a position was missing
 * @param rationale         the judge's reasoning
 * @param conditions        changes required for a conditional approval
 * @param votes             every vote cast, advocate and critic first
 * @param reducedConfidence true when the advocate or critic position was missing
 * @param rootCause         whether the critic accepted the artifact as addressing the root requirement
 */
public record ConsensusResult(
    VoteDecision decision,
    double confidence,
    String rationale,
    List<String> conditions,
    List<Vote> votes,
    boolean reducedConfidence,
    boolean rootCause
) implements Serializable {

    public ConsensusResult {
        rationale = rationale != null ? rationale : "";
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        votes = votes != null ? List.copyOf(votes) : List.of();
    }

    public boolean approved() {
        return decision == VoteDecision.APPROVED;
    }
}

package com.parallax.core.consensus;

import com.parallax.core.model.VoteDecision;

import java.util.List;
import java.util.Locale;

/**
 * Judge's final ruling.
 *
 * @param verdict    "approved", "rejected" or "conditional"
 * @param confidence confidence in the ruling, 0.0 to 1.0
 * @param reasoning  rationale
 * @param conditions required changes for a conditional approval
 */
public record JudgmentResponse(
    String verdict,
    double confidence,
    String reasoning,
    List<String> conditions
) {

    public JudgmentResponse {
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    /** Anything that is neither an approval nor a conditional approval is a rejection. */
    public VoteDecision decision() {
        if (verdict == null) {
            return VoteDecision.REJECTED;
        }
        String normalized = verdict.trim().toLowerCase(Locale.ROOT);
        if (normalized.contains("condition")) {
            return VoteDecision.CONDITIONAL;
        }
        if (normalized.startsWith("approve")) {
            return VoteDecision.APPROVED;
        }
        return VoteDecision.REJECTED;
    }
}

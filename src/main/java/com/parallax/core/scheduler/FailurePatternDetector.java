package com.parallax.core.scheduler;

import com.parallax.core.model.AttemptRecord;

import java.util.List;

/**
 * Detects failure patterns across an item's attempts: stagnation (the same
 * failure twice in a row) and oscillation (A-B-A). Either one switches the
 * next attempt to lateral thinking.
 * <p>
 * Works on the attempt history kept in the ledger, so the answer is the same
 * for a live run and a replayed one.
 */
public final class FailurePatternDetector {

    private FailurePatternDetector() {}

    public static boolean isStagnating(List<AttemptRecord> history) {
        if (history.size() < 2) {
            return false;
        }
        String last = history.get(history.size() - 1).failureKey();
        String previous = history.get(history.size() - 2).failureKey();
        return last.equals(previous);
    }

    public static boolean isOscillating(List<AttemptRecord> history) {
        if (history.size() < 3) {
            return false;
        }
        // failure[N] matches failure[N-2] but differs from failure[N-1]
        for (int i = 2; i < history.size(); i++) {
            String current = history.get(i).failureKey();
            String twoBack = history.get(i - 2).failureKey();
            String oneBack = history.get(i - 1).failureKey();
            if (current.equals(twoBack) && !current.equals(oneBack)) {
                return true;
            }
        }
        return false;
    }

    public static boolean needsLateralThinking(List<AttemptRecord> history) {
        return isStagnating(history) || isOscillating(history);
    }
}

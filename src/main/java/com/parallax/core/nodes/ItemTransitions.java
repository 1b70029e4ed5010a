package com.parallax.core.nodes;

import com.parallax.core.events.EventTypes;
import com.parallax.core.ledger.SessionEvents;
import com.parallax.core.model.AttemptRecord;

import java.util.List;
import java.util.Map;

/**
 * Item transitions shared by several nodes.
 */
final class ItemTransitions {

    static final String ITERATION_CAP_REACHED = "iteration cap reached";

    private ItemTransitions() {}

    /** Fails every item that has not reached a terminal status. */
    static int failNonTerminal(SessionEvents events, String reason) {
        int failed = 0;
        for (var record : events.ledger().items().values()) {
            if (!record.status().isTerminal()) {
                events.emit(EventTypes.ITEM_FAILED, Map.of(
                        "itemIndex", record.index(),
                        "reasons", List.of(reason)));
                failed++;
            }
        }
        return failed;
    }

    /**
     * Markdown feedback from earlier attempts, injected into the next
     * attempt's prompt. Empty for a first attempt.
     */
    static String renderRetryFeedback(List<AttemptRecord> history) {
        if (history.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder("## Previous Attempts\n\n");
        sb.append("Earlier attempts at this item were not accepted. Fix these problems:\n\n");
        for (var record : history) {
            sb.append("### Attempt ").append(record.attempt());
            if (record.timedOut()) {
                sb.append(" (timed out)");
            }
            sb.append('\n');
            for (var reason : record.reasons()) {
                sb.append("- ").append(reason).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}

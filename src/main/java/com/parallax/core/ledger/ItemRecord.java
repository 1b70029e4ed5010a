package com.parallax.core.ledger;

import com.parallax.core.model.AttemptRecord;
import com.parallax.core.model.ItemStatus;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Ledger entry for one work item.
 *
 * @param index           work item index
 * @param status          current status
 * @param attempts        attempts started so far
 * @param lateralThinking whether the current or next attempt uses a lateral-thinking prompt
 * @param history         failed attempts, oldest first
 * @param reasons         every failure reason recorded for the item, in order
 */
public record ItemRecord(
    int index,
    ItemStatus status,
    int attempts,
    boolean lateralThinking,
    List<AttemptRecord> history,
    List<String> reasons
) implements Serializable {

    public ItemRecord {
        history = history != null ? List.copyOf(history) : List.of();
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    public static ItemRecord pending(int index) {
        return new ItemRecord(index, ItemStatus.PENDING, 0, false, List.of(), List.of());
    }

    ItemRecord withStatus(ItemStatus newStatus) {
        return new ItemRecord(index, newStatus, attempts, lateralThinking, history, reasons);
    }

    ItemRecord started(int attempt, boolean lateral) {
        return new ItemRecord(index, ItemStatus.RUNNING, attempt, lateral, history, reasons);
    }

    ItemRecord retrying(boolean lateral) {
        return new ItemRecord(index, ItemStatus.RETRYING, attempts, lateral, history, reasons);
    }

    ItemRecord withAttempt(AttemptRecord record) {
        var newHistory = new ArrayList<>(history);
        newHistory.add(record);
        var newReasons = new ArrayList<>(reasons);
        for (var reason : record.reasons()) {
            newReasons.add("Attempt " + record.attempt() + ": " + reason);
        }
        return new ItemRecord(index, status, attempts, lateralThinking, newHistory, newReasons);
    }

    ItemRecord terminal(ItemStatus terminalStatus, List<String> extraReasons) {
        var newReasons = new ArrayList<>(reasons);
        newReasons.addAll(extraReasons);
        return new ItemRecord(index, terminalStatus, attempts, lateralThinking, history, newReasons);
    }
}

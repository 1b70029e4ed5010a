package com.parallax.core.ledger;

import com.parallax.core.events.EventTypes;
import com.parallax.core.events.ParallaxEvent;
import com.parallax.core.model.AttemptRecord;
import com.parallax.core.model.EvaluationStage;
import com.parallax.core.model.ItemStatus;
import com.parallax.core.model.SessionStatus;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Per-session item and session status, built only by folding events.
 * <p>
 * {@link #apply(ParallaxEvent)} is a pure function of (ledger, event): live
 * execution folds the events it emits and {@link #replay(String, List)}
 * rebuilds the same ledger from the session's event log. Events already
 * folded (by sequence) and event types the ledger does not track are ignored.
 */
public record ExecutionLedger(
    String sessionId,
    SessionStatus status,
    SortedMap<Integer, ItemRecord> items,
    int currentLevel,
    int levelsCompleted,
    long lastSequence
) implements Serializable {

    public ExecutionLedger {
        items = Collections.unmodifiableSortedMap(new TreeMap<>(items));
    }

    public static ExecutionLedger empty(String sessionId) {
        return new ExecutionLedger(sessionId, SessionStatus.ANALYZING, new TreeMap<>(), -1, 0, 0L);
    }

    public static ExecutionLedger replay(String sessionId, List<ParallaxEvent> events) {
        var ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparingLong(ParallaxEvent::sequence));
        var ledger = empty(sessionId);
        for (var event : ordered) {
            ledger = ledger.apply(event);
        }
        return ledger;
    }

    public ExecutionLedger applyAll(List<ParallaxEvent> events) {
        var ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparingLong(ParallaxEvent::sequence));
        var ledger = this;
        for (var event : ordered) {
            ledger = ledger.apply(event);
        }
        return ledger;
    }

    public ExecutionLedger apply(ParallaxEvent event) {
        if (!sessionId.equals(event.aggregateId()) || event.sequence() <= lastSequence) {
            return this;
        }
        long seq = event.sequence();
        int item = event.intValue("itemIndex");
        return switch (event.eventType()) {
            case EventTypes.SESSION_STARTED -> {
                var initial = new TreeMap<Integer, ItemRecord>();
                for (int i = 0; i < event.intValue("itemCount"); i++) {
                    initial.put(i, ItemRecord.pending(i));
                }
                yield new ExecutionLedger(sessionId, SessionStatus.ANALYZING, initial, -1, 0, seq);
            }
            case EventTypes.DEPENDENCY_GRAPH_BUILT ->
                    new ExecutionLedger(sessionId, SessionStatus.EXECUTING, items, currentLevel, levelsCompleted, seq);
            case EventTypes.LEVEL_STARTED ->
                    new ExecutionLedger(sessionId, status, items, event.intValue("levelNumber"), levelsCompleted, seq);
            case EventTypes.LEVEL_COMPLETED ->
                    new ExecutionLedger(sessionId, status, items, currentLevel, levelsCompleted + 1, seq);
            case EventTypes.ITEM_STARTED ->
                    withItem(item, item(item).started(event.intValue("attempt"), flag(event, "lateralThinking")), seq);
            case EventTypes.ITEM_EXECUTION_FAILED -> {
                var record = item(item);
                var attempt = new AttemptRecord(event.intValue("attempt"), EvaluationStage.NONE,
                        List.of(event.stringValue("reason")), null, null,
                        record.lateralThinking(), flag(event, "timedOut"));
                yield withItem(item, record.withAttempt(attempt), seq);
            }
            case EventTypes.ITEM_REJECTED -> {
                var record = item(item);
                var attempt = new AttemptRecord(event.intValue("attempt"), stage(event.intValue("stage")),
                        strings(event, "reasons"), number(event, "satisfaction"), number(event, "uncertainty"),
                        record.lateralThinking(), false);
                yield withItem(item, record.withAttempt(attempt), seq);
            }
            case EventTypes.ITEM_RETRY_SCHEDULED ->
                    withItem(item, item(item).retrying(flag(event, "lateralThinking")), seq);
            case EventTypes.ITEM_ACCEPTED ->
                    withItem(item, item(item).withStatus(ItemStatus.ACCEPTED), seq);
            case EventTypes.ITEM_FAILED ->
                    withItem(item, item(item).terminal(ItemStatus.FAILED, strings(event, "reasons")), seq);
            case EventTypes.ITEM_SKIPPED ->
                    withItem(item, item(item).terminal(ItemStatus.SKIPPED, List.of(event.stringValue("reason"))), seq);
            case EventTypes.SESSION_COMPLETED ->
                    new ExecutionLedger(sessionId, SessionStatus.valueOf(event.stringValue("status")),
                            items, currentLevel, levelsCompleted, seq);
            case EventTypes.SESSION_CANCELLED ->
                    new ExecutionLedger(sessionId, SessionStatus.CANCELLED, items, currentLevel, levelsCompleted, seq);
            default -> new ExecutionLedger(sessionId, status, items, currentLevel, levelsCompleted, seq);
        };
    }

    public ItemRecord item(int index) {
        var record = items.get(index);
        return record != null ? record : ItemRecord.pending(index);
    }

    public List<Integer> indicesWithStatus(ItemStatus wanted) {
        return items.values().stream()
                .filter(r -> r.status() == wanted)
                .map(ItemRecord::index)
                .toList();
    }

    public boolean allTerminal() {
        return items.values().stream().allMatch(r -> r.status().isTerminal());
    }

    public int totalAttempts() {
        return items.values().stream().mapToInt(ItemRecord::attempts).sum();
    }

    private ExecutionLedger withItem(int index, ItemRecord record, long seq) {
        var updated = new TreeMap<>(items);
        updated.put(index, record);
        return new ExecutionLedger(sessionId, status, updated, currentLevel, levelsCompleted, seq);
    }

    private static boolean flag(ParallaxEvent event, String key) {
        return Boolean.TRUE.equals(event.payload().get(key));
    }

    private static Double number(ParallaxEvent event, String key) {
        Object value = event.payload().get(key);
        return value instanceof Number n ? n.doubleValue() : null;
    }

    private static List<String> strings(ParallaxEvent event, String key) {
        Object value = event.payload().get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return value != null ? List.of(value.toString()) : List.of();
    }

    private static EvaluationStage stage(int number) {
        for (var stage : EvaluationStage.values()) {
            if (stage.number() == number) {
                return stage;
            }
        }
        return EvaluationStage.NONE;
    }
}

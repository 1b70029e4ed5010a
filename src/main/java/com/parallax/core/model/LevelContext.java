package com.parallax.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Forward-flowing summary of a finished level, injected as background into
 * the prompts of every item in later levels.
 *
 * @param levelNumber level this context describes
 * @param summaries   per-item summaries in item order
 * @param review      coordinator review, present only when conflicts were found
 */
public record LevelContext(
    int levelNumber,
    List<ItemSummary> summaries,
    CoordinatorReview review
) implements Serializable {

    public static final int MAX_ITEM_TEXT_CHARS = 60;
    public static final int MAX_LISTED_FILES = 5;
    public static final int MAX_CONTEXT_CHARS = 2000;

    public LevelContext {
        summaries = summaries != null ? List.copyOf(summaries) : List.of();
    }

    public boolean hasReview() {
        return review != null;
    }

    /**
     * Combines a later pass over the same level into this context. Summaries of
     * re-executed items replace earlier ones; the later review wins when present.
     */
    public LevelContext mergedWith(LevelContext later) {
        Map<Integer, ItemSummary> byIndex = new TreeMap<>();
        for (var s : summaries) {
            byIndex.put(s.index(), s);
        }
        for (var s : later.summaries()) {
            byIndex.put(s.index(), s);
        }
        var mergedReview = later.review() != null ? later.review() : review;
        return new LevelContext(levelNumber, List.copyOf(byIndex.values()), mergedReview);
    }

    /**
     * Renders the successful items of this level as prompt lines. Returns an
     * empty string when nothing in the level succeeded.
     */
    public String toPromptText() {
        var sb = new StringBuilder();
        for (var s : summaries) {
            if (!s.success()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("- Item ").append(s.index() + 1).append(": ").append(truncate(s.text(), MAX_ITEM_TEXT_CHARS));
            if (!s.filesModified().isEmpty()) {
                var files = s.filesModified();
                sb.append("\n  Files modified: ")
                        .append(String.join(", ", files.subList(0, Math.min(MAX_LISTED_FILES, files.size()))));
                if (files.size() > MAX_LISTED_FILES) {
                    sb.append(" (+").append(files.size() - MAX_LISTED_FILES).append(" more)");
                }
            }
            if (!s.keyOutput().isBlank()) {
                sb.append("\n  Result: ").append(s.keyOutput());
            }
        }
        String text = sb.toString();
        if (text.length() > MAX_CONTEXT_CHARS) {
            text = text.substring(0, MAX_CONTEXT_CHARS - 3) + "...";
        }
        return text;
    }

    /**
     * Builds the background section for the next level's prompts from every
     * finished level so far. Coordinator reviews are rendered even when no
     * item succeeded; the combined text is capped at {@link #MAX_CONTEXT_CHARS}.
     */
    public static String renderAll(List<LevelContext> contexts) {
        if (contexts == null || contexts.isEmpty()) {
            return "";
        }
        var sections = contexts.stream()
                .map(LevelContext::toPromptText)
                .filter(text -> !text.isEmpty())
                .toList();
        var sb = new StringBuilder();
        if (!sections.isEmpty()) {
            sb.append("\n## Previous Work Context\n")
                    .append("These items are already done. Build on their results instead of redoing them.\n\n")
                    .append(String.join("\n\n", sections))
                    .append('\n');
        }
        for (var context : contexts) {
            var review = context.review();
            if (review == null) {
                continue;
            }
            sb.append("\n## Coordinator Review (Level ").append(review.levelNumber()).append(")\n");
            if (!review.summary().isBlank()) {
                sb.append("**Review**: ").append(review.summary()).append('\n');
            }
            if (!review.fixesApplied().isEmpty()) {
                sb.append("**Fixes applied**: ").append(String.join("; ", review.fixesApplied())).append('\n');
            }
            for (var warning : review.warnings()) {
                sb.append("- WARNING: ").append(warning).append('\n');
            }
        }
        String text = sb.toString();
        if (text.length() > MAX_CONTEXT_CHARS) {
            text = text.substring(0, MAX_CONTEXT_CHARS - 3) + "...";
        }
        return text;
    }

    private static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) : text;
    }
}

package com.parallax.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class LevelContextTest {

    private static ItemSummary summary(int index, boolean success, List<String> files, String output) {
        return new ItemSummary(index, "Item text " + index, success, List.of("write_file"), files, output);
    }

    @Test
    @DisplayName("Only successful items are rendered")
    void successfulOnly() {
        var context = new LevelContext(0, List.of(
                summary(0, true, List.of("src/A.java"), "A done"),
                summary(1, false, List.of("src/B.java"), "B broke")), null);

        String text = context.toPromptText();

        assertTrue(text.contains("- Item 1: Item text 0"));
        assertTrue(text.contains("Files modified: src/A.java"));
        assertTrue(text.contains("Result: A done"));
        assertFalse(text.contains("B broke"));
    }

    @Test
    @DisplayName("Item text, file lists and total length are capped")
    void caps() {
        var longText = "x".repeat(100);
        var files = IntStream.range(0, 8).mapToObj(i -> "src/F" + i + ".java").toList();
        var context = new LevelContext(0, List.of(
                new ItemSummary(0, longText, true, List.of(), files, "")), null);

        String text = context.toPromptText();

        assertTrue(text.contains("x".repeat(60)));
        assertFalse(text.contains("x".repeat(61)));
        assertTrue(text.contains("src/F4.java"));
        assertFalse(text.contains("src/F5.java"));
        assertTrue(text.contains("(+3 more)"));

        var many = IntStream.range(0, 60)
                .mapToObj(i -> summary(i, true, List.of("src/File" + i + ".java"), "output ".repeat(10)))
                .toList();
        String capped = new LevelContext(1, many, null).toPromptText();
        assertEquals(LevelContext.MAX_CONTEXT_CHARS, capped.length());
        assertTrue(capped.endsWith("..."));
    }

    @Test
    @DisplayName("Rendering all levels adds coordinator reviews")
    void renderAllWithReview() {
        var review = new CoordinatorReview(0, List.of(), "Merged config keys", List.of("Combined app.yaml"),
                List.of("Port changed to 8081"), true);
        var contexts = List.of(new LevelContext(0, List.of(summary(0, true, List.of(), "ok")), review));

        String text = LevelContext.renderAll(contexts);

        assertTrue(text.contains("## Previous Work Context"));
        assertTrue(text.contains("## Coordinator Review (Level 0)"));
        assertTrue(text.contains("**Fixes applied**: Combined app.yaml"));
        assertTrue(text.contains("- WARNING: Port changed to 8081"));
    }

    @Test
    @DisplayName("Coordinator warnings survive a level with no successful items")
    void reviewWithoutSuccesses() {
        var review = new CoordinatorReview(0, List.of(), "", List.of(),
                List.of("Unresolved conflict in build.gradle"), false);
        var contexts = List.of(new LevelContext(0, List.of(summary(0, false, List.of(), "broke")), review));

        String text = LevelContext.renderAll(contexts);

        assertFalse(text.contains("## Previous Work Context"));
        assertTrue(text.contains("## Coordinator Review (Level 0)"));
        assertTrue(text.contains("- WARNING: Unresolved conflict in build.gradle"));
    }

    @Test
    @DisplayName("The combined text of several levels is capped as a whole")
    void combinedCap() {
        var contexts = IntStream.range(0, 4)
                .mapToObj(level -> new LevelContext(level, IntStream.range(0, 10)
                        .mapToObj(i -> summary(i, true, List.of("src/L" + level + "F" + i + ".java"), "output ".repeat(10)))
                        .toList(), null))
                .toList();
        contexts.forEach(context -> assertTrue(context.toPromptText().length() < LevelContext.MAX_CONTEXT_CHARS));

        String text = LevelContext.renderAll(contexts);

        assertEquals(LevelContext.MAX_CONTEXT_CHARS, text.length());
        assertTrue(text.endsWith("..."));
    }

    @Test
    @DisplayName("Nothing to render gives an empty string")
    void empty() {
        assertEquals("", LevelContext.renderAll(List.of()));
        assertEquals("", LevelContext.renderAll(List.of(
                new LevelContext(0, List.of(summary(0, false, List.of(), "")), null))));
    }

    @Test
    @DisplayName("A later pass replaces re-executed items and keeps the rest")
    void merge() {
        var first = new LevelContext(2, List.of(summary(0, true, List.of(), "first"),
                summary(1, false, List.of(), "failed")), null);
        var second = new LevelContext(2, List.of(summary(1, true, List.of(), "fixed")), null);

        var merged = first.mergedWith(second);

        assertEquals(List.of("first", "fixed"), merged.summaries().stream().map(ItemSummary::keyOutput).toList());
    }

    @Test
    @DisplayName("Item summaries keep the tail of long outputs")
    void summaryTail() {
        var output = "head " + "y".repeat(300);
        var trace = new ExecutionTrace(0, null, List.of(), output, "", true, List.of(), 1);

        var summary = ItemSummary.of("Item", trace);

        assertEquals(ItemSummary.KEY_OUTPUT_CHARS, summary.keyOutput().length());
        assertFalse(summary.keyOutput().contains("head"));
    }
}

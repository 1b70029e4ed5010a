package com.parallax.core.nodes;

import com.parallax.core.Fixtures;
import com.parallax.core.coordination.LevelCoordinator;
import com.parallax.core.engine.CancellationRegistry;
import com.parallax.core.events.EventBus;
import com.parallax.core.model.CoordinatorReview;
import com.parallax.core.model.ItemSummary;
import com.parallax.core.model.LevelContext;
import com.parallax.core.model.Specification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.parallax.core.nodes.Sessions.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CoordinateLevelNodeTest {

    private LevelCoordinator coordinator;
    private CancellationRegistry cancellations;
    private EventBus bus;
    private Specification spec;

    @BeforeEach
    void setUp() {
        coordinator = mock(LevelCoordinator.class);
        cancellations = new CancellationRegistry();
        bus = new EventBus();
        spec = Fixtures.spec("Model", "Repository", "Service", "API");
    }

    private Map<String, Object> coordinate(List<Integer> resolvedLevels, LevelContext current) {
        return new CoordinateLevelNode(coordinator, cancellations).apply(state(spec, diamond(spec), started(bus, 4),
                Map.of("levelNumber", 1,
                        "levelTraces", List.of(Fixtures.trace(1, true, "a"), Fixtures.trace(2, true, "b")),
                        "resolvedLevels", resolvedLevels,
                        "currentLevelContext", current)));
    }

    private static ItemSummary summary(int index, String output) {
        return new ItemSummary(index, "item", true, List.of(), List.of(), output);
    }

    @Test
    @DisplayName("The first pass of a level may resolve conflicts and records that it did")
    void firstPass() {
        var review = new CoordinatorReview(1, List.of(), "Merged", List.of(), List.of(), true);
        when(coordinator.coordinate(eq(SESSION), eq(1), anyList(), anyMap(), eq(true)))
                .thenReturn(new LevelContext(1, List.of(summary(1, "one"), summary(2, "two")), review));

        var updates = coordinate(List.of(), new LevelContext(1, List.of(), null));

        assertEquals(List.of(1), updates.get("resolvedLevels"));
        var context = (LevelContext) updates.get("currentLevelContext");
        assertTrue(context.hasReview());
        assertEquals(2, context.summaries().size());
        verify(coordinator).coordinate(eq(SESSION), eq(1), anyList(),
                eq(Map.of(1, "Repository", 2, "Service")), eq(true));
    }

    @Test
    @DisplayName("Later passes of a resolved level may not resolve again")
    void laterPass() {
        when(coordinator.coordinate(anyString(), anyInt(), anyList(), anyMap(), anyBoolean()))
                .thenReturn(new LevelContext(1, List.of(summary(1, "retried")), null));
        var earlier = new LevelContext(1, List.of(summary(1, "first"), summary(2, "two")),
                new CoordinatorReview(1, List.of(), "Merged", List.of(), List.of(), true));

        var updates = coordinate(List.of(1), earlier);

        verify(coordinator).coordinate(eq(SESSION), eq(1), anyList(), anyMap(), eq(false));
        assertNull(updates.get("resolvedLevels"));
        var context = (LevelContext) updates.get("currentLevelContext");
        assertEquals(List.of("retried", "two"), context.summaries().stream().map(ItemSummary::keyOutput).toList());
        assertTrue(context.hasReview());
    }

    @Test
    @DisplayName("A level without conflicts is not marked resolved")
    void noConflicts() {
        when(coordinator.coordinate(anyString(), anyInt(), anyList(), anyMap(), anyBoolean()))
                .thenReturn(new LevelContext(1, List.of(summary(1, "one")), null));

        var updates = coordinate(List.of(), new LevelContext(1, List.of(), null));

        assertNull(updates.get("resolvedLevels"));
    }
}

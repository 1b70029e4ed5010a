package com.parallax.core.coordination;

import com.parallax.core.agent.AgentException;
import com.parallax.core.agent.AgentInvoker;
import com.parallax.core.agent.AgentRequest;
import com.parallax.core.agent.AgentTool;
import com.parallax.core.events.EventBus;
import com.parallax.core.events.EventTypes;
import com.parallax.core.events.ParallaxEvent;
import com.parallax.core.execution.ExecutionProperties;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.model.ExecutionTrace;
import com.parallax.core.model.FileConflict;
import com.parallax.core.resilience.BackendCalls;
import com.parallax.core.resilience.BackendUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.parallax.core.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LevelCoordinatorTest {

    private static final Map<Integer, String> TEXTS = Map.of(
            0, "Add logging settings", 1, "Add database settings", 2, "Write the README");

    private ExecutorService executor;
    private AgentInvoker invoker;
    private EventBus bus;
    private SimpleMeterRegistry registry;
    private LevelCoordinator coordinator;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        invoker = mock(AgentInvoker.class);
        bus = new EventBus();
        registry = new SimpleMeterRegistry();
        var calls = new BackendCalls(executor, Duration.ofSeconds(5), 3, Duration.ofMillis(1), 1.0);
        coordinator = new LevelCoordinator(invoker, calls, bus, new ExecutionProperties(),
                new ParallaxMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private List<ExecutionTrace> conflictingLevel() {
        return List.of(
                trace(1, true, "config/app.yaml"),
                trace(0, true, "config/app.yaml", "src/Log.java"),
                trace(2, true, "README.md"));
    }

    private static ExecutionTrace coordinatorAnswer(String output) {
        return new ExecutionTrace(-1, null, List.of(), output, "", true, List.of(), 5);
    }

    private List<String> eventTypes() {
        return bus.history("s1").stream().map(ParallaxEvent::eventType).toList();
    }

    @Test
    @DisplayName("A conflict-free level makes no agent call and carries no review")
    void noConflictsNoCall() {
        var context = coordinator.coordinate("s1", 0,
                List.of(trace(0, true, "a.txt"), trace(1, true, "b.txt")), TEXTS, true);

        assertFalse(context.hasReview());
        assertEquals(2, context.summaries().size());
        verifyNoInteractions(invoker);
        assertTrue(bus.history("s1").isEmpty());
    }

    @Test
    @DisplayName("A shared config file triggers exactly one resolution session")
    void sharedConfigResolved() {
        when(invoker.invoke(any())).thenReturn(coordinatorAnswer("""
                {"review_summary": "Merged both settings blocks",
                 "fixes_applied": ["config/app.yaml: kept logging and database sections"],
                 "warnings_for_next_level": ["Database password is a placeholder"],
                 "conflicts_resolved": ["./config/app.yaml"]}
                """));

        var context = coordinator.coordinate("s1", 0, conflictingLevel(), TEXTS, true);

        verify(invoker, times(1)).invoke(any());
        assertTrue(context.hasReview());
        var review = context.review();
        assertTrue(review.completed());
        assertEquals(1, review.resolvedCount());
        FileConflict conflict = review.conflicts().get(0);
        assertEquals(List.of(0, 1), conflict.itemIndices());
        assertEquals("config/app.yaml: kept logging and database sections", conflict.resolutionDescription());
        assertEquals(List.of("Database password is a placeholder"), review.warnings());
        assertEquals(List.of(0, 1, 2), context.summaries().stream().map(s -> s.index()).toList());

        assertEquals(List.of(EventTypes.CONFLICT_DETECTED, EventTypes.REVIEW_STARTED,
                EventTypes.REVIEW_COMPLETED, EventTypes.CONFLICT_RESOLVED), eventTypes());
        assertEquals(1.0, registry.find("parallax.conflicts.resolved").counter().count());
    }

    @Test
    @DisplayName("The resolution session gets the coordinator tool set and sees every conflicting item")
    void resolutionRequest() {
        when(invoker.invoke(any())).thenReturn(coordinatorAnswer("{\"review_summary\": \"ok\"}"));

        coordinator.coordinate("s1", 2, conflictingLevel(), TEXTS, true);

        ArgumentCaptor<AgentRequest> captor = ArgumentCaptor.forClass(AgentRequest.class);
        verify(invoker).invoke(captor.capture());
        var request = captor.getValue();
        assertEquals(AgentTool.COORDINATOR_TOOLS, request.capabilities());
        assertEquals(-1, request.itemIndex());
        assertTrue(request.prompt().contains("config/app.yaml"));
        assertTrue(request.prompt().contains("Add logging settings"));
        assertTrue(request.prompt().contains("Add database settings"));
        assertEquals(Duration.ofSeconds(300), request.deadline());
    }

    @Test
    @DisplayName("A session failing on every attempt leaves conflicts unresolved and adds a warning")
    void failedSession() {
        when(invoker.invoke(any())).thenThrow(new AgentException("sandbox crashed"));

        var context = coordinator.coordinate("s1", 0, conflictingLevel(), TEXTS, true);

        var review = context.review();
        assertFalse(review.completed());
        assertEquals(0, review.resolvedCount());
        assertEquals("Coordinator review failed: sandbox crashed", review.summary());
        assertEquals(1, review.warnings().size());
        assertTrue(eventTypes().contains(EventTypes.REVIEW_FAILED));
        verify(invoker, times(3)).invoke(any());
        assertEquals(1.0, registry.find("parallax.degraded.total")
                .tag("operation", "conflict_resolution").counter().count());
    }

    @Test
    @DisplayName("A transient failure is retried within the single resolution pass")
    void transientFailureRetried() {
        when(invoker.invoke(any()))
                .thenThrow(new BackendUnavailableException("connection reset", null))
                .thenReturn(coordinatorAnswer("{\"review_summary\": \"Merged\", \"conflicts_resolved\": []}"));

        var context = coordinator.coordinate("s1", 0, conflictingLevel(), TEXTS, true);

        verify(invoker, times(2)).invoke(any());
        var review = context.review();
        assertTrue(review.completed());
        assertEquals(1, review.resolvedCount());
        assertEquals("Merged", review.summary());
        assertEquals(1, eventTypes().stream().filter(EventTypes.REVIEW_STARTED::equals).count());
        assertFalse(eventTypes().contains(EventTypes.REVIEW_FAILED));
    }

    @Test
    @DisplayName("A second pass over the same level is DENIED a resolution session")
    void resolutionDenied() {
        var context = coordinator.coordinate("s1", 0, conflictingLevel(), TEXTS, false);

        verifyNoInteractions(invoker);
        assertFalse(context.review().completed());
        assertEquals(0, context.review().resolvedCount());
        assertFalse(eventTypes().contains(EventTypes.REVIEW_STARTED));
    }

    @Nested
    @DisplayName("parseReview")
    class ParseReview {

        private final List<FileConflict> conflicts = List.of(
                FileConflict.detected("a.txt", List.of(0, 1)),
                FileConflict.detected("b.txt", List.of(1, 2)));

        @Test
        @DisplayName("Unstructured output becomes the summary and resolves every conflict")
        void unstructured() {
            String output = "I merged the files. ".repeat(40);

            var review = coordinator.parseReview(0, conflicts, output);

            assertEquals(output.substring(0, LevelCoordinator.FALLBACK_SUMMARY_CHARS).strip(), review.summary());
            assertEquals(2, review.resolvedCount());
        }

        @Test
        @DisplayName("An empty resolved list means every conflict was handled")
        void emptyListResolvesAll() {
            var review = coordinator.parseReview(0, conflicts, "{\"review_summary\": \"Both merged\"}");

            assertEquals(2, review.resolvedCount());
            assertEquals("Both merged", review.conflicts().get(1).resolutionDescription());
        }

        @Test
        @DisplayName("Paths left out of a non-empty list stay unresolved with a warning")
        void partialResolution() {
            var review = coordinator.parseReview(0, conflicts, """
                    ```json
                    {"review_summary": "", "conflicts_resolved": ["a.txt"]}
                    ```
                    """);

            assertTrue(review.conflicts().get(0).resolved());
            assertEquals("Reconciled by coordinator session", review.conflicts().get(0).resolutionDescription());
            assertFalse(review.conflicts().get(1).resolved());
            assertEquals(1, review.warnings().size());
            assertTrue(review.warnings().get(0).contains("b.txt"));
        }
    }
}

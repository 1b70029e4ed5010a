package com.parallax.core.execution;

import com.parallax.core.Fixtures;
import com.parallax.core.agent.AgentException;
import com.parallax.core.agent.AgentInvoker;
import com.parallax.core.agent.AgentRequest;
import com.parallax.core.agent.TaskKindRegistry;
import com.parallax.core.events.EventBus;
import com.parallax.core.events.EventTypes;
import com.parallax.core.llm.LlmService;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.model.ExecutionTrace;
import com.parallax.core.model.ItemSummary;
import com.parallax.core.model.LevelContext;
import com.parallax.core.model.WorkItemNode;
import com.parallax.core.resilience.BackendCalls;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.IntStream;

import static com.parallax.core.Fixtures.write;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WorkItemExecutorTest {

    private ExecutorService executor;
    private AgentInvoker invoker;
    private LlmService llm;
    private EventBus bus;
    private SimpleMeterRegistry registry;
    private ExecutionProperties properties;
    private WorkItemExecutor workItemExecutor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        invoker = mock(AgentInvoker.class);
        llm = mock(LlmService.class);
        bus = new EventBus();
        registry = new SimpleMeterRegistry();
        properties = new ExecutionProperties();
        var calls = new BackendCalls(executor, Duration.ofSeconds(5), 2, Duration.ofMillis(1), 1.0);
        workItemExecutor = new WorkItemExecutor(invoker, llm, calls, TaskKindRegistry.defaults(), bus, executor,
                properties, new ParallaxMetrics(registry));

        when(invoker.invoke(any())).thenAnswer(inv -> {
            AgentRequest r = inv.getArgument(0);
            String file = r.subItemIndex() != null ? "src/Part" + r.subItemIndex() + ".java" : "src/Item.java";
            return new ExecutionTrace(r.itemIndex(), r.subItemIndex(), List.of(write(file)),
                    "finished " + r.subItemIndex(), "", true, List.of(), 20 + (r.subItemIndex() != null ? r.subItemIndex() : 0));
        });
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private WorkItemRequest request(List<LevelContext> contexts, String feedback) {
        var spec = Fixtures.spec("Create the model", "Create the API");
        return new WorkItemRequest("s1", spec, new WorkItemNode(1, "Create the API", Set.of(0)),
                contexts, feedback, false, 1);
    }

    private void decompose(DecompositionDecision decision) {
        when(llm.structuredCall(anyString(), anyString(), eq(DecompositionDecision.class))).thenReturn(decision);
    }

    private static List<String> subItems(int count) {
        return IntStream.range(0, count).mapToObj(i -> "Part " + i).toList();
    }

    @Test
    @DisplayName("An atomic item runs one session with the kind's tools, context and feedback")
    void atomicItem() {
        decompose(DecompositionDecision.atomic("small"));
        var context = new LevelContext(0, List.of(new ItemSummary(0, "Create the model", true,
                List.of("write_file"), List.of("src/Model.java"), "Model ready")), null);

        var trace = workItemExecutor.execute(request(List.of(context), "## Previous Attempts\nMissing tests"));

        ArgumentCaptor<AgentRequest> captor = ArgumentCaptor.forClass(AgentRequest.class);
        verify(invoker).invoke(captor.capture());
        var agentRequest = captor.getValue();
        assertEquals(1, agentRequest.itemIndex());
        assertNull(agentRequest.subItemIndex());
        assertEquals(TaskKindRegistry.defaults().profileFor(Fixtures.spec("x").taskKind()).capabilities(),
                agentRequest.capabilities());
        assertEquals(Duration.ofSeconds(600), agentRequest.deadline());
        assertTrue(agentRequest.prompt().contains("Create the API"));
        assertTrue(agentRequest.prompt().contains("src/Model.java"));
        assertTrue(agentRequest.prompt().contains("Missing tests"));

        assertFalse(trace.isDecomposed());
        assertEquals(List.of("src/Item.java"), trace.filesModified());
        assertEquals(1, registry.find("parallax.item.duration").tag("kind", "CODE").timer().count());
    }

    @Test
    @DisplayName("A decomposed item runs one session per sub-item and merges them under the parent")
    void decomposedItem() {
        decompose(new DecompositionDecision(false, subItems(3), "three layers"));

        var trace = workItemExecutor.execute(request(List.of(), ""));

        verify(invoker, times(3)).invoke(any());
        verify(llm, times(1)).structuredCall(anyString(), anyString(), eq(DecompositionDecision.class));
        assertTrue(trace.isDecomposed());
        assertEquals(1, trace.itemIndex());
        assertNull(trace.subItemIndex());
        assertTrue(trace.toolInvocations().isEmpty());
        assertEquals(3, trace.subTraces().size());
        assertEquals(List.of(0, 1, 2), trace.subTraces().stream().map(ExecutionTrace::subItemIndex).toList());
        assertEquals(List.of("src/Part0.java", "src/Part1.java", "src/Part2.java"), trace.filesModified());
        assertTrue(trace.finalOutput().contains("### Sub-item 1: Part 0"));
        assertTrue(trace.success());
        assertEquals(22, trace.durationMs());
        assertTrue(bus.history("s1").stream().anyMatch(e -> e.eventType().equals(EventTypes.ITEM_DECOMPOSED)));
    }

    @Test
    @DisplayName("Sub-item prompts list their siblings")
    void siblingAwareness() {
        decompose(new DecompositionDecision(false, List.of("Repository", "Controller"), ""));

        workItemExecutor.execute(request(List.of(), ""));

        ArgumentCaptor<AgentRequest> captor = ArgumentCaptor.forClass(AgentRequest.class);
        verify(invoker, times(2)).invoke(captor.capture());
        var controller = captor.getAllValues().stream()
                .filter(r -> Integer.valueOf(1).equals(r.subItemIndex())).findFirst().orElseThrow();
        assertTrue(controller.prompt().contains("## Your Sub-Item\nController"));
        assertTrue(controller.prompt().contains("- Repository"));
    }

    @Test
    @DisplayName("A failing sub-item fails the item and keeps the surviving sub-traces")
    void failingSubItem() {
        decompose(new DecompositionDecision(false, subItems(3), ""));
        doThrow(new AgentException("tool crashed"))
                .when(invoker).invoke(argThat(r -> r != null && Integer.valueOf(1).equals(r.subItemIndex())));

        var ex = assertThrows(AgentException.class, () -> workItemExecutor.execute(request(List.of(), "")));

        assertTrue(ex.getMessage().contains("sub-item 2"));
        assertEquals(2, ex.getPartialTraces().size());
    }

    @Nested
    @DisplayName("Decomposition decision")
    class Decision {

        @Test
        @DisplayName("Fewer than two sub-items counts as atomic")
        void tooFew() {
            decompose(new DecompositionDecision(false, subItems(1), ""));
            assertTrue(workItemExecutor.decide(request(List.of(), "")).atomic());
        }

        @Test
        @DisplayName("More than five sub-items counts as atomic")
        void tooMany() {
            decompose(new DecompositionDecision(false, subItems(6), ""));
            assertTrue(workItemExecutor.decide(request(List.of(), "")).atomic());
        }

        @Test
        @DisplayName("Blank sub-items are ignored before the range check")
        void blankSubItems() {
            decompose(new DecompositionDecision(false, List.of("A", " ", "B"), ""));

            var decision = workItemExecutor.decide(request(List.of(), ""));

            assertFalse(decision.atomic());
            assertEquals(List.of("A", "B"), decision.subItems());
        }

        @Test
        @DisplayName("A failed check is treated as atomic and recorded as degraded")
        void failedCheck() {
            when(llm.structuredCall(anyString(), anyString(), eq(DecompositionDecision.class)))
                    .thenThrow(new RuntimeException("timeout"));

            var trace = workItemExecutor.execute(request(List.of(), ""));

            assertFalse(trace.isDecomposed());
            verify(invoker, times(1)).invoke(any());
            assertEquals(1.0, registry.find("parallax.degraded.total")
                    .tag("operation", "decomposition").counter().count());
        }

        @Test
        @DisplayName("Disabled decomposition skips the backend")
        void disabled() {
            properties.getDecomposition().setEnabled(false);

            assertTrue(workItemExecutor.decide(request(List.of(), "")).atomic());
            verifyNoInteractions(llm);
        }
    }

    @Test
    @DisplayName("Merged success is false when any sub-trace failed")
    void mergeSuccess() {
        var ok = new ExecutionTrace(0, 0, List.of(), "a", "", true, List.of(), 5);
        var bad = new ExecutionTrace(0, 1, List.of(), "b", "", false, List.of(), 9);

        var merged = WorkItemExecutor.merge(0, List.of("A", "B"), List.of(ok, bad));

        assertFalse(merged.success());
        assertEquals(9, merged.durationMs());
    }
}

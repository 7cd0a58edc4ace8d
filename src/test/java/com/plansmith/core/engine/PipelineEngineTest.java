package com.plansmith.core.engine;

import com.plansmith.core.events.EventBus;
import com.plansmith.core.events.PipelineEvent;
import com.plansmith.core.graph.PipelineAbortedException;
import com.plansmith.core.graph.PlanningGraph;
import com.plansmith.core.metrics.PlanningMetrics;
import com.plansmith.core.model.PipelineStatus;
import com.plansmith.core.nodes.GeneratePlanNode;
import com.plansmith.core.nodes.RefinePlanNode;
import com.plansmith.core.nodes.ReportNode;
import com.plansmith.core.nodes.ResearchNode;
import com.plansmith.core.nodes.ValidatePlanNode;
import com.plansmith.core.planning.PlanGenerator;
import com.plansmith.core.planning.PlanRefiner;
import com.plansmith.core.planning.PlanningProperties;
import com.plansmith.core.state.PlanningState;
import com.plansmith.core.validation.PlanValidator;
import com.plansmith.research.ResearchProperties;
import com.plansmith.research.SearchProvider;
import com.plansmith.research.SearchProviderException;
import com.plansmith.research.SourceSummarizer;
import com.plansmith.support.PlanFixtures;
import com.plansmith.support.ScriptedGenerationProvider;
import com.plansmith.support.ScriptedGenerationProvider.Role;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link PipelineEngine}.
 * Uses a real graph with scripted LLM replies and a mocked search provider.
 */
class PipelineEngineTest {

    private ScriptedGenerationProvider llm;
    private SearchProvider searchProvider;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private PlanningProperties planningProperties;
    private ResearchProperties researchProperties;
    private PipelineEngine engine;
    private List<PipelineEvent> events;

    @BeforeEach
    void setUp() throws Exception {
        llm = new ScriptedGenerationProvider()
                .script(Role.PLANNER, PlanFixtures.validPlanJson())
                .script(Role.RESEARCHER, "{}")
                .script(Role.REPORTER, "# Report");
        searchProvider = mock(SearchProvider.class);
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribe(events::add);
        registry = new SimpleMeterRegistry();
        planningProperties = new PlanningProperties();
        researchProperties = new ResearchProperties();
        researchProperties.setEnabled(false);

        var metrics = new PlanningMetrics(registry);
        var graph = new PlanningGraph(
                new GeneratePlanNode(new PlanGenerator(llm, planningProperties, metrics), eventBus),
                new ValidatePlanNode(new PlanValidator(), metrics, eventBus),
                new RefinePlanNode(new PlanRefiner(llm), eventBus),
                new ResearchNode(searchProvider, new SourceSummarizer(llm, researchProperties), llm, researchProperties),
                new ReportNode(llm));
        engine = new PipelineEngine(graph, eventBus, metrics, planningProperties, researchProperties);
    }

    @Test
    @DisplayName("run executes the pipeline with configured defaults")
    void runWithDefaults() {
        PlanningState state = engine.run("Migrate the billing service");

        assertTrue(state.runId().startsWith("PLAN-"));
        assertEquals("Migrate the billing service", state.task());
        assertEquals(PlanningState.DEFAULT_MAX_ATTEMPTS, state.maxAttempts());
        assertFalse(state.useWebResearch());
        assertTrue(state.validated());
        assertEquals(PipelineStatus.COMPLETED, state.status());
        assertEquals("# Report", state.reportMarkdown());
        verifyNoInteractions(searchProvider);
    }

    @Test
    @DisplayName("Events are published in pipeline order")
    void publishesEvents() {
        engine.run("Migrate the billing service", 3, false);

        List<String> types = events.stream().map(PipelineEvent::eventType).toList();
        assertEquals(List.of("pipeline.started", "plan.generated", "plan.validated", "pipeline.completed"), types);
    }

    @Test
    @DisplayName("Accepted and best-effort outcomes are recorded")
    void recordsOutcomes() {
        engine.run("Migrate the billing service", 3, false);
        llm.script(Role.PLANNER, "garbage");
        llm.script(Role.REVIEWER, "garbage");
        engine.run("Migrate the billing service", 1, false);

        assertEquals(1.0, registry.counter("plansmith.pipelines.total", "outcome", "accepted").count());
        assertEquals(1.0, registry.counter("plansmith.pipelines.total", "outcome", "best_effort").count());
        assertEquals(2L, registry.timer("plansmith.pipeline.duration").count());
    }

    @Test
    @DisplayName("Blank task is rejected")
    void blankTask() {
        assertThrows(IllegalArgumentException.class, () -> engine.run("  "));
        assertThrows(IllegalArgumentException.class, () -> engine.run(null, 3, false));
    }

    @Test
    @DisplayName("Attempt ceiling outside 0..10 is rejected")
    void attemptBounds() {
        assertThrows(IllegalArgumentException.class, () -> engine.run("task", -1, false));
        assertThrows(IllegalArgumentException.class, () -> engine.run("task", 11, false));
    }

    @Test
    @DisplayName("Step ceiling too small for the attempt ceiling is rejected")
    void stepCeilingTooSmall() {
        planningProperties.setMaxSteps(9);
        var ex = assertThrows(IllegalArgumentException.class, () -> engine.run("task", 3, false));
        assertTrue(ex.getMessage().contains("needs at least 10"));
    }

    @Test
    @DisplayName("Search failures propagate and are recorded as failed runs")
    void collaboratorFailure() {
        when(searchProvider.search(anyString(), anyInt())).thenThrow(new SearchProviderException("HTTP 500"));

        assertThrows(RuntimeException.class, () -> engine.run("Migrate the billing service", 3, true));

        assertEquals(1.0, registry.counter("plansmith.pipelines.total", "outcome", "failed").count());
        assertEquals("pipeline.failed", events.get(events.size() - 1).eventType());
    }

    @Test
    @DisplayName("MDC run id is cleared after the run")
    void clearsMdc() {
        engine.run("Migrate the billing service", 3, false);
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("node"));
    }

    @Test
    @DisplayName("Run ids are unique and formatted")
    void runIds() {
        String first = engine.generateRunId();
        String second = engine.generateRunId();
        assertNotEquals(first, second);
        assertTrue(first.matches("PLAN-\\d{4}-\\d{4,}"));
    }

    @Test
    @DisplayName("PipelineAbortedException carries the step it failed at")
    void abortedException() {
        var ex = new PipelineAbortedException("ceiling", 21);
        assertEquals(21, ex.getSteps());
    }
}

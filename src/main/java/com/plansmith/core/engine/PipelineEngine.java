package com.plansmith.core.engine;

import com.plansmith.core.events.EventBus;
import com.plansmith.core.events.PipelineEvent;
import com.plansmith.core.graph.PipelineAbortedException;
import com.plansmith.core.graph.PlanningGraph;
import com.plansmith.core.logging.MdcContext;
import com.plansmith.core.metrics.PlanningMetrics;
import com.plansmith.core.model.PipelineStatus;
import com.plansmith.core.model.RefinementPhase;
import com.plansmith.core.planning.PlanningProperties;
import com.plansmith.core.state.PlanningState;
import com.plansmith.research.ResearchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the planning pipeline for a task by building the initial state and
 * invoking the compiled LangGraph4j graph.
 */
@Service
public class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    /** Upper bound on the refinement ceiling accepted per run. */
    public static final int MAX_ATTEMPTS_LIMIT = 10;

    private final PlanningGraph planningGraph;
    private final EventBus eventBus;
    private final PlanningMetrics metrics;
    private final PlanningProperties planningProperties;
    private final ResearchProperties researchProperties;

    public PipelineEngine(PlanningGraph planningGraph,
                          EventBus eventBus,
                          PlanningMetrics metrics,
                          PlanningProperties planningProperties,
                          ResearchProperties researchProperties) {
        this.planningGraph = planningGraph;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.planningProperties = planningProperties;
        this.researchProperties = researchProperties;
    }

    /**
     * Runs the pipeline with the configured refinement ceiling and research setting.
     */
    public PlanningState run(String task) {
        return run(task, planningProperties.getMaxAttempts(), researchProperties.isEnabled());
    }

    /**
     * Runs the pipeline for one task.
     *
     * @param task           the free-text task description, must not be blank
     * @param maxAttempts    refinement ceiling, between 0 and {@value #MAX_ATTEMPTS_LIMIT}
     * @param useWebResearch whether the research node queries the web
     * @return the final graph state
     * @throws IllegalArgumentException  if the task is blank or the ceilings are inconsistent
     * @throws PipelineAbortedException if the run exceeds its step ceiling
     */
    public PlanningState run(String task, int maxAttempts, boolean useWebResearch) {
        if (task == null || task.isBlank()) {
            throw new IllegalArgumentException("Task must not be blank");
        }
        if (maxAttempts < 0 || maxAttempts > MAX_ATTEMPTS_LIMIT) {
            throw new IllegalArgumentException(String.format(
                    "maxAttempts must be between 0 and %d, was %d", MAX_ATTEMPTS_LIMIT, maxAttempts));
        }
        int maxSteps = planningProperties.getMaxSteps();
        int requiredSteps = 2 * maxAttempts + 4;
        if (maxSteps < requiredSteps) {
            throw new IllegalArgumentException(String.format(
                    "maxSteps %d is too low for maxAttempts %d (needs at least %d)",
                    maxSteps, maxAttempts, requiredSteps));
        }

        String runId = generateRunId();
        MdcContext.setRun(runId);
        long start = System.currentTimeMillis();
        try {
            log.info("Starting run {} (maxAttempts={}, webResearch={}): {}",
                    runId, maxAttempts, useWebResearch, task);
            eventBus.publish(PipelineEvent.of("pipeline.started", runId, Map.of(
                    "task", task,
                    "maxAttempts", maxAttempts,
                    "useWebResearch", useWebResearch)));

            var stateMap = new HashMap<String, Object>();
            stateMap.put("runId", runId);
            stateMap.put("task", task);
            stateMap.put("attemptCount", 0);
            stateMap.put("maxAttempts", maxAttempts);
            stateMap.put("validated", false);
            stateMap.put("refinementPhase", RefinementPhase.GENERATING.name());
            stateMap.put("status", PipelineStatus.PLANNING.name());
            stateMap.put("stepCount", 0);
            stateMap.put("maxSteps", maxSteps);
            stateMap.put("useWebResearch", useWebResearch);

            PlanningState state;
            try {
                state = planningGraph.getCompiledGraph()
                        .invoke(Map.copyOf(stateMap))
                        .orElseThrow(() -> new IllegalStateException(
                                "Graph execution returned empty state for run " + runId));
            } catch (Exception e) {
                throw unwrapFailure(runId, e);
            }

            long elapsed = System.currentTimeMillis() - start;
            String outcome = state.validated() ? "accepted" : "best_effort";
            metrics.recordPipelineDuration(elapsed);
            metrics.recordPipelineResult(outcome);
            log.info("Run {} completed in {}ms ({}, {} refinement attempt(s))",
                    runId, elapsed, outcome, state.attemptCount());
            eventBus.publish(PipelineEvent.of("pipeline.completed", runId, Map.of(
                    "validated", state.validated(),
                    "attempts", state.attemptCount(),
                    "durationMs", elapsed)));
            return state;
        } catch (RuntimeException e) {
            metrics.recordPipelineDuration(System.currentTimeMillis() - start);
            metrics.recordPipelineResult("failed");
            log.error("Run {} failed: {}", runId, e.getMessage(), e);
            eventBus.publish(PipelineEvent.of("pipeline.failed", runId, Map.of(
                    "error", String.valueOf(e.getMessage()))));
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Generates a unique run ID in the format PLAN-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("PLAN-%d-%04d", year, count);
    }

    /**
     * Surfaces a step-ceiling abort from under the executor's wrapping; other failures
     * are rethrown unchecked.
     */
    private static RuntimeException unwrapFailure(String runId, Exception e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof PipelineAbortedException aborted) {
                return aborted;
            }
            cause = cause.getCause();
        }
        if (e instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException("Graph execution failed for run " + runId, e);
    }
}

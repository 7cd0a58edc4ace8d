package com.plansmith.core.nodes;

import com.plansmith.core.events.EventBus;
import com.plansmith.core.events.PipelineEvent;
import com.plansmith.core.model.Plan;
import com.plansmith.core.model.RefinementPhase;
import com.plansmith.core.planning.PlanGenerator;
import com.plansmith.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Entry node of the refinement loop: drafts the first plan for the task.
 * Runs once per pipeline run; refinement never routes back here.
 */
@Component
public class GeneratePlanNode {

    private static final Logger log = LoggerFactory.getLogger(GeneratePlanNode.class);

    private final PlanGenerator planGenerator;
    private final EventBus eventBus;

    public GeneratePlanNode(PlanGenerator planGenerator, EventBus eventBus) {
        this.planGenerator = planGenerator;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(PlanningState state) {
        String task = state.task();
        log.info("Drafting plan for task: {}", task);

        // planner retries share the refinement ceiling's call budget
        Plan plan = planGenerator.generate(task, state.maxAttempts());

        eventBus.publish(PipelineEvent.of("plan.generated", state.runId(), Map.of(
                "timelineEntries", sizeOf(plan.timeline()),
                "workstreams", sizeOf(plan.workstreams()),
                "risks", sizeOf(plan.risks()))));

        return Map.of(
                "plan", plan,
                "refinementPhase", RefinementPhase.VALIDATING.name(),
                "logs", List.of(
                        "Planner: creating detailed timeline, workstreams, and risks.",
                        "Planner: detailed plan drafted."));
    }

    private static int sizeOf(List<?> values) {
        return values == null ? 0 : values.size();
    }
}

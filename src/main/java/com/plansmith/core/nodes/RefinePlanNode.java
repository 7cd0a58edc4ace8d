package com.plansmith.core.nodes;

import com.plansmith.core.events.EventBus;
import com.plansmith.core.events.PipelineEvent;
import com.plansmith.core.model.Plan;
import com.plansmith.core.model.RefinementPhase;
import com.plansmith.core.planning.PlanRefiner;
import com.plansmith.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Repairs the current plan against the violations from the last validation.
 * Always hands control back to validation; the attempt was already counted there.
 */
@Component
public class RefinePlanNode {

    private static final Logger log = LoggerFactory.getLogger(RefinePlanNode.class);

    private final PlanRefiner planRefiner;
    private final EventBus eventBus;

    public RefinePlanNode(PlanRefiner planRefiner, EventBus eventBus) {
        this.planRefiner = planRefiner;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(PlanningState state) {
        Plan current = state.plan().orElseThrow(
                () -> new IllegalStateException("Plan must be present before refinement"));
        List<String> violations = state.violations();
        int attempt = state.attemptCount();

        log.info("Refinement {}/{} for {} violation(s)", attempt, state.maxAttempts(), violations.size());
        Plan refined = planRefiner.refine(current, state.task(), violations);
        boolean replaced = refined != current;

        eventBus.publish(PipelineEvent.of("plan.refined", state.runId(), Map.of(
                "attempt", attempt,
                "replaced", replaced)));

        String outcome = replaced
                ? String.format("Reviewer: plan corrected (attempt %d).", attempt)
                : String.format("Reviewer: reply unparsable, previous plan kept (attempt %d).", attempt);
        return Map.of(
                "plan", refined,
                "refinementPhase", RefinementPhase.VALIDATING.name(),
                "logs", List.of(
                        String.format("Reviewer: repairing %s (attempt %d).", String.join(", ", violations), attempt),
                        outcome));
    }
}

package com.plansmith.core.nodes;

import com.plansmith.core.events.EventBus;
import com.plansmith.core.events.PipelineEvent;
import com.plansmith.core.metrics.PlanningMetrics;
import com.plansmith.core.model.PipelineStatus;
import com.plansmith.core.model.RefinementPhase;
import com.plansmith.core.state.PlanningState;
import com.plansmith.core.validation.PlanValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decision point of the refinement loop.
 *
 * <p>Validates the current plan and picks the next loop state:
 * <ul>
 *   <li>no violations: {@code DONE}, {@code validated=true}</li>
 *   <li>violations and {@code attemptCount >= maxAttempts}: {@code DONE},
 *       {@code validated=false}; the plan is forwarded as the best available</li>
 *   <li>violations otherwise: {@code REFINING}, {@code attemptCount + 1}</li>
 * </ul>
 * This is the only node that writes {@code attemptCount}. Every call appends one
 * line to {@code violationLog}.
 */
@Component
public class ValidatePlanNode {

    private static final Logger log = LoggerFactory.getLogger(ValidatePlanNode.class);

    private final PlanValidator validator;
    private final PlanningMetrics metrics;
    private final EventBus eventBus;

    public ValidatePlanNode(PlanValidator validator, PlanningMetrics metrics, EventBus eventBus) {
        this.validator = validator;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(PlanningState state) {
        List<String> violations = validator.validate(state.plan().orElse(null), state.task());
        int attempts = state.attemptCount();
        int maxAttempts = state.maxAttempts();
        int validationNumber = state.violationLog().size() + 1;

        var updates = new HashMap<String, Object>();
        updates.put("violations", violations);
        metrics.recordValidation(violations.isEmpty());

        if (violations.isEmpty()) {
            log.info("Validation {} passed after {} refinement attempt(s)", validationNumber, attempts);
            updates.put("validated", true);
            updates.put("refinementPhase", RefinementPhase.DONE.name());
            updates.put("status", PipelineStatus.RESEARCHING.name());
            updates.put("violationLog", List.of(String.format(
                    "Validation %d (refinement attempts %d/%d): passed", validationNumber, attempts, maxAttempts)));
            updates.put("logs", List.of("Validator: plan passed structural checks."));
            metrics.recordRefinementAttempts(attempts, true);
            eventBus.publish(PipelineEvent.of("plan.validated", state.runId(), Map.of(
                    "attempts", attempts)));
            return updates;
        }

        String codes = String.join(", ", violations);
        updates.put("validated", false);
        updates.put("violationLog", List.of(String.format(
                "Validation %d (refinement attempts %d/%d): %s", validationNumber, attempts, maxAttempts, codes)));
        eventBus.publish(PipelineEvent.of("plan.rejected", state.runId(), Map.of(
                "attempts", attempts,
                "violations", violations)));

        if (attempts >= maxAttempts) {
            log.warn("Refinement ceiling reached ({}/{}); forwarding plan with {} open violation(s): {}",
                    attempts, maxAttempts, violations.size(), codes);
            updates.put("refinementPhase", RefinementPhase.DONE.name());
            updates.put("status", PipelineStatus.RESEARCHING.name());
            updates.put("logs", List.of(String.format(
                    "Validator: refinement ceiling reached (%d/%d); forwarding best-effort plan with open issues -> %s.",
                    attempts, maxAttempts, codes)));
            metrics.recordRefinementAttempts(attempts, false);
            return updates;
        }

        int nextAttempt = attempts + 1;
        log.info("Validation {} found {} violation(s), requesting refinement {}/{}: {}",
                validationNumber, violations.size(), nextAttempt, maxAttempts, codes);
        updates.put("attemptCount", nextAttempt);
        updates.put("refinementPhase", RefinementPhase.REFINING.name());
        updates.put("logs", List.of(String.format(
                "Validator: plan still has issues -> %s (attempt %d/%d).", codes, nextAttempt, maxAttempts)));
        return updates;
    }
}

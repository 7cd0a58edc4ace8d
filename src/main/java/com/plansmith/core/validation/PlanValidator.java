package com.plansmith.core.validation;

import com.plansmith.core.model.Plan;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.plansmith.core.validation.PlanViolations.*;

/**
 * Deterministic structural check of a {@link Plan} against the plan schema.
 * <p>
 * Makes no LLM calls and has no side effects, which is what lets the refinement
 * loop terminate no matter how the generative steps behave. All rules run and
 * every violation is reported; only an absent plan short-circuits.
 */
@Component
public class PlanValidator {

    static final int MIN_ASSUMPTIONS = 3;
    static final int MIN_TIMELINE = 4;
    static final int MIN_GRANULAR_TIMELINE = 7;
    static final int MIN_WORKSTREAMS = 4;
    static final int MIN_RISKS = 4;
    static final int MIN_METRICS = 3;

    /** Task words that call for a day- or week-level timeline (substring match). */
    static final List<String> GRANULAR_SCHEDULE_TOKENS = List.of("day", "week", "itinerary");

    /**
     * @param plan the plan to check, may be {@code null}
     * @param task the original task text, used for the granular-schedule rule
     * @return violation codes in rule order; empty when the plan is structurally valid
     */
    public List<String> validate(Plan plan, String task) {
        if (plan == null || plan.isBlank()) {
            return List.of(PLAN_MISSING);
        }

        List<String> violations = new ArrayList<>();

        if (sizeOf(plan.assumptions()) < MIN_ASSUMPTIONS) {
            violations.add(ASSUMPTIONS_MIN);
        }

        checkTimeline(plan.timeline(), violations);

        if (requiresGranularSchedule(task) && sizeOf(plan.timeline()) < MIN_GRANULAR_TIMELINE) {
            violations.add(TIMELINE_GRANULARITY_REQUIRED);
        }

        checkWorkstreams(plan.workstreams(), violations);
        checkRisks(plan.risks(), violations);

        if (sizeOf(plan.metrics()) < MIN_METRICS) {
            violations.add(METRICS_MIN);
        }

        return List.copyOf(violations);
    }

    /**
     * True when the lower-cased task mentions a day, week or itinerary.
     */
    public boolean requiresGranularSchedule(String task) {
        String lowered = task == null ? "" : task.toLowerCase(Locale.ROOT);
        return GRANULAR_SCHEDULE_TOKENS.stream().anyMatch(lowered::contains);
    }

    private void checkTimeline(List<Plan.Phase> timeline, List<String> violations) {
        if (sizeOf(timeline) < MIN_TIMELINE) {
            violations.add(TIMELINE_MIN);
            return;
        }
        for (int i = 0; i < timeline.size(); i++) {
            int position = i + 1;
            Plan.Phase phase = timeline.get(i);
            if (phase == null) {
                violations.add(phaseNotObject(position));
                continue;
            }
            if (isEmpty(phase.milestones())) {
                violations.add(phaseMilestonesMissing(position));
            }
            if (isEmpty(phase.deliverables())) {
                violations.add(phaseDeliverablesMissing(position));
            }
        }
    }

    private void checkWorkstreams(List<Plan.Workstream> workstreams, List<String> violations) {
        if (sizeOf(workstreams) < MIN_WORKSTREAMS) {
            violations.add(WORKSTREAMS_MIN);
            return;
        }
        Set<String> seen = new HashSet<>();
        boolean duplicate = false;
        for (int i = 0; i < workstreams.size(); i++) {
            int position = i + 1;
            Plan.Workstream workstream = workstreams.get(i);
            if (workstream == null) {
                violations.add(workstreamNotObject(position));
                continue;
            }
            if (isEmpty(workstream.tasks())) {
                violations.add(workstreamTasksMissing(position));
            }
            if (isBlank(workstream.owner())) {
                violations.add(workstreamOwnerMissing(position));
            }
            // empty list allowed, absent is not
            if (workstream.dependencies() == null) {
                violations.add(workstreamDependenciesMissing(position));
            }
            String name = normalize(workstream.name());
            if (!name.isEmpty() && !seen.add(name)) {
                duplicate = true;
            }
        }
        if (duplicate) {
            violations.add(WORKSTREAMS_UNIQUE);
        }
    }

    private void checkRisks(List<Plan.Risk> risks, List<String> violations) {
        if (sizeOf(risks) < MIN_RISKS) {
            violations.add(RISKS_MIN);
            return;
        }
        Set<String> seen = new HashSet<>();
        boolean duplicate = false;
        for (int i = 0; i < risks.size(); i++) {
            int position = i + 1;
            Plan.Risk risk = risks.get(i);
            if (risk == null) {
                violations.add(riskNotObject(position));
                continue;
            }
            String name = normalize(risk.risk());
            if (name.isEmpty()) {
                violations.add(riskNameMissing(position));
            } else if (!seen.add(name)) {
                duplicate = true;
            }
            if (isBlank(risk.impact())) {
                violations.add(riskImpactMissing(position));
            } else if (risk.impactLevel().isEmpty()) {
                violations.add(riskImpactInvalid(position));
            }
            if (isBlank(risk.mitigation())) {
                violations.add(riskMitigationMissing(position));
            }
        }
        if (duplicate) {
            violations.add(RISKS_UNIQUE);
        }
    }

    private static int sizeOf(Collection<?> values) {
        return values == null ? 0 : values.size();
    }

    private static boolean isEmpty(Collection<?> values) {
        return values == null || values.isEmpty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String normalize(String name) {
        return name == null ? "" : name.strip().toLowerCase(Locale.ROOT);
    }
}

package com.plansmith.core.planning;

import com.plansmith.core.llm.GenerationProvider;
import com.plansmith.core.llm.JsonSupport;
import com.plansmith.core.metrics.PlanningMetrics;
import com.plansmith.core.model.Plan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Requests a structured plan for a task and enforces its shape contract.
 * <p>
 * A reply is accepted only when it decodes to a JSON object holding every key in
 * {@link PlanDocuments#REQUIRED_KEYS}. Otherwise the request is repeated with a
 * reminder of the minimum sizes, and once retries run out the
 * {@linkplain Plan#skeleton(String) skeleton plan} is returned. Parse failures
 * never escape this class; provider failures do.
 */
@Service
public class PlanGenerator {

    private static final Logger log = LoggerFactory.getLogger(PlanGenerator.class);

    static final String SYSTEM_PROMPT = """
            You are the Planner Agent. Produce comprehensive, realistic project plans.
            Constraints:
            - 4-6 timeline phases or weekly buckets, each with 2-4 milestones and deliverables.
              If the task is about days, weeks or an itinerary, give one timeline entry per day
              (at least 7 entries).
            - 4-6 workstreams, e.g. Discovery/Research, Execution/Build, QA/Validation,
              Logistics/Operations, Comms/Marketing, Governance/Risk.
            - Each workstream: multiple tasks, an owner role, and explicit dependencies.
            - >=3 assumptions; >=4 distinct risks (with impact + mitigation); >=3 success metrics.
            Output VALID JSON ONLY.
            """;

    static final String PLAN_SHAPE = """
            {
              "objective": "string",
              "assumptions": ["string", "string", "..."],
              "timeline": [
                {
                  "phase": "string",
                  "milestones": ["string", "string"],
                  "deliverables": ["string", "string"]
                }
              ],
              "workstreams": [
                {
                  "name": "string",
                  "tasks": ["string", "string"],
                  "owner": "Role",
                  "dependencies": ["string", "string"]
                }
              ],
              "risks": [
                {
                  "risk": "string",
                  "impact": "low|medium|high",
                  "mitigation": "string"
                }
              ],
              "metrics": ["string", "string", "string"]
            }
            """;

    static final String REMINDER = """


            REMINDER: You MUST include >=4 timeline entries, >=4 risks, >=3 metrics, >=3 assumptions, \
            and >=4 workstreams with tasks/owner/dependencies. Output VALID JSON ONLY.""";

    private final GenerationProvider generationProvider;
    private final PlanningProperties properties;
    private final PlanningMetrics metrics;

    public PlanGenerator(GenerationProvider generationProvider,
                         PlanningProperties properties,
                         PlanningMetrics metrics) {
        this.generationProvider = generationProvider;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Retries are capped by both the configured planner retries and {@code retryBudget}, so
     * a run with a refinement ceiling of {@code m} spends at most {@code 1 + min(retries, m)}
     * calls here.
     *
     * @param task        the free-text task description
     * @param retryBudget the most retries this run may spend on the first draft
     * @return a plan decoded from the model, or the skeleton plan when no reply satisfied the contract
     */
    public Plan generate(String task, int retryBudget) {
        String userPrompt = buildUserPrompt(task);
        int retries = Math.max(0, Math.min(properties.getPlannerRetries(), retryBudget));
        int totalCalls = 1 + retries;

        for (int call = 1; call <= totalCalls; call++) {
            String prompt = call == 1 ? userPrompt : userPrompt + REMINDER;
            String reply = generationProvider.invoke(SYSTEM_PROMPT, prompt);
            Optional<Plan> plan = JsonSupport.extractObject(reply)
                    .filter(PlanDocuments::hasRequiredKeys)
                    .map(PlanDocuments::fromJson);
            if (plan.isPresent()) {
                log.info("Planner reply accepted on call {}/{}", call, totalCalls);
                return plan.get();
            }
            log.warn("Planner reply {}/{} unparsable or missing required keys {}",
                    call, totalCalls, PlanDocuments.REQUIRED_KEYS);
        }

        log.warn("Planner gave no usable plan after {} calls, using skeleton plan", totalCalls);
        metrics.recordPlanFallback();
        return Plan.skeleton(task);
    }

    static String buildUserPrompt(String task) {
        return "TASK: " + task + "\n\nReturn JSON exactly in this shape:\n\n" + PLAN_SHAPE;
    }
}

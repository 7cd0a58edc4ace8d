package com.plansmith.core.planning;

import com.plansmith.core.llm.GenerationProvider;
import com.plansmith.core.llm.JsonSupport;
import com.plansmith.core.model.Plan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Asks the model to repair the exact violations found in a plan.
 * <p>
 * Any decodable JSON object replaces the plan. An undecodable reply returns the
 * input plan itself, since a prior plan may already satisfy most of the schema.
 */
@Service
public class PlanRefiner {

    private static final Logger log = LoggerFactory.getLogger(PlanRefiner.class);

    static final String SYSTEM_PROMPT = """
            You are the Reviewer Agent. You receive a project plan in JSON format
            and a list of violation codes naming missing or weak elements. Your job is to
            repair exactly those deficiencies so that the plan is complete, detailed,
            realistic, and implementable.
            Do not delete good content. Instead, expand, enrich, and ground it in real-world best practices.
            If the task involves a timeline (days/weeks/itinerary), ensure a day-by-day breakdown.
            Risks should be varied and realistic, with clear mitigations.
            Workstreams must be distinct and balanced.
            Always return valid JSON only.
            """;

    static final String CONSTRAINTS = """
            CONSTRAINTS (must all be satisfied):
            - >=3 assumptions
            - >=4 timeline phases, each with milestones[] and deliverables[]; \
            if the task mentions days/weeks/itinerary, expand into at least 7 daily entries
            - >=4 workstreams; each must have tasks[], owner, dependencies[], and a unique name
            - >=4 distinct risks, each with impact (low|medium|high) and mitigation
            - >=3 metrics
            Return only the corrected JSON (no commentary).
            """;

    private final GenerationProvider generationProvider;

    public PlanRefiner(GenerationProvider generationProvider) {
        this.generationProvider = generationProvider;
    }

    /**
     * @param plan       the current plan
     * @param task       the original task text
     * @param violations violation codes reported for {@code plan}
     * @return the repaired plan, or {@code plan} itself when the reply could not be decoded
     */
    public Plan refine(Plan plan, String task, List<String> violations) {
        String reply = generationProvider.invoke(SYSTEM_PROMPT, buildUserPrompt(plan, task, violations));
        return JsonSupport.extractObject(reply)
                .map(PlanDocuments::fromJson)
                .orElseGet(() -> {
                    log.warn("Refiner reply could not be decoded, keeping the previous plan");
                    return plan;
                });
    }

    static String buildUserPrompt(Plan plan, String task, List<String> violations) {
        return "TASK: " + task + "\n\n"
                + "PROBLEMS:\n" + violations + "\n\n"
                + "CURRENT PLAN:\n" + JsonSupport.toJson(plan) + "\n\n"
                + CONSTRAINTS;
    }
}

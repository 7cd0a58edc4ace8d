package com.plansmith.core.planning;

import com.plansmith.core.model.Plan;
import com.plansmith.support.PlanFixtures;
import com.plansmith.support.ScriptedGenerationProvider;
import com.plansmith.support.ScriptedGenerationProvider.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanRefinerTest {

    private static final String TASK = "Plan a 2-week hackathon";

    private final ScriptedGenerationProvider llm = new ScriptedGenerationProvider();
    private final PlanRefiner refiner = new PlanRefiner(llm);

    @Test
    @DisplayName("Prompt carries task, violation codes, current plan and constraints")
    void promptContents() {
        llm.script(Role.REVIEWER, PlanFixtures.validPlanJson());
        Plan current = PlanFixtures.validPlan(2, 3);

        refiner.refine(current, TASK, List.of("timeline_min", "workstreams_min"));

        String prompt = llm.calls().get(0).userInstruction();
        assertTrue(prompt.startsWith("TASK: " + TASK));
        assertTrue(prompt.contains("PROBLEMS:\n[timeline_min, workstreams_min]"));
        assertTrue(prompt.contains("\"workstreams\""));
        assertTrue(prompt.contains("CONSTRAINTS (must all be satisfied)"));
    }

    @Test
    @DisplayName("Decodable reply replaces the plan")
    void replacesPlan() {
        llm.script(Role.REVIEWER, PlanFixtures.validPlanJson());

        Plan refined = refiner.refine(PlanFixtures.validPlan(2, 3), TASK, List.of("timeline_min"));

        assertEquals(PlanFixtures.validPlan(), refined);
    }

    @Test
    @DisplayName("Undecodable reply returns the same plan instance")
    void passThrough() {
        llm.script(Role.REVIEWER, "I fixed it, trust me.");
        Plan current = PlanFixtures.validPlan(2, 3);

        assertSame(current, refiner.refine(current, TASK, List.of("timeline_min")));
    }

    @Test
    @DisplayName("Partial object is accepted and left to validation")
    void partialObject() {
        llm.script(Role.REVIEWER, "{\"objective\": \"only this\"}");

        Plan refined = refiner.refine(PlanFixtures.validPlan(), TASK, List.of("metrics_min"));

        assertEquals("only this", refined.objective());
        assertNull(refined.metrics());
    }
}

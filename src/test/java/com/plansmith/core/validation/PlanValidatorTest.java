package com.plansmith.core.validation;

import com.plansmith.core.model.Plan;
import com.plansmith.support.PlanFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanValidatorTest {

    private static final String TASK = "Launch an internal developer portal";

    private final PlanValidator validator = new PlanValidator();

    @Test
    @DisplayName("Well-formed plan has no violations")
    void validPlanPasses() {
        assertEquals(List.of(), validator.validate(PlanFixtures.validPlan(), TASK));
    }

    @Test
    @DisplayName("Absent or blank plan reports only plan_missing")
    void missingPlan() {
        assertEquals(List.of(PlanViolations.PLAN_MISSING), validator.validate(null, TASK));
        var blank = new Plan(null, null, null, null, null, null);
        assertEquals(List.of(PlanViolations.PLAN_MISSING), validator.validate(blank, TASK));
    }

    @Test
    @DisplayName("Validation is idempotent")
    void idempotent() {
        var plan = new Plan("x", List.of("a"), PlanFixtures.phases(2),
                PlanFixtures.workstreams(4), PlanFixtures.risks(1), List.of());
        assertEquals(validator.validate(plan, "a 3-day trip"), validator.validate(plan, "a 3-day trip"));
    }

    @Test
    @DisplayName("Skeleton plan reports every minimum-size rule")
    void skeletonPlan() {
        List<String> violations = validator.validate(Plan.skeleton(TASK), TASK);
        assertEquals(List.of(
                PlanViolations.TIMELINE_MIN,
                PlanViolations.WORKSTREAMS_MIN,
                PlanViolations.RISKS_MIN,
                PlanViolations.METRICS_MIN), violations);
    }

    @Test
    @DisplayName("Fewer than three assumptions is reported")
    void assumptionsMin() {
        var base = PlanFixtures.validPlan();
        var plan = new Plan(base.objective(), List.of("only", "two"), base.timeline(),
                base.workstreams(), base.risks(), base.metrics());
        assertEquals(List.of(PlanViolations.ASSUMPTIONS_MIN), validator.validate(plan, TASK));
    }

    @Nested
    @DisplayName("Timeline rules")
    class TimelineRules {

        @Test
        @DisplayName("Granular task with 5 daily entries needs at least 7")
        void granularityRequired() {
            var plan = PlanFixtures.validPlan(5, 4);
            List<String> violations = validator.validate(plan, "Plan a 7-day itinerary for Japan");
            assertEquals(List.of(PlanViolations.TIMELINE_GRANULARITY_REQUIRED), violations);
        }

        @Test
        @DisplayName("Granular task with 7 daily entries passes")
        void granularitySatisfied() {
            var plan = PlanFixtures.validPlan(7, 4);
            assertTrue(validator.validate(plan, "Plan a 7-day itinerary for Japan").isEmpty());
        }

        @Test
        @DisplayName("Short timeline on a granular task reports both timeline codes")
        void shortTimelineOnGranularTask() {
            var plan = PlanFixtures.validPlan(2, 4);
            List<String> violations = validator.validate(plan, "Plan a 2-week hackathon");
            assertEquals(List.of(PlanViolations.TIMELINE_MIN, PlanViolations.TIMELINE_GRANULARITY_REQUIRED),
                    violations);
        }

        @Test
        @DisplayName("Granularity tokens match as lower-case substrings")
        void granularTokens() {
            assertTrue(validator.requiresGranularSchedule("Two WEEKS in Portugal"));
            assertTrue(validator.requiresGranularSchedule("Weekday standup rollout"));
            assertTrue(validator.requiresGranularSchedule("Itinerary for a conference"));
            assertFalse(validator.requiresGranularSchedule("Migrate the billing service"));
            assertFalse(validator.requiresGranularSchedule(null));
        }

        @Test
        @DisplayName("Phases missing milestones or deliverables are reported by position")
        void phaseFields() {
            var timeline = new ArrayList<>(PlanFixtures.phases(4));
            timeline.set(1, new Plan.Phase("Day 2", List.of(), List.of("d")));
            timeline.set(3, new Plan.Phase("Day 4", List.of("m"), null));
            var base = PlanFixtures.validPlan();
            var plan = new Plan(base.objective(), base.assumptions(), timeline,
                    base.workstreams(), base.risks(), base.metrics());

            assertEquals(List.of("timeline_phase_2_milestones_missing", "timeline_phase_4_deliverables_missing"),
                    validator.validate(plan, TASK));
        }

        @Test
        @DisplayName("Non-object timeline entry is reported")
        void phaseNotObject() {
            var timeline = new ArrayList<>(PlanFixtures.phases(4));
            timeline.set(0, null);
            var base = PlanFixtures.validPlan();
            var plan = new Plan(base.objective(), base.assumptions(), timeline,
                    base.workstreams(), base.risks(), base.metrics());

            assertEquals(List.of("timeline_phase_1_not_object"), validator.validate(plan, TASK));
        }
    }

    @Nested
    @DisplayName("Workstream rules")
    class WorkstreamRules {

        @Test
        @DisplayName("Case and whitespace variants of a name give exactly one workstreams_unique")
        void duplicateNames() {
            var workstreams = new ArrayList<>(PlanFixtures.workstreams(4));
            workstreams.set(1, new Plan.Workstream(" research ", List.of("t"), "Lead", List.of()));
            workstreams.set(2, new Plan.Workstream("RESEARCH", List.of("t"), "Lead", List.of()));
            var plan = withWorkstreams(workstreams);

            List<String> violations = validator.validate(plan, TASK);
            assertEquals(List.of(PlanViolations.WORKSTREAMS_UNIQUE), violations);
        }

        @Test
        @DisplayName("Missing tasks, owner and dependencies are reported per workstream")
        void missingFields() {
            var workstreams = new ArrayList<>(PlanFixtures.workstreams(4));
            workstreams.set(0, new Plan.Workstream("Research", List.of(), " ", null));
            var plan = withWorkstreams(workstreams);

            assertEquals(List.of(
                    "workstream_1_tasks_missing",
                    "workstream_1_owner_missing",
                    "workstream_1_dependencies_missing"), validator.validate(plan, TASK));
        }

        @Test
        @DisplayName("Empty dependency list is accepted")
        void emptyDependencies() {
            var workstreams = new ArrayList<>(PlanFixtures.workstreams(4));
            workstreams.replaceAll(w -> new Plan.Workstream(w.name(), w.tasks(), w.owner(), List.of()));
            assertTrue(validator.validate(withWorkstreams(workstreams), TASK).isEmpty());
        }

        @Test
        @DisplayName("Three workstreams reports workstreams_min and skips per-entry checks")
        void tooFew() {
            var workstreams = List.of(
                    new Plan.Workstream("A", List.of(), null, null),
                    new Plan.Workstream("B", List.of("t"), "o", List.of()),
                    new Plan.Workstream("C", List.of("t"), "o", List.of()));
            assertEquals(List.of(PlanViolations.WORKSTREAMS_MIN), validator.validate(withWorkstreams(workstreams), TASK));
        }

        @Test
        @DisplayName("Non-object workstream entry is reported")
        void notObject() {
            var workstreams = new ArrayList<>(PlanFixtures.workstreams(4));
            workstreams.set(2, null);
            assertEquals(List.of("workstream_3_not_object"), validator.validate(withWorkstreams(workstreams), TASK));
        }

        private Plan withWorkstreams(List<Plan.Workstream> workstreams) {
            var base = PlanFixtures.validPlan();
            return new Plan(base.objective(), base.assumptions(), base.timeline(),
                    workstreams, base.risks(), base.metrics());
        }
    }

    @Nested
    @DisplayName("Risk rules")
    class RiskRules {

        @Test
        @DisplayName("Duplicate risk names give one risks_unique")
        void duplicates() {
            var risks = Arrays.asList(
                    new Plan.Risk("Weather", "high", "Indoor backup"),
                    new Plan.Risk("weather ", "low", "Tents"),
                    new Plan.Risk("WEATHER", "medium", "Reschedule"),
                    new Plan.Risk("Budget", "medium", "Reserve"));
            assertEquals(List.of(PlanViolations.RISKS_UNIQUE), validator.validate(withRisks(risks), TASK));
        }

        @Test
        @DisplayName("Missing and invalid impact are distinguished")
        void impact() {
            var risks = Arrays.asList(
                    new Plan.Risk("A", null, "m"),
                    new Plan.Risk("B", "critical", "m"),
                    new Plan.Risk("C", "HIGH", "m"),
                    new Plan.Risk("D", "Low", ""));
            assertEquals(List.of(
                    "risk_1_impact_missing",
                    "risk_2_impact_invalid",
                    "risk_4_mitigation_missing"), validator.validate(withRisks(risks), TASK));
        }

        @Test
        @DisplayName("Blank risk names are reported but not counted as duplicates")
        void blankNames() {
            var risks = Arrays.asList(
                    new Plan.Risk("", "low", "m"),
                    new Plan.Risk(" ", "low", "m"),
                    new Plan.Risk("C", "low", "m"),
                    null);
            assertEquals(List.of(
                    "risk_1_name_missing",
                    "risk_2_name_missing",
                    "risk_4_not_object"), validator.validate(withRisks(risks), TASK));
        }

        private Plan withRisks(List<Plan.Risk> risks) {
            var base = PlanFixtures.validPlan();
            return new Plan(base.objective(), base.assumptions(), base.timeline(),
                    base.workstreams(), risks, base.metrics());
        }
    }

    @Test
    @DisplayName("All failing rules are reported together in rule order")
    void reportsEverything() {
        var plan = new Plan("x", List.of(), List.of(), List.of(), List.of(), List.of("one"));
        assertEquals(List.of(
                PlanViolations.ASSUMPTIONS_MIN,
                PlanViolations.TIMELINE_MIN,
                PlanViolations.TIMELINE_GRANULARITY_REQUIRED,
                PlanViolations.WORKSTREAMS_MIN,
                PlanViolations.RISKS_MIN,
                PlanViolations.METRICS_MIN), validator.validate(plan, "A one-week sprint"));
    }
}

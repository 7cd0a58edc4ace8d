package com.plansmith.core.validation;

/**
 * Stable violation codes reported by {@link PlanValidator}.
 * <p>
 * Codes are matched verbatim by the refiner prompt and by tests, so they must not
 * change. Per-entity codes carry the 1-based position of the offending entry.
 */
public final class PlanViolations {

    private PlanViolations() {
        // constants
    }

    public static final String PLAN_MISSING = "plan_missing";
    public static final String ASSUMPTIONS_MIN = "assumptions_min";
    public static final String TIMELINE_MIN = "timeline_min";
    public static final String TIMELINE_GRANULARITY_REQUIRED = "timeline_granularity_required";
    public static final String WORKSTREAMS_MIN = "workstreams_min";
    public static final String WORKSTREAMS_UNIQUE = "workstreams_unique";
    public static final String RISKS_MIN = "risks_min";
    public static final String RISKS_UNIQUE = "risks_unique";
    public static final String METRICS_MIN = "metrics_min";

    // ── Timeline ─────────────────────────────────────────────────────

    public static String phaseNotObject(int position) {
        return "timeline_phase_" + position + "_not_object";
    }

    public static String phaseMilestonesMissing(int position) {
        return "timeline_phase_" + position + "_milestones_missing";
    }

    public static String phaseDeliverablesMissing(int position) {
        return "timeline_phase_" + position + "_deliverables_missing";
    }

    // ── Workstreams ──────────────────────────────────────────────────

    public static String workstreamNotObject(int position) {
        return "workstream_" + position + "_not_object";
    }

    public static String workstreamTasksMissing(int position) {
        return "workstream_" + position + "_tasks_missing";
    }

    public static String workstreamOwnerMissing(int position) {
        return "workstream_" + position + "_owner_missing";
    }

    public static String workstreamDependenciesMissing(int position) {
        return "workstream_" + position + "_dependencies_missing";
    }

    // ── Risks ────────────────────────────────────────────────────────

    public static String riskNotObject(int position) {
        return "risk_" + position + "_not_object";
    }

    public static String riskNameMissing(int position) {
        return "risk_" + position + "_name_missing";
    }

    public static String riskImpactMissing(int position) {
        return "risk_" + position + "_impact_missing";
    }

    public static String riskImpactInvalid(int position) {
        return "risk_" + position + "_impact_invalid";
    }

    public static String riskMitigationMissing(int position) {
        return "risk_" + position + "_mitigation_missing";
    }
}

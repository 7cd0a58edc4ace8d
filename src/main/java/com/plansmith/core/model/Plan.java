package com.plansmith.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Structured project plan produced by the planner and repaired by the refiner.
 * <p>
 * Generated documents are untrusted, so every field may be {@code null} when the
 * source document omitted it or gave it the wrong JSON kind, and the entity lists
 * may hold {@code null} entries where the source had a non-object element.
 * {@link com.plansmith.core.validation.PlanValidator} reports all of these.
 */
public record Plan(
    String objective,
    List<String> assumptions,
    List<Phase> timeline,
    List<Workstream> workstreams,
    List<Risk> risks,
    List<String> metrics
) implements Serializable {

    private static final List<String> TBD = List.of("TBD", "TBD", "TBD");

    /**
     * Minimal well-typed plan used when the planner never returned a usable document.
     */
    public static Plan skeleton(String task) {
        return new Plan(task, TBD, List.of(), List.of(), List.of(), List.of());
    }

    /** True when none of the six fields was supplied. */
    @JsonIgnore
    public boolean isBlank() {
        return objective == null && assumptions == null && timeline == null
                && workstreams == null && risks == null && metrics == null;
    }

    /**
     * One timeline entry: a phase, week or day bucket.
     */
    public record Phase(
        @JsonProperty("phase") String label,
        List<String> milestones,
        List<String> deliverables
    ) implements Serializable {}

    public record Workstream(
        String name,
        List<String> tasks,
        String owner,
        List<String> dependencies
    ) implements Serializable {}

    /**
     * A risk with its impact rating kept as received; see {@link #impactLevel()}.
     */
    public record Risk(
        String risk,
        String impact,
        String mitigation
    ) implements Serializable {

        public Optional<Impact> impactLevel() {
            return Impact.parse(impact);
        }
    }
}

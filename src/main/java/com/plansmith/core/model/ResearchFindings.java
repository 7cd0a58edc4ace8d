package com.plansmith.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Research synthesized from web sources for the finalized plan.
 * Citation numbers refer to the 1-based position of a source in the run's source list.
 */
public record ResearchFindings(
    List<Resource> resources,
    List<Estimate> estimates,
    @JsonProperty("validation_checklists") List<Checklist> validationChecklists,
    @JsonProperty("open_questions") List<String> openQuestions,
    @JsonProperty("used_sources") List<Integer> usedSources
) implements Serializable {

    public ResearchFindings {
        resources = nonNull(resources);
        estimates = nonNull(estimates);
        validationChecklists = nonNull(validationChecklists);
        openQuestions = nonNull(openQuestions);
        usedSources = nonNull(usedSources);
    }

    public static ResearchFindings empty() {
        return new ResearchFindings(List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public record Resource(
        String workstream,
        List<String> tools,
        List<String> templates,
        List<Integer> citations
    ) implements Serializable {
        public Resource {
            tools = nonNull(tools);
            templates = nonNull(templates);
            citations = nonNull(citations);
        }
    }

    public record Estimate(
        String workstream,
        String effort,
        String notes,
        List<Integer> citations
    ) implements Serializable {
        public Estimate {
            citations = nonNull(citations);
        }
    }

    public record Checklist(
        String workstream,
        List<String> checklist,
        List<Integer> citations
    ) implements Serializable {
        public Checklist {
            checklist = nonNull(checklist);
            citations = nonNull(citations);
        }
    }

    private static <T> List<T> nonNull(List<T> values) {
        if (values == null) return List.of();
        return values.stream().filter(Objects::nonNull).toList();
    }
}

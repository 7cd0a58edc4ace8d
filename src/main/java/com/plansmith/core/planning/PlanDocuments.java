package com.plansmith.core.planning;

import com.fasterxml.jackson.databind.JsonNode;
import com.plansmith.core.model.Plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Converts decoded plan documents into {@link Plan} records.
 * <p>
 * The conversion never rejects a document. Fields of the wrong JSON kind become
 * {@code null} and non-object list entries become {@code null} elements, leaving
 * the judgement to {@link com.plansmith.core.validation.PlanValidator}.
 */
public final class PlanDocuments {

    /** Keys the planner reply must contain before it is accepted. */
    public static final List<String> REQUIRED_KEYS =
            List.of("timeline", "workstreams", "risks", "metrics", "assumptions");

    private PlanDocuments() {
        // utility class
    }

    public static boolean hasRequiredKeys(JsonNode document) {
        return REQUIRED_KEYS.stream().allMatch(document::has);
    }

    /**
     * @param document a decoded JSON object
     * @return the plan view of the document
     */
    public static Plan fromJson(JsonNode document) {
        return new Plan(
                text(document.get("objective")),
                textList(document.get("assumptions")),
                objectList(document.get("timeline"), PlanDocuments::phaseFromJson),
                objectList(document.get("workstreams"), PlanDocuments::workstreamFromJson),
                objectList(document.get("risks"), PlanDocuments::riskFromJson),
                textList(document.get("metrics"))
        );
    }

    private static Plan.Phase phaseFromJson(JsonNode node) {
        String label = text(node.get("phase"));
        if (label == null) label = text(node.get("label"));
        if (label == null) label = text(node.get("name"));
        return new Plan.Phase(label, textList(node.get("milestones")), textList(node.get("deliverables")));
    }

    private static Plan.Workstream workstreamFromJson(JsonNode node) {
        return new Plan.Workstream(
                text(node.get("name")),
                textList(node.get("tasks")),
                text(node.get("owner")),
                textList(node.get("dependencies")));
    }

    private static Plan.Risk riskFromJson(JsonNode node) {
        return new Plan.Risk(
                text(node.get("risk")),
                text(node.get("impact")),
                text(node.get("mitigation")));
    }

    // ── Lenient readers ──────────────────────────────────────────────

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) return null;
        return node.asText();
    }

    /** Scalars as text, nested structures as compact JSON, JSON nulls dropped. */
    private static List<String> textList(JsonNode node) {
        if (node == null || !node.isArray()) return null;
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isNull()) continue;
            values.add(element.isContainerNode() ? element.toString() : element.asText());
        }
        return Collections.unmodifiableList(values);
    }

    private static <T> List<T> objectList(JsonNode node, Function<JsonNode, T> mapper) {
        if (node == null || !node.isArray()) return null;
        List<T> values = new ArrayList<>();
        for (JsonNode element : node) {
            values.add(element.isObject() ? mapper.apply(element) : null);
        }
        return Collections.unmodifiableList(values);
    }
}

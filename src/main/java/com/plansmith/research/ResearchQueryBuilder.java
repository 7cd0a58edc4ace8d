package com.plansmith.research;

import com.plansmith.core.model.Plan;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Derives web search queries from the task and the finalized plan.
 */
public final class ResearchQueryBuilder {

    private static final int WORKSTREAM_QUERIES = 2;

    private ResearchQueryBuilder() {
        // utility class
    }

    /**
     * Three task-level queries, then one per named workstream among the first two,
     * de-duplicated in order and capped at {@code limit}.
     */
    public static List<String> build(String task, Plan plan, int limit) {
        Set<String> queries = new LinkedHashSet<>();
        queries.add(task + " best practices");
        queries.add(task + " logistics checklist");
        queries.add(task + " risk management");

        List<Plan.Workstream> workstreams = plan != null && plan.workstreams() != null
                ? plan.workstreams() : List.of();
        workstreams.stream()
                .limit(WORKSTREAM_QUERIES)
                .filter(ws -> ws != null && ws.name() != null && !ws.name().isBlank())
                .forEach(ws -> queries.add(task + " " + ws.name().toLowerCase(Locale.ROOT) + " tools and templates"));

        return List.copyOf(new ArrayList<>(queries).subList(0, Math.max(0, Math.min(limit, queries.size()))));
    }
}

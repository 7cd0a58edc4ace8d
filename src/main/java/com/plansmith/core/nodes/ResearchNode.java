package com.plansmith.core.nodes;

import com.plansmith.core.llm.GenerationProvider;
import com.plansmith.core.llm.JsonSupport;
import com.plansmith.core.model.PipelineStatus;
import com.plansmith.core.model.Plan;
import com.plansmith.core.model.ResearchFindings;
import com.plansmith.core.state.PlanningState;
import com.plansmith.research.ResearchProperties;
import com.plansmith.research.ResearchQueryBuilder;
import com.plansmith.research.SearchProvider;
import com.plansmith.research.SearchResult;
import com.plansmith.research.SourceSummarizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Gathers web sources for the finalized plan, summarizes each one and asks the LLM
 * to synthesize resources, estimates, checklists and open questions grounded in the
 * summaries.
 * <p>
 * Skipped (empty findings, no sources) when web research is disabled for the run.
 * An undecodable synthesis reply falls back to {@link ResearchFindings#empty()};
 * search provider failures propagate.
 */
@Component
public class ResearchNode {

    private static final Logger log = LoggerFactory.getLogger(ResearchNode.class);

    static final String SYSTEM_PROMPT = """
            You are the Web Research Agent. Given a planning task and sources (with URLs),
            synthesize findings into structured JSON: resources/tools, estimates, validation checklists,
            and 5-7 open questions. Only use information supported by the provided sources.
            Return VALID JSON ONLY. Include citations by listing the numeric source IDs you used.
            """;

    static final String RESEARCH_SHAPE = """
            {
              "resources": [{"workstream": "string", "tools": ["..."], "templates": ["..."], "citations": [1,2]}],
              "estimates": [{"workstream": "string", "effort": "S|M|L", "notes": "string", "citations": [3]}],
              "validation_checklists": [{"workstream": "string", "checklist": ["..."], "citations": [1,4]}],
              "open_questions": ["...", "..."],
              "used_sources": [1,2,3]
            }
            """;

    private final SearchProvider searchProvider;
    private final SourceSummarizer sourceSummarizer;
    private final GenerationProvider generationProvider;
    private final ResearchProperties properties;

    public ResearchNode(SearchProvider searchProvider,
                        SourceSummarizer sourceSummarizer,
                        GenerationProvider generationProvider,
                        ResearchProperties properties) {
        this.searchProvider = searchProvider;
        this.sourceSummarizer = sourceSummarizer;
        this.generationProvider = generationProvider;
        this.properties = properties;
    }

    public Map<String, Object> apply(PlanningState state) {
        if (!state.useWebResearch()) {
            log.info("Web research disabled for this run");
            return Map.of(
                    "research", ResearchFindings.empty(),
                    "webSources", List.of(),
                    "status", PipelineStatus.REPORTING.name(),
                    "logs", List.of("Researcher: web research disabled, skipping."));
        }

        String task = state.task();
        Plan plan = state.plan().orElse(null);
        List<String> queries = ResearchQueryBuilder.build(task, plan, properties.getMaxQueries());
        log.info("Running {} research queries", queries.size());

        List<SearchResult> collected = new ArrayList<>();
        for (String query : queries) {
            collected.addAll(searchProvider.search(query, properties.getResultsPerQuery()));
        }
        List<SearchResult> sources = collected.stream()
                .filter(SearchResult::hasText)
                .limit(properties.getMaxSources())
                .toList();
        log.info("Kept {} of {} search results with extracted text", sources.size(), collected.size());

        List<String> summaries = sources.stream().map(sourceSummarizer::summarize).toList();

        String reply = generationProvider.invoke(SYSTEM_PROMPT, buildUserPrompt(task, plan, sources, summaries));
        ResearchFindings findings = JsonSupport.extractObject(reply)
                .flatMap(node -> JsonSupport.convert(node, ResearchFindings.class))
                .orElseGet(() -> {
                    log.warn("Research synthesis reply could not be decoded, using empty findings");
                    return ResearchFindings.empty();
                });

        return Map.of(
                "research", findings,
                "webSources", sources,
                "status", PipelineStatus.REPORTING.name(),
                "logs", List.of(String.format(
                        "Researcher: synthesized findings from %d source(s) across %d queries.",
                        sources.size(), queries.size())));
    }

    static String buildUserPrompt(String task, Plan plan, List<SearchResult> sources, List<String> summaries) {
        var context = new StringBuilder();
        for (int i = 0; i < sources.size(); i++) {
            SearchResult source = sources.get(i);
            if (i > 0) context.append("\n\n");
            context.append('[').append(i + 1).append("] TITLE: ").append(source.title()).append('\n')
                    .append("URL: ").append(source.url()).append('\n')
                    .append("SUMMARY:\n").append(summaries.get(i)).append('\n');
        }
        return "TASK: " + task + "\n\n"
                + "PLAN (JSON):\n" + JsonSupport.toJson(plan) + "\n\n"
                + "SOURCES:\n" + context + "\n\n"
                + "Return JSON with this exact shape:\n" + RESEARCH_SHAPE
                + "Only JSON. No extra commentary.";
    }
}

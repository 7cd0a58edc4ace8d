package com.plansmith.core.nodes;

import com.plansmith.core.llm.GenerationProvider;
import com.plansmith.core.llm.JsonSupport;
import com.plansmith.core.model.PipelineStatus;
import com.plansmith.core.model.ResearchFindings;
import com.plansmith.core.state.PlanningState;
import com.plansmith.research.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Final node: merges plan and research into an executive Markdown report with citations.
 */
@Component
public class ReportNode {

    private static final Logger log = LoggerFactory.getLogger(ReportNode.class);

    static final String DEFAULT_HEADING = "# Project Plan\n\n";

    static final String SYSTEM_PROMPT = """
            You are the Reporter Agent. Merge the plan and research into a polished, executive-ready Markdown report.
            Include sections: Overview, Assumptions, Timeline (table), Workstreams, Risks & Mitigations,
            Resources & Tools, Estimates, Validation Checklists, Open Questions, Next Steps,
            and a Sources section with citations.
            Do not invent facts; when unsure, keep it generic.
            """;

    private final GenerationProvider generationProvider;

    public ReportNode(GenerationProvider generationProvider) {
        this.generationProvider = generationProvider;
    }

    public Map<String, Object> apply(PlanningState state) {
        log.info("Compiling final report");
        String sources = citations(state.webSources());
        String userPrompt = "PLAN:\n" + JsonSupport.toJson(state.plan().orElse(null)) + "\n\n"
                + "RESEARCH:\n" + JsonSupport.toJson(state.research().orElse(ResearchFindings.empty())) + "\n\n"
                + "SOURCES (append at end as a list with [n] labels):\n" + sources + "\n";

        String markdown = generationProvider.invoke(SYSTEM_PROMPT, userPrompt).strip();
        if (!markdown.startsWith("#")) {
            markdown = DEFAULT_HEADING + markdown;
        }

        return Map.of(
                "reportMarkdown", markdown,
                "status", PipelineStatus.COMPLETED.name(),
                "logs", List.of(
                        "Reporter: compiling final report with citations (Markdown).",
                        "Reporter: report assembled."));
    }

    /**
     * Numbered source list, empty when there are no sources.
     */
    static String citations(List<SearchResult> sources) {
        if (sources.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder("\n\n**Sources**\n");
        for (int i = 0; i < sources.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append('[').append(i + 1).append("] ").append(sources.get(i).title())
                    .append(" - ").append(sources.get(i).url());
        }
        return sb.toString();
    }
}

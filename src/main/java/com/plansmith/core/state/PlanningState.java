package com.plansmith.core.state;

import com.plansmith.core.model.PipelineStatus;
import com.plansmith.core.model.Plan;
import com.plansmith.core.model.RefinementPhase;
import com.plansmith.core.model.ResearchFindings;
import com.plansmith.research.SearchResult;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one planning pipeline run.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. The refinement
 * loop fields ({@code task}, {@code plan}, {@code attemptCount}, {@code maxAttempts},
 * {@code validated}, {@code violationLog}) are written only by the loop's nodes;
 * {@code maxAttempts} and {@code maxSteps} are fixed by the initial input. The two
 * log fields use appender channels so each node adds lines without replacing earlier ones.
 */
public class PlanningState extends AgentState {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_MAX_STEPS = 20;

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Scalar channels ──────────────────────────────────────────
        Map.entry("runId",            Channels.base(() -> "")),
        Map.entry("task",             Channels.base(() -> "")),
        Map.entry("plan",             Channels.base((Reducer<Plan>) null)),
        Map.entry("attemptCount",     Channels.base(() -> 0)),
        Map.entry("maxAttempts",      Channels.base(() -> DEFAULT_MAX_ATTEMPTS)),
        Map.entry("validated",        Channels.base(() -> false)),
        Map.entry("refinementPhase",  Channels.base(() -> RefinementPhase.GENERATING.name())),
        Map.entry("status",           Channels.base(() -> PipelineStatus.PLANNING.name())),
        Map.entry("violations",       Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("stepCount",        Channels.base(() -> 0)),
        Map.entry("maxSteps",         Channels.base(() -> DEFAULT_MAX_STEPS)),
        Map.entry("useWebResearch",   Channels.base(() -> true)),
        Map.entry("research",         Channels.base((Reducer<ResearchFindings>) null)),
        Map.entry("webSources",       Channels.base((Supplier<List<SearchResult>>) List::of)),
        Map.entry("reportMarkdown",   Channels.base(() -> "")),

        // ── Appender channels (list accumulation) ────────────────────
        Map.entry("violationLog",     Channels.appender(ArrayList::new)),
        Map.entry("logs",             Channels.appender(ArrayList::new))
    );

    public PlanningState(Map<String, Object> initData) {
        super(initData);
    }

    // ── Refinement loop accessors ────────────────────────────────────

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public String task() {
        return this.<String>value("task").orElse("");
    }

    public Optional<Plan> plan() {
        return this.value("plan");
    }

    public int attemptCount() {
        return this.<Integer>value("attemptCount").orElse(0);
    }

    public int maxAttempts() {
        return this.<Integer>value("maxAttempts").orElse(DEFAULT_MAX_ATTEMPTS);
    }

    public boolean validated() {
        return this.<Boolean>value("validated").orElse(false);
    }

    public RefinementPhase refinementPhase() {
        String raw = this.<String>value("refinementPhase").orElse(RefinementPhase.GENERATING.name());
        return RefinementPhase.valueOf(raw);
    }

    /** Violation codes from the most recent validation. */
    public List<String> violations() {
        return this.<List<String>>value("violations").orElse(List.of());
    }

    /** One line per validation, in order. */
    public List<String> violationLog() {
        return this.<List<String>>value("violationLog").orElse(List.of());
    }

    // ── Pipeline accessors ───────────────────────────────────────────

    public PipelineStatus status() {
        String raw = this.<String>value("status").orElse(PipelineStatus.PLANNING.name());
        return PipelineStatus.valueOf(raw);
    }

    public int stepCount() {
        return this.<Integer>value("stepCount").orElse(0);
    }

    public int maxSteps() {
        return this.<Integer>value("maxSteps").orElse(DEFAULT_MAX_STEPS);
    }

    public boolean useWebResearch() {
        return this.<Boolean>value("useWebResearch").orElse(true);
    }

    public Optional<ResearchFindings> research() {
        return this.value("research");
    }

    public List<SearchResult> webSources() {
        return this.<List<SearchResult>>value("webSources").orElse(List.of());
    }

    public String reportMarkdown() {
        return this.<String>value("reportMarkdown").orElse("");
    }

    public List<String> logs() {
        return this.<List<String>>value("logs").orElse(List.of());
    }
}

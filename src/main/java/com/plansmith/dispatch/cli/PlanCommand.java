package com.plansmith.dispatch.cli;

import com.plansmith.core.engine.PipelineEngine;
import com.plansmith.core.events.EventBus;
import com.plansmith.core.llm.JsonSupport;
import com.plansmith.core.model.ResearchFindings;
import com.plansmith.core.planning.PlanningProperties;
import com.plansmith.core.state.PlanningState;
import com.plansmith.research.ResearchProperties;
import com.plansmith.research.SearchResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: plansmith plan --task "&lt;task&gt;"
 * <p>
 * Runs the planning pipeline and prints the run logs, the validation log,
 * the plan, the research findings, the report and its sources.
 * Returns 0 when the pipeline completes, including a best-effort plan after
 * the refinement ceiling, and 1 when the run fails.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Generate a project plan for a task")
@Component
public class PlanCommand implements Callable<Integer> {

    @Option(names = {"--task", "-t"}, required = true, description = "Free-text planning task")
    private String task;

    @Option(names = "--max-attempts",
            description = "Refinement attempts before the best available plan is used (default: configured value)")
    private Integer maxAttempts;

    @Option(names = "--no-web", description = "Skip web research")
    private boolean noWeb;

    private final PipelineEngine pipelineEngine;
    private final EventBus eventBus;
    private final PlanningProperties planningProperties;
    private final ResearchProperties researchProperties;

    public PlanCommand(PipelineEngine pipelineEngine,
                       EventBus eventBus,
                       PlanningProperties planningProperties,
                       ResearchProperties researchProperties) {
        this.pipelineEngine = pipelineEngine;
        this.eventBus = eventBus;
        this.planningProperties = planningProperties;
        this.researchProperties = researchProperties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        int attempts = maxAttempts != null ? maxAttempts : planningProperties.getMaxAttempts();
        boolean useWeb = !noWeb && researchProperties.isEnabled();
        ConsoleOutput.info("Planning: " + task);

        PlanningState state;
        EventBus.Subscription subscription = eventBus.subscribe(ConsoleOutput::event);
        try {
            state = pipelineEngine.run(task, attempts, useWeb);
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + rootCauseMessage(e));
            return 1;
        } finally {
            subscription.unsubscribe();
        }

        ConsoleOutput.section("Run " + state.runId());
        state.logs().forEach(line -> System.out.println("- " + line));

        ConsoleOutput.section("Validation");
        state.violationLog().forEach(line -> System.out.println("- " + line));

        ConsoleOutput.section("Plan (JSON)");
        System.out.println(JsonSupport.toJson(state.plan().orElse(null)));

        ConsoleOutput.section("Research (JSON)");
        System.out.println(JsonSupport.toJson(state.research().orElse(ResearchFindings.empty())));

        ConsoleOutput.section("Report");
        System.out.println(state.reportMarkdown());

        List<SearchResult> sources = state.webSources();
        if (!sources.isEmpty()) {
            ConsoleOutput.section("Sources");
            for (int i = 0; i < sources.size(); i++) {
                System.out.printf("[%d] %s - %s%n", i + 1, sources.get(i).title(), sources.get(i).url());
            }
        }

        System.out.println();
        if (state.validated()) {
            ConsoleOutput.success(String.format("Plan validated after %d refinement attempt(s).",
                    state.attemptCount()));
        } else {
            ConsoleOutput.warn(String.format(
                    "Refinement ceiling reached (%d/%d); plan has open issues: %s",
                    state.attemptCount(), state.maxAttempts(), String.join(", ", state.violations())));
        }
        return 0;
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

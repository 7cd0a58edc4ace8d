package com.plansmith.core.graph;

import com.plansmith.core.model.RefinementPhase;
import com.plansmith.core.nodes.GeneratePlanNode;
import com.plansmith.core.nodes.RefinePlanNode;
import com.plansmith.core.nodes.ReportNode;
import com.plansmith.core.nodes.ResearchNode;
import com.plansmith.core.nodes.ValidatePlanNode;
import com.plansmith.core.state.PlanningState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} for the planning pipeline.
 * <pre>
 *   START -> generate_plan -> validate_plan -> [routeAfterValidation]
 *            -> refine_plan -> validate_plan   (loop while REFINING)
 *            -> research -> report -> END
 * </pre>
 * Every node runs behind {@link StepGuard}, so a run that passes its
 * {@code maxSteps} ceiling fails with {@link PipelineAbortedException}.
 */
@Component
public class PlanningGraph {

    private static final Logger log = LoggerFactory.getLogger(PlanningGraph.class);

    static final String GENERATE_PLAN = "generate_plan";
    static final String VALIDATE_PLAN = "validate_plan";
    static final String REFINE_PLAN = "refine_plan";
    static final String RESEARCH = "research";
    static final String REPORT = "report";

    private final CompiledGraph<PlanningState> compiledGraph;

    public PlanningGraph(
            GeneratePlanNode generateNode,
            ValidatePlanNode validateNode,
            RefinePlanNode refineNode,
            ResearchNode researchNode,
            ReportNode reportNode) throws Exception {

        var graph = new StateGraph<>(PlanningState.SCHEMA, PlanningState::new)
                .addNode(GENERATE_PLAN, node_async(StepGuard.guard(GENERATE_PLAN, generateNode::apply)))
                .addNode(VALIDATE_PLAN, node_async(StepGuard.guard(VALIDATE_PLAN, validateNode::apply)))
                .addNode(REFINE_PLAN, node_async(StepGuard.guard(REFINE_PLAN, refineNode::apply)))
                .addNode(RESEARCH, node_async(StepGuard.guard(RESEARCH, researchNode::apply)))
                .addNode(REPORT, node_async(StepGuard.guard(REPORT, reportNode::apply)))
                .addEdge(START, GENERATE_PLAN)
                .addEdge(GENERATE_PLAN, VALIDATE_PLAN)
                .addConditionalEdges(VALIDATE_PLAN,
                        edge_async(this::routeAfterValidation),
                        Map.of(REFINE_PLAN, REFINE_PLAN,
                                RESEARCH, RESEARCH))
                .addEdge(REFINE_PLAN, VALIDATE_PLAN)
                .addEdge(RESEARCH, REPORT)
                .addEdge(REPORT, END);

        // the per-run step ceiling is enforced by StepGuard; this only bounds the executor
        this.compiledGraph = graph.compile(CompileConfig.builder()
                .recursionLimit(100)
                .build());
        log.info("Planning graph compiled");
    }

    /**
     * Loops back to refinement while the validator asks for it, otherwise moves on to research.
     */
    String routeAfterValidation(PlanningState state) {
        if (state.refinementPhase() == RefinementPhase.REFINING) {
            return REFINE_PLAN;
        }
        return RESEARCH;
    }

    public CompiledGraph<PlanningState> getCompiledGraph() {
        return compiledGraph;
    }
}

package com.plansmith.core.graph;

import com.plansmith.core.logging.MdcContext;
import com.plansmith.core.state.PlanningState;
import org.bsc.langgraph4j.action.NodeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;

/**
 * Wraps a graph node so that every execution counts against the run's
 * {@code maxSteps} ceiling. The node is not executed once the ceiling is passed.
 */
final class StepGuard {

    private static final Logger log = LoggerFactory.getLogger(StepGuard.class);

    private StepGuard() {}

    static NodeAction<PlanningState> guard(String nodeName, NodeAction<PlanningState> action) {
        return state -> {
            int step = state.stepCount() + 1;
            if (step > state.maxSteps()) {
                log.error("Run {} aborted before node {}: step {} exceeds ceiling {}",
                        state.runId(), nodeName, step, state.maxSteps());
                throw new PipelineAbortedException(String.format(
                        "Step ceiling of %d exceeded at node '%s'", state.maxSteps(), nodeName), step);
            }
            MdcContext.setNode(state.runId(), nodeName);
            try {
                log.debug("Step {}/{}: {}", step, state.maxSteps(), nodeName);
                var updates = new HashMap<String, Object>(action.apply(state));
                updates.put("stepCount", step);
                return updates;
            } finally {
                MdcContext.clearNode();
            }
        };
    }
}

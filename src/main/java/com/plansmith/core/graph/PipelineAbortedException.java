package com.plansmith.core.graph;

/**
 * Thrown when a run exceeds its step ceiling. The run ends without a report.
 */
public class PipelineAbortedException extends RuntimeException {

    private final int steps;

    public PipelineAbortedException(String message, int steps) {
        super(message);
        this.steps = steps;
    }

    public int getSteps() {
        return steps;
    }
}

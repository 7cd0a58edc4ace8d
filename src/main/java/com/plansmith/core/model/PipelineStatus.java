package com.plansmith.core.model;

/**
 * Lifecycle status of a planning pipeline run.
 */
public enum PipelineStatus {
    PLANNING,       // refinement loop in progress
    RESEARCHING,
    REPORTING,
    COMPLETED
}

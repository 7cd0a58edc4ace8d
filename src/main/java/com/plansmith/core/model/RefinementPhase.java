package com.plansmith.core.model;

/**
 * States of the plan refinement loop.
 */
public enum RefinementPhase {
    GENERATING,
    VALIDATING,
    REFINING,
    DONE
}

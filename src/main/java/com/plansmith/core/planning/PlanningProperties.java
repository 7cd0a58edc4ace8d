package com.plansmith.core.planning;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Ceilings for the plan refinement loop.
 */
@Component
@ConfigurationProperties(prefix = "plansmith.planning")
public class PlanningProperties {

    /** Refinement attempts before the best available plan is forwarded. */
    private int maxAttempts = 3;

    /** Outer ceiling on graph steps per run; exceeding it aborts the run. */
    private int maxSteps = 20;

    /** Extra planner calls when the first reply is unparsable or incomplete. */
    private int plannerRetries = 2;

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    public int getPlannerRetries() {
        return plannerRetries;
    }

    public void setPlannerRetries(int plannerRetries) {
        this.plannerRetries = plannerRetries;
    }
}

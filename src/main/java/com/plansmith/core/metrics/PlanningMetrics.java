package com.plansmith.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for planning pipeline runs.
 */
@Service
public class PlanningMetrics {

    private final MeterRegistry registry;

    public PlanningMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordValidation(boolean accepted) {
        Counter.builder("plansmith.plan.validations")
                .tag("result", accepted ? "accepted" : "rejected")
                .register(registry)
                .increment();
    }

    /**
     * Counts planner runs that exhausted their retries and fell back to the skeleton plan.
     */
    public void recordPlanFallback() {
        Counter.builder("plansmith.plan.fallbacks")
                .register(registry)
                .increment();
    }

    public void recordRefinementAttempts(int attempts, boolean validated) {
        DistributionSummary.builder("plansmith.refinement.attempts")
                .tag("validated", String.valueOf(validated))
                .register(registry)
                .record(attempts);
    }

    public void recordPipelineDuration(long ms) {
        Timer.builder("plansmith.pipeline.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPipelineResult(String outcome) {
        Counter.builder("plansmith.pipelines.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}

package com.plansmith.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a pipeline run, used for CLI progress output.
 *
 * @param eventType event type (e.g. "pipeline.started", "plan.validated", "plan.refined")
 * @param runId     the run this event belongs to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String runId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static PipelineEvent of(String eventType, String runId, Map<String, Object> payload) {
        return new PipelineEvent(eventType, runId, payload, Instant.now());
    }
}

package com.plansmith.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Test
    @DisplayName("PipelineEvent.of stamps the current time")
    void eventFactory() {
        var event = PipelineEvent.of("plan.generated", "PLAN-1", Map.of("risks", 4));
        assertEquals("plan.generated", event.eventType());
        assertEquals("PLAN-1", event.runId());
        assertEquals(Map.of("risks", 4), event.payload());
        assertNotNull(event.timestamp());
    }

    @Test
    @DisplayName("Listeners see events of every run in publish order")
    void deliversAllRuns() {
        List<PipelineEvent> received = new ArrayList<>();
        eventBus.subscribe(received::add);

        eventBus.publish(PipelineEvent.of("pipeline.started", "PLAN-1", Map.of()));
        eventBus.publish(PipelineEvent.of("pipeline.started", "PLAN-2", Map.of()));

        assertEquals(List.of("PLAN-1", "PLAN-2"), received.stream().map(PipelineEvent::runId).toList());
    }

    @Test
    @DisplayName("Unsubscribed listeners receive nothing further")
    void unsubscribe() {
        List<PipelineEvent> received = new ArrayList<>();
        var subscription = eventBus.subscribe(received::add);
        eventBus.publish(PipelineEvent.of("plan.generated", "PLAN-1", Map.of()));
        subscription.unsubscribe();

        eventBus.publish(PipelineEvent.of("plan.refined", "PLAN-1", Map.of()));

        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("Events without a run id are still delivered")
    void nullRunId() {
        List<PipelineEvent> received = new ArrayList<>();
        eventBus.subscribe(received::add);

        eventBus.publish(PipelineEvent.of("pipeline.failed", null, Map.of()));

        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("A failing listener does not stop delivery to others")
    void failingSubscriber() {
        List<PipelineEvent> received = new ArrayList<>();
        eventBus.subscribe(e -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribe(received::add);

        eventBus.publish(PipelineEvent.of("plan.rejected", "PLAN-1", Map.of()));

        assertEquals(1, received.size());
    }
}

package com.plansmith.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans pipeline events out to in-process listeners such as the CLI progress printer.
 * <p>
 * Every listener sees the events of every run; listeners that care about one run
 * filter on {@link PipelineEvent#runId()}. A listener that throws is logged and
 * skipped so the run itself is never affected.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final List<Consumer<PipelineEvent>> listeners = new CopyOnWriteArrayList<>();

    public void publish(PipelineEvent event) {
        log.debug("Event {} for run {} to {} listener(s)", event.eventType(), event.runId(), listeners.size());
        for (Consumer<PipelineEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on event {}: {}", event.eventType(), e.getMessage(), e);
            }
        }
    }

    /**
     * @param listener callback for each published event
     * @return handle that removes the listener again
     */
    public Subscription subscribe(Consumer<PipelineEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}

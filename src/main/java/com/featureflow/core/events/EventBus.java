package com.featureflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans workflow events out to in-process listeners, such as the CLI's live progress
 * output during {@code start} and {@code resume}.
 * <p>
 * A listener that throws is logged and skipped; the remaining listeners still see the event.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<WorkflowEvent>> listeners = new CopyOnWriteArrayList<>();

    public void publish(WorkflowEvent event) {
        log.debug("{} for {} (phase {})", event.eventType(), event.featureId(), event.phase());
        for (Consumer<WorkflowEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {}: {}", event.eventType(), e.getMessage(), e);
            }
        }
    }

    /**
     * Registers {@code listener} for every event until the returned handle is closed.
     */
    public Subscription subscribeAll(Consumer<WorkflowEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /** Removes its listener on close; usable in try-with-resources. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }
}

package loganalyzer.engine.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of job events to listeners (progress UIs, notifiers).
 * Listeners run on the publishing worker thread and must not block.
 */
public final class JobEventBus {

    private static final Logger log = LoggerFactory.getLogger(JobEventBus.class);

    private final CopyOnWriteArrayList<Consumer<JobEvent>> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(Consumer<JobEvent> listener) {
        listeners.add(listener);
    }

    public void unsubscribe(Consumer<JobEvent> listener) {
        listeners.remove(listener);
    }

    public void publish(JobEvent event) {
        for (Consumer<JobEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} for job {}: {}", event.type(), event.jobId(), e.getMessage());
            }
        }
    }
}

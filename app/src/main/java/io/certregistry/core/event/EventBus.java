package io.certregistry.core.event;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans events out to registered listeners. A failing listener is logged and
 * skipped; it never affects the operation that produced the event.
 */
public final class EventBus implements RegistryEventListener {
    private static final Logger LOG = Logger.getLogger(EventBus.class.getName());

    private final List<RegistryEventListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(RegistryEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void unsubscribe(RegistryEventListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void onEvent(RegistryEvent event) {
        for (RegistryEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Event listener failed for " + event.type(), e);
            }
        }
    }
}

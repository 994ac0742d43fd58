package com.acme.deeptree.ledger.telemetry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Listener registry scoped to one ledger instance.
 *
 * <p>Delivery is synchronous and in publication order. A failing listener is logged and
 * skipped; it does not stop delivery to the others or fail the publishing operation.
 */
public final class LedgerEventBus {
    private static final Logger LOG = Logger.getLogger(LedgerEventBus.class.getName());

    private final CopyOnWriteArrayList<LedgerEventListener> listeners = new CopyOnWriteArrayList<>();

    public Subscription subscribe(LedgerEventListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(LedgerEvent event) {
        for (LedgerEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Ledger listener failed on " + event.getClass().getSimpleName(), e);
            }
        }
    }

    public void publishAll(List<LedgerEvent> events) {
        for (LedgerEvent event : events) {
            publish(event);
        }
    }

    public int listenerCount() {
        return listeners.size();
    }

    /** Detaches the listener it was returned for. Closing twice is harmless. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}

package io.datascope.event;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe subscriber list for post-execution statement events, one per engine.
 *
 * <p>Listeners are invoked in registration order. A failing listener is logged and skipped;
 * it never fails the statement that triggered it.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (StatementEvents.Registration reg = engine.statementEvents()
 *     .register(event -> log(event.sql()))) {
 *     // statements executed here are observed
 * }
 * }</pre>
 */
public final class StatementEvents {
    private static final Logger logger = Logger.getLogger(StatementEvents.class.getName());

    private final CopyOnWriteArrayList<StatementListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a listener.
     *
     * @return token whose {@link Registration#close()} removes the listener exactly once
     */
    public Registration register(StatementListener listener) {
        Objects.requireNonNull(listener, "listener");
        // wrap so the same listener instance can hold several independent registrations
        Entry entry = new Entry(listener);
        listeners.add(entry);
        return entry;
    }

    /**
     * Delivers an event to all registered listeners.
     */
    public void publish(StatementEvent event) {
        for (StatementListener listener : listeners) {
            try {
                listener.afterExecute(event);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Statement listener failed for: " + event.sql(), e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }

    public boolean hasListeners() {
        return !listeners.isEmpty();
    }

    /**
     * Deregistration token. Closing it more than once has no further effect.
     */
    public interface Registration extends AutoCloseable {
        boolean isActive();

        @Override
        void close();
    }

    private final class Entry implements StatementListener, Registration {
        private final StatementListener delegate;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Entry(StatementListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void afterExecute(StatementEvent event) {
            delegate.afterExecute(event);
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                listeners.remove(this);
            }
        }
    }
}

package io.datascope.engine;

import io.datascope.DataScopeConfig;
import io.datascope.EngineConstructionException;
import io.datascope.Mode;
import io.datascope.UnsupportedSchemeException;
import io.datascope.spi.MetricsExporter;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lazy, lock-guarded engine slot shared by the blocking and non-blocking registries.
 *
 * <p>{@link #getEngine()} uses a double-checked read of a volatile field, so the hot path
 * takes no lock. Construction and disposal are serialized by the same monitor.
 * Subclasses supply {@link #createEngine} and {@link #closeEngine}.
 *
 * @param <E> engine handle type
 */
public abstract class AbstractEngineRegistry<E extends EngineHandle> implements EngineRegistry<E> {
    private static final Logger logger = Logger.getLogger(AbstractEngineRegistry.class.getName());

    private final Mode mode;
    private final DataScopeConfig config;
    private final MetricsExporter metrics;
    private final Object lock = new Object();

    private volatile E engine;
    private volatile EngineState state = EngineState.UNINITIALIZED;

    protected AbstractEngineRegistry(Mode mode, DataScopeConfig config, MetricsExporter metrics) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    }

    /**
     * Builds the engine from the config as it is now. Must not leave resources open
     * when it throws.
     */
    protected abstract E createEngine(DataScopeConfig config);

    /**
     * Releases the engine's pool. Exceptions are logged by the caller.
     */
    protected abstract void closeEngine(E engine) throws Exception;

    @Override
    public final Mode mode() {
        return mode;
    }

    @Override
    public E getEngine() {
        E current = engine;
        if (current != null) {
            return current;
        }
        synchronized (lock) {
            current = engine;
            if (current == null) {
                current = construct();
                engine = current;
                state = EngineState.READY;
            }
            return current;
        }
    }

    @Override
    public void dispose() {
        E detached = detach();
        if (detached == null) {
            return;
        }
        release(detached);
    }

    @Override
    public EngineState state() {
        return state;
    }

    /**
     * Returns the live engine without building one, or {@code null}.
     */
    public E currentEngine() {
        return engine;
    }

    protected DataScopeConfig config() {
        return config;
    }

    protected MetricsExporter metrics() {
        return metrics;
    }

    /**
     * Clears the slot under the lock and returns the engine that was live, or {@code null}.
     * The caller is responsible for {@link #release releasing} it.
     */
    protected final E detach() {
        synchronized (lock) {
            E current = engine;
            if (current == null) {
                return null;
            }
            engine = null;
            state = EngineState.DISPOSED;
            return current;
        }
    }

    /**
     * Closes a detached engine, logging instead of propagating failures.
     */
    protected final void release(E detached) {
        beforeClose(detached);
        Exception failure = null;
        try {
            closeEngine(detached);
        } catch (Exception e) {
            failure = e;
        }
        closeCompleted(detached, failure);
    }

    /**
     * Warns when sessions are still open on an engine about to be closed.
     */
    protected final void beforeClose(E detached) {
        int open = detached.openSessions();
        if (open > 0) {
            logger.log(Level.WARNING, "Disposing {0} engine with {1} open session(s)",
                new Object[]{mode, open});
        }
    }

    /**
     * Records the outcome of closing a detached engine.
     *
     * @param failure the close failure, or {@code null}
     */
    protected final void closeCompleted(E detached, Throwable failure) {
        if (failure == null) {
            logger.log(Level.FINE, "Disposed {0} engine for {1}", new Object[]{mode, detached.url()});
        } else {
            logger.log(Level.WARNING, "Failed to close " + mode + " engine for " + detached.url(), failure);
        }
        metrics.incrementEngineDisposed(mode);
        metrics.recordOpenSessions(mode, 0);
    }

    private E construct() {
        E created;
        try {
            created = createEngine(config.validate());
        } catch (UnsupportedSchemeException | EngineConstructionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EngineConstructionException(mode,
                "Failed to build " + mode + " engine: " + e.getMessage(), e);
        }
        logger.log(Level.FINE, "Created {0} engine for {1} (pool {2}+{3})",
            new Object[]{mode, created.url(), created.poolSize(), created.maxOverflow()});
        metrics.incrementEngineCreated(mode);
        return created;
    }
}

package io.datascope.engine;

import io.datascope.Mode;

/**
 * Lazily builds, caches and disposes the engine of a single mode.
 *
 * <p>Implementations are thread-safe. Concurrent first callers of {@link #getEngine()}
 * observe exactly one construction and receive the same handle.
 *
 * @param <E> engine handle type
 */
public interface EngineRegistry<E extends EngineHandle> {

    Mode mode();

    /**
     * Returns the live engine, building it on first use or after {@link #dispose()}.
     *
     * @throws io.datascope.EngineConstructionException if the driver or pool cannot be set up
     * @throws io.datascope.UnsupportedSchemeException if the configured URL family is unknown
     */
    E getEngine();

    /**
     * Closes the live engine's pool. No-op when nothing is live. Close failures are
     * logged, never thrown.
     */
    void dispose();

    EngineState state();
}

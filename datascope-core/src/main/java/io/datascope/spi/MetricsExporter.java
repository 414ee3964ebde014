package io.datascope.spi;

import io.datascope.Mode;

/**
 * Observability hook for exporting engine and session counters to a metrics backend.
 *
 * <p>Every call is tagged with the {@link Mode} of the engine it concerns.
 * The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of engines built (first use or rebuild after dispose).
     */
    void incrementEngineCreated(Mode mode);

    /**
     * Increments the count of engines disposed.
     */
    void incrementEngineDisposed(Mode mode);

    /**
     * Increments the count of sessions handed out by the pool.
     */
    void incrementSessionOpened(Mode mode);

    void incrementCommitted(Mode mode);

    void incrementRolledBack(Mode mode);

    /**
     * Increments the count of session requests that timed out waiting for a connection.
     */
    void incrementPoolExhausted(Mode mode);

    /**
     * Records the number of sessions currently open on the engine of the given mode.
     *
     * @param openSessions current count (always non-negative)
     */
    default void recordOpenSessions(Mode mode, int openSessions) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEngineCreated(Mode mode) {
        }

        @Override
        public void incrementEngineDisposed(Mode mode) {
        }

        @Override
        public void incrementSessionOpened(Mode mode) {
        }

        @Override
        public void incrementCommitted(Mode mode) {
        }

        @Override
        public void incrementRolledBack(Mode mode) {
        }

        @Override
        public void incrementPoolExhausted(Mode mode) {
        }
    }
}

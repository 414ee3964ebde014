package io.datascope;

/**
 * Execution mode of an engine and of the sessions drawn from it.
 */
public enum Mode {
    /**
     * JDBC driver stack; the calling thread blocks on connection acquisition and statement round-trips.
     */
    BLOCKING,

    /**
     * R2DBC driver stack; callers suspend at acquisition and round-trip boundaries instead of blocking.
     */
    NON_BLOCKING
}

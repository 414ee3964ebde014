package io.datascope;

/**
 * Thrown when an engine cannot be built from the configured connection parameters,
 * e.g. a malformed URL, a missing driver or an unreachable database.
 *
 * <p>The owning registry stays uninitialized, so the next {@code getEngine()} call retries.
 */
public final class EngineConstructionException extends DataAccessException {
    private final Mode mode;

    public EngineConstructionException(Mode mode, String message, Throwable cause) {
        super(message, cause);
        this.mode = mode;
    }

    public Mode mode() {
        return mode;
    }
}

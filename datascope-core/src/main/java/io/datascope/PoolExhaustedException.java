package io.datascope;

import java.time.Duration;

/**
 * Thrown when no pooled connection became available within the acquire timeout.
 *
 * <p>Callers may retry with backoff.
 */
public final class PoolExhaustedException extends DataAccessException {
    private final Mode mode;
    private final Duration acquireTimeout;

    public PoolExhaustedException(Mode mode, Duration acquireTimeout, Throwable cause) {
        super("No " + mode + " connection available within " + acquireTimeout.toMillis() + "ms", cause);
        this.mode = mode;
        this.acquireTimeout = acquireTimeout;
    }

    public Mode mode() {
        return mode;
    }

    public Duration acquireTimeout() {
        return acquireTimeout;
    }
}

package io.datascope.engine;

import io.datascope.Mode;
import io.datascope.event.StatementEvents;

import java.time.Duration;

/**
 * A live connection pool for one mode together with its pool settings.
 *
 * <p>Handles are owned by their {@link EngineRegistry}; callers must not close them directly.
 */
public interface EngineHandle {

    Mode mode();

    /**
     * The native driver URL the pool connects to, without credentials.
     */
    String url();

    int poolSize();

    int maxOverflow();

    Duration acquireTimeout();

    /**
     * SELECT count above which a capture with repeated patterns is flagged as a potential N+1.
     */
    int nPlusOneSelectThreshold();

    /**
     * Subscriber list notified after every statement executed through this engine.
     */
    StatementEvents statementEvents();

    /**
     * Number of sessions currently holding a connection of this engine.
     */
    int openSessions();

    boolean isClosed();
}

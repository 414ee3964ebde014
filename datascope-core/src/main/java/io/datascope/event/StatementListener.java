package io.datascope.event;

/**
 * Post-execution hook. Invoked on the thread that executed the statement,
 * after the driver accepted it.
 *
 * <p>Implementations must be thread-safe when the engine is shared by concurrent sessions.
 */
@FunctionalInterface
public interface StatementListener {

    void afterExecute(StatementEvent event);
}

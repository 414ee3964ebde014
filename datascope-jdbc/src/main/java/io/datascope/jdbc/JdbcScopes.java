package io.datascope.jdbc;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scoped access to blocking sessions. Every scope closes its session exactly once, on
 * every exit path.
 *
 * <pre>{@code
 * JdbcScopes scopes = new JdbcScopes(new JdbcEngineRegistry(config));
 *
 * // commits on success, rolls back and rethrows on failure
 * long id = scopes.inTransaction(session -> {
 *     session.update("INSERT INTO author(name) VALUES (?)", "Ursula");
 *     return session.queryOne("SELECT MAX(id) FROM author", rs -> rs.getLong(1)).orElseThrow();
 * });
 *
 * // never commits
 * List<String> names = scopes.inSession(session ->
 *     session.query("SELECT name FROM author", rs -> rs.getString(1)));
 * }</pre>
 */
public final class JdbcScopes {
    private static final Logger logger = Logger.getLogger(JdbcScopes.class.getName());

    private final JdbcEngineRegistry registry;

    public JdbcScopes(JdbcEngineRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Opens a session the caller must close. Builds the engine on first use.
     *
     * @throws io.datascope.PoolExhaustedException if the acquire timeout elapses
     */
    public JdbcSession openSession() {
        return registry.getEngine().openSession();
    }

    /**
     * Bare scope: runs the callback and closes the session without committing.
     */
    public <T, X extends Exception> T inSession(SessionCallback<T, X> callback) throws X {
        Objects.requireNonNull(callback, "callback");
        try (JdbcSession session = openSession()) {
            return callback.doInSession(session);
        }
    }

    /**
     * Auto-transaction scope: commits when the callback returns normally. If the callback
     * or the commit fails, rolls back and rethrows the original exception; cleanup failures
     * are attached to it as suppressed.
     */
    public <T, X extends Exception> T inTransaction(SessionCallback<T, X> callback) throws X {
        Objects.requireNonNull(callback, "callback");
        JdbcSession session = openSession();
        T result;
        try {
            result = callback.doInSession(session);
            session.commit();
        } catch (Throwable t) {
            rollbackAndClose(session, t);
            throw t;
        }
        session.close();
        return result;
    }

    /**
     * {@link #inTransaction} followed by disposal of the blocking engine, for one-shot
     * programs that should not leave a pool behind.
     */
    public <T, X extends Exception> T inStandaloneTransaction(SessionCallback<T, X> callback) throws X {
        try {
            return inTransaction(callback);
        } finally {
            registry.dispose();
        }
    }

    /**
     * The blocking engine, built on first use. Entry point for introspection such as
     * {@link JdbcEngine#tableNames()}.
     */
    public JdbcEngine engine() {
        return registry.getEngine();
    }

    public JdbcEngineRegistry registry() {
        return registry;
    }

    private static void rollbackAndClose(JdbcSession session, Throwable failure) {
        try {
            if (session.isOpen()) {
                session.rollback();
            }
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Rollback after failure did not complete", e);
            failure.addSuppressed(e);
        }
        try {
            session.close();
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }
}

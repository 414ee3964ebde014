package io.datascope.jdbc;

/**
 * Work run by {@link JdbcScopes} against a session the scope owns.
 *
 * @param <T> result type
 * @param <X> checked exception the callback may throw; rethrown unchanged by the scope
 */
@FunctionalInterface
public interface SessionCallback<T, X extends Exception> {
    T doInSession(JdbcSession session) throws X;
}

package io.datascope.jdbc;

import io.datascope.DataAccessException;
import io.datascope.Mode;
import io.datascope.event.StatementEvent;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A unit of work bound to one pooled JDBC connection.
 *
 * <p>The connection runs with auto-commit off, so statements stay invisible to other
 * sessions until {@link #commit()}. {@link #close()} rolls back anything uncommitted and
 * returns the connection to the pool. Any call after close fails with
 * {@link IllegalStateException}.
 *
 * <p>Sessions are not thread-safe; use one per caller.
 */
public final class JdbcSession implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(JdbcSession.class.getName());

    private final JdbcEngine engine;
    private final Connection connection;
    private boolean dirty;
    // a close-time rollback is only counted when it discards writes
    private boolean written;
    private boolean closed;

    JdbcSession(JdbcEngine engine, Connection connection) {
        this.engine = engine;
        this.connection = connection;
    }

    /** Execute INSERT/UPDATE/DELETE, return rows affected. */
    public int update(String sql, Object... params) {
        ensureOpen();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bindParams(ps, params);
            dirty = true;
            written = true;
            int rows = ps.executeUpdate();
            published(sql, params);
            return rows;
        } catch (SQLException e) {
            throw new DataAccessException("Failed to execute update: " + sql, e);
        }
    }

    /** Execute SELECT, map rows. */
    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
        ensureOpen();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bindParams(ps, params);
            dirty = true;
            try (ResultSet rs = ps.executeQuery()) {
                published(sql, params);
                List<T> results = new ArrayList<>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new DataAccessException("Failed to execute query: " + sql, e);
        }
    }

    /**
     * Execute SELECT expected to return at most one row.
     *
     * @throws DataAccessException if more than one row is returned
     */
    public <T> Optional<T> queryOne(String sql, RowMapper<T> mapper, Object... params) {
        List<T> rows = query(sql, mapper, params);
        if (rows.size() > 1) {
            throw new DataAccessException("Expected at most one row but got " + rows.size() + ": " + sql);
        }
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    /** Execute a statement without parameters, typically DDL. */
    public void execute(String sql) {
        ensureOpen();
        try (Statement statement = connection.createStatement()) {
            dirty = true;
            written = true;
            statement.execute(sql);
            published(sql);
        } catch (SQLException e) {
            throw new DataAccessException("Failed to execute: " + sql, e);
        }
    }

    public void commit() {
        ensureOpen();
        try {
            connection.commit();
        } catch (SQLException e) {
            throw new DataAccessException("Failed to commit", e);
        }
        dirty = false;
        written = false;
        engine.metrics().incrementCommitted(Mode.BLOCKING);
    }

    public void rollback() {
        ensureOpen();
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw new DataAccessException("Failed to roll back", e);
        } finally {
            dirty = false;
            written = false;
        }
        engine.metrics().incrementRolledBack(Mode.BLOCKING);
    }

    public boolean isOpen() {
        return !closed;
    }

    /**
     * Rolls back uncommitted work and returns the connection to the pool. Idempotent.
     *
     * @throws DataAccessException if the rollback or the release failed; the session is
     *                             closed either way
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        SQLException failure = null;
        try {
            if (dirty) {
                connection.rollback();
                if (written) {
                    engine.metrics().incrementRolledBack(Mode.BLOCKING);
                }
            }
        } catch (SQLException e) {
            failure = e;
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                if (failure == null) failure = e; else failure.addSuppressed(e);
            } finally {
                engine.sessionClosed();
            }
        }
        if (failure != null) {
            logger.log(Level.FINE, "Session cleanup failed", failure);
            throw new DataAccessException("Failed to release session", failure);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Session is closed");
        }
    }

    private void published(String sql, Object... params) {
        if (engine.statementEvents().hasListeners()) {
            engine.statementEvents().publish(new StatementEvent(sql, Arrays.asList(params), Mode.BLOCKING));
        }
    }

    private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object param = params[i];
            if (param == null) {
                ps.setObject(i + 1, null);
            } else if (param instanceof String s) {
                ps.setString(i + 1, s);
            } else if (param instanceof Integer n) {
                ps.setInt(i + 1, n);
            } else if (param instanceof Long n) {
                ps.setLong(i + 1, n);
            } else if (param instanceof Timestamp ts) {
                ps.setTimestamp(i + 1, ts);
            } else {
                ps.setObject(i + 1, param);
            }
        }
    }
}

package io.datascope.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import io.datascope.DataAccessException;
import io.datascope.Mode;
import io.datascope.PoolExhaustedException;
import io.datascope.engine.EngineHandle;
import io.datascope.event.StatementEvents;
import io.datascope.spi.Dialect;
import io.datascope.spi.MetricsExporter;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blocking engine: a HikariCP pool plus the dialect of the configured database.
 *
 * <p>Obtained from {@link JdbcEngineRegistry#getEngine()}; the registry owns and closes it.
 */
public final class JdbcEngine implements EngineHandle {
    private final HikariDataSource dataSource;
    private final Dialect dialect;
    private final int poolSize;
    private final int maxOverflow;
    private final Duration acquireTimeout;
    private final int nPlusOneSelectThreshold;
    private final MetricsExporter metrics;
    private final StatementEvents statementEvents = new StatementEvents();
    private final AtomicInteger openSessions = new AtomicInteger();

    JdbcEngine(HikariDataSource dataSource, Dialect dialect, int poolSize, int maxOverflow,
               Duration acquireTimeout, int nPlusOneSelectThreshold,
               MetricsExporter metrics) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.poolSize = poolSize;
        this.maxOverflow = maxOverflow;
        this.acquireTimeout = acquireTimeout;
        this.nPlusOneSelectThreshold = nPlusOneSelectThreshold;
        this.metrics = metrics;
    }

    /**
     * Borrows a connection and wraps it in a session. Blocks for at most the acquire timeout.
     *
     * @throws PoolExhaustedException if no connection became available in time
     * @throws DataAccessException    if the connection could not be obtained for another reason
     * @throws IllegalStateException  if the engine has been disposed
     */
    public JdbcSession openSession() {
        if (dataSource.isClosed()) {
            throw new IllegalStateException("Engine has been disposed: " + url());
        }
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLTransientConnectionException e) {
            metrics.incrementPoolExhausted(Mode.BLOCKING);
            throw new PoolExhaustedException(Mode.BLOCKING, acquireTimeout, e);
        } catch (SQLException e) {
            throw new DataAccessException("Failed to obtain connection from " + url(), e);
        }
        try {
            if (connection.getAutoCommit()) {
                connection.setAutoCommit(false);
            }
        } catch (SQLException e) {
            closeQuietly(connection, e);
            throw new DataAccessException("Failed to begin transaction", e);
        }
        metrics.incrementSessionOpened(Mode.BLOCKING);
        metrics.recordOpenSessions(Mode.BLOCKING, openSessions.incrementAndGet());
        return new JdbcSession(this, connection);
    }

    /**
     * Names of the user tables in the current schema, sorted.
     */
    public List<String> tableNames() {
        try (JdbcSession session = openSession()) {
            return session.query(dialect.listTablesSql(), rs -> rs.getString(1));
        }
    }

    /**
     * The pooled data source, for integration with libraries that take a {@link DataSource}.
     * Statements run through it directly bypass {@link #statementEvents()}.
     */
    public DataSource dataSource() {
        return dataSource;
    }

    public Dialect dialect() {
        return dialect;
    }

    @Override
    public Mode mode() {
        return Mode.BLOCKING;
    }

    @Override
    public String url() {
        return dataSource.getJdbcUrl();
    }

    @Override
    public int poolSize() {
        return poolSize;
    }

    @Override
    public int maxOverflow() {
        return maxOverflow;
    }

    @Override
    public Duration acquireTimeout() {
        return acquireTimeout;
    }

    @Override
    public int nPlusOneSelectThreshold() {
        return nPlusOneSelectThreshold;
    }

    @Override
    public StatementEvents statementEvents() {
        return statementEvents;
    }

    @Override
    public int openSessions() {
        return openSessions.get();
    }

    @Override
    public boolean isClosed() {
        return dataSource.isClosed();
    }

    /**
     * Connections currently borrowed from the pool, as reported by HikariCP.
     */
    public int activeConnections() {
        return dataSource.getHikariPoolMXBean() == null ? 0 : dataSource.getHikariPoolMXBean().getActiveConnections();
    }

    MetricsExporter metrics() {
        return metrics;
    }

    void sessionClosed() {
        int open = openSessions.decrementAndGet();
        // the gauge belongs to the live engine once this one is disposed
        if (!isClosed()) {
            metrics.recordOpenSessions(Mode.BLOCKING, open);
        }
    }

    void close() {
        dataSource.close();
    }

    private static void closeQuietly(Connection connection, SQLException cause) {
        try {
            connection.close();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}

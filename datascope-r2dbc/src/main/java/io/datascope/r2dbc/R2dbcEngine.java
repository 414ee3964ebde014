package io.datascope.r2dbc;

import io.datascope.DataAccessException;
import io.datascope.Mode;
import io.datascope.PoolExhaustedException;
import io.datascope.engine.EngineHandle;
import io.datascope.event.StatementEvents;
import io.datascope.spi.Dialect;
import io.datascope.spi.MetricsExporter;
import io.r2dbc.pool.ConnectionPool;
import io.r2dbc.pool.PoolMetrics;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.R2dbcTimeoutException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Non-blocking engine: an r2dbc-pool {@link ConnectionPool} plus the dialect of the
 * configured database.
 *
 * <p>Obtained from {@link R2dbcEngineRegistry#getEngine()}; the registry owns and disposes it.
 * Building the engine performs no I/O; connectivity problems surface on the first acquire.
 */
public final class R2dbcEngine implements EngineHandle {
    private static final Logger logger = Logger.getLogger(R2dbcEngine.class.getName());

    private final ConnectionPool pool;
    private final Dialect dialect;
    private final String url;
    private final int poolSize;
    private final int maxOverflow;
    private final Duration acquireTimeout;
    private final int nPlusOneSelectThreshold;
    private final MetricsExporter metrics;
    private final StatementEvents statementEvents = new StatementEvents();
    private final AtomicInteger openSessions = new AtomicInteger();

    R2dbcEngine(ConnectionPool pool, Dialect dialect, String url, int poolSize, int maxOverflow,
                Duration acquireTimeout, int nPlusOneSelectThreshold,
                MetricsExporter metrics) {
        this.pool = pool;
        this.dialect = dialect;
        this.url = url;
        this.poolSize = poolSize;
        this.maxOverflow = maxOverflow;
        this.acquireTimeout = acquireTimeout;
        this.nPlusOneSelectThreshold = nPlusOneSelectThreshold;
        this.metrics = metrics;
    }

    /**
     * Acquires a pooled connection and wraps it in a session. Waits at most the acquire
     * timeout. Cancelling the subscription while waiting leaves the pool intact.
     *
     * <p>Errors with {@link PoolExhaustedException} on timeout, {@link IllegalStateException}
     * if the engine has been disposed and {@link DataAccessException} for driver failures.
     */
    public Mono<R2dbcSession> openSession() {
        return Mono.defer(() -> {
            if (pool.isDisposed()) {
                return Mono.error(new IllegalStateException("Engine has been disposed: " + url));
            }
            return pool.create()
                .onErrorMap(R2dbcEngine::isAcquireTimeout, e -> {
                    metrics.incrementPoolExhausted(Mode.NON_BLOCKING);
                    return new PoolExhaustedException(Mode.NON_BLOCKING, acquireTimeout, e);
                })
                .onErrorMap(R2dbcException.class, e -> new DataAccessException("Failed to obtain connection from " + url, e))
                .map(connection -> {
                    metrics.incrementSessionOpened(Mode.NON_BLOCKING);
                    metrics.recordOpenSessions(Mode.NON_BLOCKING, openSessions.incrementAndGet());
                    return new R2dbcSession(this, connection);
                });
        });
    }

    /**
     * Names of the user tables in the current schema, sorted.
     */
    public Flux<String> tableNames() {
        return Flux.usingWhen(openSession(),
            session -> session.query(dialect.listTablesSql(), (row, meta) -> row.get(0, String.class)),
            R2dbcSession::close);
    }

    /**
     * The pooled connection factory. Statements run through it directly bypass
     * {@link #statementEvents()}.
     */
    public ConnectionFactory connectionFactory() {
        return pool;
    }

    public Dialect dialect() {
        return dialect;
    }

    @Override
    public Mode mode() {
        return Mode.NON_BLOCKING;
    }

    @Override
    public String url() {
        return url;
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
        return pool.isDisposed();
    }

    /**
     * Connections currently borrowed from the pool, as reported by r2dbc-pool.
     */
    public int activeConnections() {
        return pool.getMetrics().map(PoolMetrics::acquiredSize).orElse(0);
    }

    MetricsExporter metrics() {
        return metrics;
    }

    void sessionClosed() {
        int open = openSessions.decrementAndGet();
        // the gauge belongs to the live engine once this one is disposed
        if (!isClosed()) {
            metrics.recordOpenSessions(Mode.NON_BLOCKING, open);
        }
    }

    Mono<Void> disposeLater() {
        return pool.disposeLater();
    }

    /**
     * Closes the pool. Blocks until done, except on a Reactor non-blocking thread where
     * blocking is not allowed; there the disposal runs in the background.
     */
    void dispose() {
        if (Schedulers.isInNonBlockingThread()) {
            pool.disposeLater().subscribe(null,
                e -> logger.log(Level.WARNING, "Background disposal failed for " + url, e));
        } else {
            pool.dispose();
        }
    }

    private static boolean isAcquireTimeout(Throwable e) {
        return e instanceof TimeoutException || e instanceof R2dbcTimeoutException;
    }
}

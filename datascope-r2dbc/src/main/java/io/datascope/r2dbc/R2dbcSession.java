package io.datascope.r2dbc;

import io.datascope.DataAccessException;
import io.datascope.Mode;
import io.datascope.event.StatementEvent;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.Result;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import io.r2dbc.spi.Statement;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A unit of work bound to one pooled R2DBC connection.
 *
 * <p>A transaction is begun before the first statement, so statements stay invisible to
 * other sessions until {@link #commit()}. {@link #close()} rolls back anything uncommitted
 * and returns the connection to the pool. Any operation after close fails with
 * {@link IllegalStateException}.
 *
 * <p>Placeholders follow the driver ({@code $1, $2} for H2 and PostgreSQL, {@code ?} for MySQL);
 * parameters are bound by position. A {@code null} argument is bound as an untyped null;
 * pass {@link io.r2dbc.spi.Parameters#in(Class)} where the driver needs the type.
 *
 * <p>Nothing happens until the returned publishers are subscribed. A session is used by one
 * caller at a time; do not interleave statements of one session concurrently.
 */
public final class R2dbcSession {
    private static final Logger logger = Logger.getLogger(R2dbcSession.class.getName());

    private final R2dbcEngine engine;
    private final Connection connection;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean transactionActive;
    // a rollback on close is only counted when it discards writes
    private volatile boolean written;

    R2dbcSession(R2dbcEngine engine, Connection connection) {
        this.engine = engine;
        this.connection = connection;
    }

    /** Execute INSERT/UPDATE/DELETE, emit rows affected. */
    public Mono<Long> update(String sql, Object... params) {
        return run(sql, params, true, Result::getRowsUpdated).reduce(0L, Long::sum);
    }

    /** Execute SELECT, map rows. */
    public <T> Flux<T> query(String sql, BiFunction<Row, RowMetadata, T> mapper, Object... params) {
        return run(sql, params, false, result -> result.map(mapper));
    }

    /**
     * Execute SELECT expected to return at most one row; empty when there is none.
     * Errors with {@link DataAccessException} when there are more.
     */
    public <T> Mono<T> queryOne(String sql, BiFunction<Row, RowMetadata, T> mapper, Object... params) {
        return query(sql, mapper, params).collectList().flatMap(rows -> {
            if (rows.size() > 1) {
                return Mono.error(new DataAccessException(
                    "Expected at most one row but got " + rows.size() + ": " + sql));
            }
            return rows.isEmpty() ? Mono.empty() : Mono.just(rows.get(0));
        });
    }

    /** Execute a statement without parameters, typically DDL. */
    public Mono<Void> execute(String sql) {
        return run(sql, new Object[0], true, Result::getRowsUpdated).then();
    }

    public Mono<Void> commit() {
        return Mono.defer(() -> {
            ensureOpen();
            if (!transactionActive) {
                return Mono.<Void>empty();
            }
            return Mono.from(connection.commitTransaction())
                .doOnSuccess(v -> {
                    transactionActive = false;
                    written = false;
                    engine.metrics().incrementCommitted(Mode.NON_BLOCKING);
                });
        }).onErrorMap(R2dbcException.class, e -> new DataAccessException("Failed to commit", e));
    }

    public Mono<Void> rollback() {
        return Mono.defer(() -> {
            ensureOpen();
            return rollbackIfActive(true);
        }).onErrorMap(R2dbcException.class, e -> new DataAccessException("Failed to roll back", e));
    }

    public boolean isOpen() {
        return !closed.get();
    }

    /**
     * Rolls back uncommitted work and returns the connection to the pool. Completes
     * immediately when already closed. If the rollback fails the connection is still
     * released and the failure is signalled.
     */
    public Mono<Void> close() {
        return Mono.defer(() -> {
            if (!closed.compareAndSet(false, true)) {
                return Mono.<Void>empty();
            }
            Mono<Void> release = Mono.from(connection.close())
                .doFinally(signal -> engine.sessionClosed());
            return rollbackIfActive(false)
                .onErrorResume(e -> release.then(Mono.error(new DataAccessException("Failed to release session", e))))
                .then(release);
        });
    }

    /**
     * Rollback then close, swallowing failures. Used by scope cleanup so that the
     * exception of the failed body reaches the subscriber unchanged.
     */
    Mono<Void> abandon() {
        Mono<Void> rollback = closed.get() ? Mono.<Void>empty() : rollbackIfActive(true);
        return rollback
            .onErrorResume(e -> {
                logger.log(Level.FINE, "Rollback during cleanup did not complete", e);
                return Mono.empty();
            })
            .then(close())
            .onErrorResume(e -> {
                logger.log(Level.WARNING, "Failed to release session during cleanup", e);
                return Mono.empty();
            });
    }

    private Mono<Void> rollbackIfActive(boolean explicit) {
        return Mono.defer(() -> {
            if (!transactionActive) {
                return Mono.<Void>empty();
            }
            boolean counted = explicit || written;
            return Mono.from(connection.rollbackTransaction())
                .doOnTerminate(() -> {
                    transactionActive = false;
                    written = false;
                })
                .doOnSuccess(v -> {
                    if (counted) {
                        engine.metrics().incrementRolledBack(Mode.NON_BLOCKING);
                    }
                });
        });
    }

    private Mono<Void> begin() {
        return Mono.defer(() -> {
            if (transactionActive) {
                return Mono.<Void>empty();
            }
            return Mono.from(connection.beginTransaction()).doOnSuccess(v -> transactionActive = true);
        });
    }

    private <T> Flux<T> run(String sql, Object[] params, boolean write, Function<Result, Publisher<T>> extractor) {
        return Flux.defer(() -> {
            ensureOpen();
            if (write) {
                written = true;
            }
            Statement statement = connection.createStatement(sql);
            bindParams(statement, params);
            return begin().thenMany(Flux.from(statement.execute())
                .doOnNext(result -> published(sql, params))
                .concatMap(extractor));
        }).onErrorMap(R2dbcException.class, e -> new DataAccessException("Failed to execute: " + sql, e));
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Session is closed");
        }
    }

    private void published(String sql, Object[] params) {
        if (engine.statementEvents().hasListeners()) {
            List<Object> parameters = Arrays.asList(params);
            engine.statementEvents().publish(new StatementEvent(sql, parameters, Mode.NON_BLOCKING));
        }
    }

    private static void bindParams(Statement statement, Object[] params) {
        for (int i = 0; i < params.length; i++) {
            Object param = params[i];
            if (param == null) {
                statement.bindNull(i, Object.class);
            } else {
                statement.bind(i, param);
            }
        }
    }
}

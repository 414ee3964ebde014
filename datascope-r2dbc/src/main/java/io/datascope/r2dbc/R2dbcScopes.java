package io.datascope.r2dbc;

import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.Function;

/**
 * Scoped access to non-blocking sessions. Every scope closes its session exactly once,
 * whether the body completes, errors or is cancelled.
 *
 * <pre>{@code
 * R2dbcScopes scopes = new R2dbcScopes(new R2dbcEngineRegistry(config));
 *
 * // commits on completion, rolls back on error or cancellation
 * Mono<Long> inserted = scopes.withTransaction(session ->
 *     session.update("INSERT INTO author(name) VALUES ($1)", "Ursula"));
 *
 * // never commits
 * Flux<String> names = scopes.inSession(session ->
 *     session.query("SELECT name FROM author", (row, meta) -> row.get(0, String.class)));
 * }</pre>
 *
 * <p>No work starts until the returned publisher is subscribed; each subscription opens
 * its own session.
 */
public final class R2dbcScopes {
    private final R2dbcEngineRegistry registry;

    public R2dbcScopes(R2dbcEngineRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Acquires a session the subscriber must close. Builds the engine on first use.
     */
    public Mono<R2dbcSession> openSession() {
        return Mono.defer(() -> registry.getEngine().openSession());
    }

    /**
     * Bare scope: runs the body and closes the session without committing.
     */
    public <T> Flux<T> inSession(Function<R2dbcSession, ? extends Publisher<T>> body) {
        Objects.requireNonNull(body, "body");
        return Flux.usingWhen(openSession(), body, R2dbcSession::close);
    }

    /**
     * Single-value form of {@link #inSession}.
     */
    public <T> Mono<T> withSession(Function<R2dbcSession, ? extends Mono<T>> body) {
        Objects.requireNonNull(body, "body");
        return Mono.usingWhen(openSession(), body, R2dbcSession::close);
    }

    /**
     * Auto-transaction scope: commits when the body completes. On error the session is
     * rolled back and the original error is signalled unchanged; on cancellation the
     * session is rolled back. A failed commit is rolled back and signalled.
     */
    public <T> Flux<T> inTransaction(Function<R2dbcSession, ? extends Publisher<T>> body) {
        Objects.requireNonNull(body, "body");
        return Flux.usingWhen(openSession(), body,
            R2dbcScopes::commitAndClose,
            (session, error) -> session.abandon(),
            R2dbcSession::abandon);
    }

    /**
     * Single-value form of {@link #inTransaction}.
     */
    public <T> Mono<T> withTransaction(Function<R2dbcSession, ? extends Mono<T>> body) {
        Objects.requireNonNull(body, "body");
        return Mono.usingWhen(openSession(), body,
            R2dbcScopes::commitAndClose,
            (session, error) -> session.abandon(),
            R2dbcSession::abandon);
    }

    /**
     * {@link #inTransaction} followed by disposal of the non-blocking engine on every
     * outcome, for one-shot programs that should not leave a pool behind.
     */
    public <T> Flux<T> inStandaloneTransaction(Function<R2dbcSession, ? extends Publisher<T>> body) {
        Objects.requireNonNull(body, "body");
        return Flux.usingWhen(Mono.just(registry), ignored -> inTransaction(body),
            R2dbcEngineRegistry::disposeLater);
    }

    /**
     * The non-blocking engine, built on first subscription. Entry point for introspection
     * such as {@link R2dbcEngine#tableNames()}.
     */
    public Mono<R2dbcEngine> engine() {
        return Mono.fromCallable(registry::getEngine);
    }

    public R2dbcEngineRegistry registry() {
        return registry;
    }

    private static Mono<Void> commitAndClose(R2dbcSession session) {
        return session.commit()
            .onErrorResume(e -> session.abandon().then(Mono.error(e)))
            .then(session.close());
    }
}

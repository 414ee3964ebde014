/**
 * Non-blocking engine on R2DBC, r2dbc-pool and Project Reactor.
 *
 * <p>Mirrors {@code io.datascope.jdbc}: {@link io.datascope.r2dbc.R2dbcEngineRegistry} owns the
 * pool, {@link io.datascope.r2dbc.R2dbcScopes} hands out sessions inside bare or
 * auto-transaction scopes, and {@link io.datascope.r2dbc.R2dbcSession} runs statements.
 * The library starts no threads of its own; suspension happens at connection acquisition
 * and at statement round-trips.
 */
package io.datascope.r2dbc;

/**
 * Blocking engine on JDBC and HikariCP.
 *
 * <ul>
 *   <li>{@link io.datascope.jdbc.JdbcEngineRegistry}: lazy, thread-safe pool lifecycle</li>
 *   <li>{@link io.datascope.jdbc.JdbcScopes}: bare and auto-transaction scopes</li>
 *   <li>{@link io.datascope.jdbc.JdbcSession}: statements on one pooled connection</li>
 * </ul>
 */
package io.datascope.jdbc;

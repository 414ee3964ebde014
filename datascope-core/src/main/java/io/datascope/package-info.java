/**
 * datascope: lazily built JDBC and R2DBC connection pools with scoped sessions,
 * transaction handling and N+1 query detection.
 *
 * <h2>Modules</h2>
 * <ul>
 *   <li>{@code datascope-core}: configuration, URL translation, dialects, engine lifecycle,
 *       statement events and the statement analyzer</li>
 *   <li>{@code datascope-jdbc}: blocking engine on HikariCP</li>
 *   <li>{@code datascope-r2dbc}: non-blocking engine on r2dbc-pool and Reactor</li>
 *   <li>{@code datascope-micrometer}: metrics bridge</li>
 *   <li>{@code datascope-spring-boot-starter}: auto-configuration</li>
 * </ul>
 *
 * @see io.datascope.DatabaseManager
 * @see io.datascope.DataScopeConfig
 */
package io.datascope;

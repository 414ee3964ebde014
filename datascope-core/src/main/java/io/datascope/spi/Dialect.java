package io.datascope.spi;

import io.datascope.url.DatabaseUrl;

/**
 * SPI for database family support.
 *
 * <p>A dialect turns a parsed {@link DatabaseUrl} into the native connection strings of
 * both driver stacks and supplies the catalog SQL used for introspection.
 * Register custom dialects via {@code META-INF/services/io.datascope.spi.Dialect}.
 *
 * <p>Built-in dialects: H2, PostgreSQL, MySQL, SQLite.
 *
 * @see io.datascope.dialect.Dialects
 */
public interface Dialect {

    /**
     * Database family, used as the URL scheme (e.g. "postgresql", "mysql", "h2").
     */
    String name();

    /**
     * Driver suffix of the non-blocking scheme: {@code name() + "+" + nonBlockingDriver()}.
     */
    default String nonBlockingDriver() {
        return "r2dbc";
    }

    /**
     * JDBC URL for the blocking engine. Credentials are not part of the result;
     * the pool receives them separately.
     *
     * @throws IllegalArgumentException if the URL lacks a part this family needs
     */
    String jdbcUrl(DatabaseUrl url);

    /**
     * R2DBC URL for the non-blocking engine, without credentials.
     *
     * @throws IllegalArgumentException if the URL lacks a part this family needs
     */
    String r2dbcUrl(DatabaseUrl url);

    /**
     * SQL returning one column with the names of the user tables in the current schema.
     */
    String listTablesSql();
}

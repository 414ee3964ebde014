package io.datascope.dialect;

import io.datascope.url.DatabaseUrl;

/**
 * SQLite dialect. {@code sqlite://} with no path selects an in-memory database.
 *
 * <p>No R2DBC driver for SQLite is published on Maven Central; the non-blocking URL is
 * produced for completeness and engine construction fails unless one is supplied.
 */
public final class SqliteDialect extends AbstractDialect {
    private static final String MEMORY = ":memory:";

    @Override
    public String name() {
        return "sqlite";
    }

    @Override
    public String jdbcUrl(DatabaseUrl url) {
        return "jdbc:sqlite:" + path(url);
    }

    @Override
    public String r2dbcUrl(DatabaseUrl url) {
        return "r2dbc:sqlite:///" + path(url);
    }

    @Override
    public String listTablesSql() {
        return "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name";
    }

    private static String path(DatabaseUrl url) {
        return url.database() == null ? MEMORY : url.database();
    }
}

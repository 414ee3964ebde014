package io.datascope.dialect;

/**
 * PostgreSQL dialect.
 */
public final class PostgresDialect extends AbstractDialect {

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public String listTablesSql() {
        return "SELECT table_name FROM information_schema.tables "
            + "WHERE table_schema = current_schema() AND table_type = 'BASE TABLE' ORDER BY table_name";
    }
}

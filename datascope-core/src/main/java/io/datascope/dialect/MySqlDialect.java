package io.datascope.dialect;

/**
 * MySQL dialect (also MariaDB servers speaking the MySQL protocol).
 */
public final class MySqlDialect extends AbstractDialect {

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public String listTablesSql() {
        return "SELECT table_name FROM information_schema.tables "
            + "WHERE table_schema = DATABASE() AND table_type = 'BASE TABLE' ORDER BY table_name";
    }
}

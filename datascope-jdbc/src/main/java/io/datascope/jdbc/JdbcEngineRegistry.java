package io.datascope.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.datascope.DataScopeConfig;
import io.datascope.Mode;
import io.datascope.dialect.Dialects;
import io.datascope.engine.AbstractEngineRegistry;
import io.datascope.spi.Dialect;
import io.datascope.spi.MetricsExporter;
import io.datascope.url.DatabaseUrl;
import io.datascope.url.UriTranslator;

/**
 * Registry of the blocking engine. Builds a HikariCP pool from {@link DataScopeConfig}:
 * <ul>
 *   <li>{@code maximumPoolSize = poolSize + maxOverflow}</li>
 *   <li>{@code minimumIdle = poolSize}</li>
 *   <li>{@code connectionTimeout = acquireTimeout} (HikariCP's floor is 250 ms)</li>
 *   <li>{@code maxLifetime = poolRecycle}</li>
 * </ul>
 *
 * <p>The configured URL may be in either form ({@code h2:///mem:x} or {@code h2+r2dbc:///mem:x});
 * the driver suffix is ignored. The pool connects eagerly, so an unreachable database fails
 * {@link #getEngine()}.
 */
public final class JdbcEngineRegistry extends AbstractEngineRegistry<JdbcEngine> {
    static final long MIN_CONNECTION_TIMEOUT_MS = 250;

    public JdbcEngineRegistry(DataScopeConfig config) {
        this(config, MetricsExporter.NOOP);
    }

    public JdbcEngineRegistry(DataScopeConfig config, MetricsExporter metrics) {
        super(Mode.BLOCKING, config, metrics);
    }

    @Override
    protected JdbcEngine createEngine(DataScopeConfig config) {
        DatabaseUrl url = DatabaseUrl.parse(UriTranslator.toBlocking(config.getUrl()));
        Dialect dialect = Dialects.forUrl(url);

        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("datascope-blocking");
        hikari.setJdbcUrl(dialect.jdbcUrl(url));
        if (url.username() != null) {
            hikari.setUsername(url.username());
        }
        if (url.password() != null) {
            hikari.setPassword(url.password());
        }
        hikari.setMaximumPoolSize(config.getMaxPoolSize());
        hikari.setMinimumIdle(config.getPoolSize());
        hikari.setConnectionTimeout(Math.max(MIN_CONNECTION_TIMEOUT_MS, config.getAcquireTimeout().toMillis()));
        hikari.setMaxLifetime(config.getPoolRecycle().toMillis());
        hikari.setAutoCommit(false);

        HikariDataSource dataSource = new HikariDataSource(hikari);
        return new JdbcEngine(dataSource, dialect, config.getPoolSize(), config.getMaxOverflow(),
            config.getAcquireTimeout(), config.getNPlusOneSelectThreshold(), metrics());
    }

    @Override
    protected void closeEngine(JdbcEngine engine) {
        engine.close();
    }
}

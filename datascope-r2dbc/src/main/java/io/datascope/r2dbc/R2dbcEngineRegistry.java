package io.datascope.r2dbc;

import io.datascope.DataScopeConfig;
import io.datascope.Mode;
import io.datascope.dialect.Dialects;
import io.datascope.engine.AbstractEngineRegistry;
import io.datascope.spi.Dialect;
import io.datascope.spi.MetricsExporter;
import io.datascope.url.DatabaseUrl;
import io.datascope.url.UriTranslator;
import io.r2dbc.pool.ConnectionPool;
import io.r2dbc.pool.ConnectionPoolConfiguration;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.ConnectionFactoryOptions;
import reactor.core.publisher.Mono;

import static io.r2dbc.spi.ConnectionFactoryOptions.PASSWORD;
import static io.r2dbc.spi.ConnectionFactoryOptions.USER;

/**
 * Registry of the non-blocking engine. Translates the configured URL with
 * {@link UriTranslator#toNonBlocking} and builds an r2dbc-pool from {@link DataScopeConfig}:
 * <ul>
 *   <li>{@code maxSize = poolSize + maxOverflow}, {@code minIdle = poolSize}</li>
 *   <li>{@code maxAcquireTime = acquireTimeout}</li>
 *   <li>{@code maxLifeTime = poolRecycle}</li>
 * </ul>
 *
 * <p>Prefer {@link #disposeLater()} on reactive threads; {@link #dispose()} blocks until the
 * pool has released its connections.
 */
public final class R2dbcEngineRegistry extends AbstractEngineRegistry<R2dbcEngine> {

    public R2dbcEngineRegistry(DataScopeConfig config) {
        this(config, MetricsExporter.NOOP);
    }

    public R2dbcEngineRegistry(DataScopeConfig config, MetricsExporter metrics) {
        super(Mode.NON_BLOCKING, config, metrics);
    }

    @Override
    protected R2dbcEngine createEngine(DataScopeConfig config) {
        DatabaseUrl url = DatabaseUrl.parse(UriTranslator.toNonBlocking(config.getUrl()));
        Dialect dialect = Dialects.forUrl(url);
        String r2dbcUrl = dialect.r2dbcUrl(url);

        ConnectionFactoryOptions.Builder options = ConnectionFactoryOptions.parse(r2dbcUrl).mutate();
        if (url.username() != null) {
            options.option(USER, url.username());
        }
        if (url.password() != null) {
            options.option(PASSWORD, url.password());
        }
        ConnectionFactory connectionFactory = ConnectionFactories.get(options.build());

        ConnectionPoolConfiguration poolConfig = ConnectionPoolConfiguration.builder(connectionFactory)
            .name("datascope-non-blocking")
            .initialSize(0)
            .minIdle(config.getPoolSize())
            .maxSize(config.getMaxPoolSize())
            .maxAcquireTime(config.getAcquireTimeout())
            .maxLifeTime(config.getPoolRecycle())
            .build();

        return new R2dbcEngine(new ConnectionPool(poolConfig), dialect, r2dbcUrl, config.getPoolSize(),
            config.getMaxOverflow(), config.getAcquireTimeout(), config.getNPlusOneSelectThreshold(), metrics());
    }

    @Override
    protected void closeEngine(R2dbcEngine engine) {
        engine.dispose();
    }

    /**
     * Non-blocking {@link #dispose()}: detaches the live engine immediately and completes
     * once its pool is closed. Close failures are logged, never signalled.
     */
    public Mono<Void> disposeLater() {
        return Mono.defer(() -> {
            R2dbcEngine detached = detach();
            if (detached == null) {
                return Mono.<Void>empty();
            }
            beforeClose(detached);
            return detached.disposeLater()
                .doOnSuccess(v -> closeCompleted(detached, null))
                .onErrorResume(e -> {
                    closeCompleted(detached, e);
                    return Mono.empty();
                });
        });
    }
}

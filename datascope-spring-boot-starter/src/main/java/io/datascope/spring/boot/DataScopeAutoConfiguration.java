package io.datascope.spring.boot;

import com.zaxxer.hikari.HikariDataSource;
import io.datascope.DataScopeConfig;
import io.datascope.DatabaseManager;
import io.datascope.engine.EngineRegistry;
import io.datascope.jdbc.JdbcEngineRegistry;
import io.datascope.jdbc.JdbcScopes;
import io.datascope.r2dbc.R2dbcEngineRegistry;
import io.datascope.r2dbc.R2dbcScopes;
import io.datascope.spi.MetricsExporter;
import io.r2dbc.pool.ConnectionPool;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration for the data-access runtime.
 *
 * <p>Registers one engine registry per mode whose driver stack is on the classpath
 * (HikariCP for blocking, r2dbc-pool for non-blocking), the matching scope managers,
 * and a {@link DatabaseManager} over whichever registries exist. Engines are built
 * lazily on first use and disposed when the context closes.
 *
 * @see DataScopeProperties
 * @see DataScopeMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(DatabaseManager.class)
@EnableConfigurationProperties(DataScopeProperties.class)
public class DataScopeAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DataScopeConfig dataScopeConfig(DataScopeProperties props) {
        return props.toConfig();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(EngineRegistry.class)
    public DatabaseManager databaseManager(ObjectProvider<EngineRegistry<?>> registries) {
        DatabaseManager.Builder builder = DatabaseManager.builder();
        registries.orderedStream().forEach(builder::registry);
        return builder.build();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({JdbcEngineRegistry.class, HikariDataSource.class})
    @ConditionalOnProperty(prefix = "datascope.blocking", name = "enabled", matchIfMissing = true)
    static class BlockingConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public JdbcEngineRegistry jdbcEngineRegistry(
                DataScopeConfig config, ObjectProvider<MetricsExporter> metrics) {
            return new JdbcEngineRegistry(config, metrics.getIfAvailable(() -> MetricsExporter.NOOP));
        }

        @Bean
        @ConditionalOnMissingBean
        public JdbcScopes jdbcScopes(JdbcEngineRegistry registry) {
            return new JdbcScopes(registry);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({R2dbcEngineRegistry.class, ConnectionPool.class})
    @ConditionalOnProperty(prefix = "datascope.non-blocking", name = "enabled", matchIfMissing = true)
    static class NonBlockingConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public R2dbcEngineRegistry r2dbcEngineRegistry(
                DataScopeConfig config, ObjectProvider<MetricsExporter> metrics) {
            return new R2dbcEngineRegistry(config, metrics.getIfAvailable(() -> MetricsExporter.NOOP));
        }

        @Bean
        @ConditionalOnMissingBean
        public R2dbcScopes r2dbcScopes(R2dbcEngineRegistry registry) {
            return new R2dbcScopes(registry);
        }
    }
}

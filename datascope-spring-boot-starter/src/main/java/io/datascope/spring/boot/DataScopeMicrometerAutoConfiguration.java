package io.datascope.spring.boot;

import io.datascope.micrometer.MicrometerMetricsExporter;
import io.datascope.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Publishes engine and session activity of both modes to the application's
 * {@link MeterRegistry}, as {@code <name-prefix>.*} meters tagged with the mode.
 *
 * <p>Ordered ahead of {@link DataScopeAutoConfiguration}: the engine registries look up a
 * {@link MetricsExporter} bean when they are created and fall back to a no-op exporter.
 * Set {@code datascope.metrics.enabled=false} to keep the no-op, or declare your own
 * {@link MetricsExporter} bean to replace this one.
 */
@AutoConfiguration(before = DataScopeAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "datascope.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(DataScopeProperties.class)
public class DataScopeMicrometerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(
            MeterRegistry meterRegistry, DataScopeProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}

/**
 * Micrometer bridge for {@link io.datascope.spi.MetricsExporter}.
 *
 * @see io.datascope.micrometer.MicrometerMetricsExporter
 */
package io.datascope.micrometer;

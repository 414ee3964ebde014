/**
 * Service provider interfaces: database {@link io.datascope.spi.Dialect dialects}
 * and the {@link io.datascope.spi.MetricsExporter metrics hook}.
 */
package io.datascope.spi;

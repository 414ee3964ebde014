/**
 * Built-in {@link io.datascope.spi.Dialect} implementations and the
 * {@link io.datascope.dialect.Dialects} registry.
 *
 * @see io.datascope.dialect.Dialects
 */
package io.datascope.dialect;

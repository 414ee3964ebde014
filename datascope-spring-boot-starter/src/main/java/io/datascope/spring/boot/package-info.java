/**
 * Spring Boot auto-configuration for the data-access runtime.
 *
 * <p>{@link io.datascope.spring.boot.DataScopeAutoConfiguration} binds {@code datascope.*}
 * application properties and exposes the engine registries, scope managers and a
 * {@link io.datascope.DatabaseManager} as beans.
 *
 * @see io.datascope.spring.boot.DataScopeProperties
 * @see io.datascope.spring.boot.DataScopeMicrometerAutoConfiguration
 */
package io.datascope.spring.boot;

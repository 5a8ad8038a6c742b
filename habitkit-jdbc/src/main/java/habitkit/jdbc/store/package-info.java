/**
 * JDBC {@link habitkit.spi.IntegrationStore} dialects for H2, MySQL and PostgreSQL, and
 * their {@link java.util.ServiceLoader}-based detection.
 */
package habitkit.jdbc.store;

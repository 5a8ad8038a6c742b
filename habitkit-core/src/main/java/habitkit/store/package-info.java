/**
 * Built-in {@link habitkit.spi.IntegrationStore} implementations. JDBC stores live in
 * the {@code habitkit-jdbc} module.
 */
package habitkit.store;

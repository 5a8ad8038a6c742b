/**
 * Service provider interfaces for pluggable persistence and metrics.
 *
 * <p>Implement {@link habitkit.spi.IntegrationStore} to persist merged integration
 * state and {@link habitkit.spi.MetricsExporter} to bridge into a metrics backend.
 */
package habitkit.spi;

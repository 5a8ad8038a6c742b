/**
 * Micrometer bridge for exporting dispatch, hook and health metrics to Prometheus,
 * Grafana and other backends.
 *
 * @see habitkit.micrometer.MicrometerMetricsExporter
 */
package habitkit.micrometer;

/**
 * OpenTelemetry metrics adapter and meter provider bootstrap.
 * <p><strong>Metrics:</strong> Instrument names are the {@code MetricsPort} keys prefixed with
 * {@code filedrop.}; the raw key is attached as attribute {@code filedrop.metric.key}.</p>
 */
package ca.gc.cra.filedrop.infrastructure.metrics;

package ca.gc.cra.filedrop.infrastructure.metrics;

import java.util.Locale;
import java.util.Objects;

/**
 * Exporter selection for the OpenTelemetry meter provider.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint; blank falls back to {@code OTEL_EXPORTER_OTLP_ENDPOINT} or
 *     {@code http://localhost:4317}
 * @param resourceAttributes extra {@code key=value,...} resource attributes; blank falls back to
 *     {@code OTEL_RESOURCE_ATTRIBUTES}
 * @since 0.1.0
 */
public record MetricsSettings(String exporter, String endpoint, String resourceAttributes) {

  public MetricsSettings {
    exporter = Objects.requireNonNullElse(exporter, "otlp").trim().toLowerCase(Locale.ROOT);
    endpoint = Objects.requireNonNullElse(endpoint, "").trim();
    resourceAttributes = Objects.requireNonNullElse(resourceAttributes, "").trim();
  }

  /** Settings that disable export entirely. */
  public static MetricsSettings disabled() {
    return new MetricsSettings("none", "", "");
  }

  public boolean enabled() {
    return !"none".equals(exporter);
  }
}

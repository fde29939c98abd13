package ca.gc.cra.diagsink.infrastructure.metrics;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Resolved OpenTelemetry export settings.
 *
 * @param exporter {@code otlp}, {@code none}, or blank to defer to the environment
 * @param endpoint OTLP gRPC endpoint; blank falls back to the environment or {@code http://localhost:4317}
 * @param resourceAttributes comma separated {@code key=value} resource attributes; may be blank
 * @param instanceId value of {@code service.instance.id}; blank uses the local host name
 * @param exportInterval period of the metric reader
 * @since 0.1.0
 */
public record TelemetrySettings(
    String exporter,
    String endpoint,
    String resourceAttributes,
    String instanceId,
    Duration exportInterval) {
  public static final Duration DEFAULT_EXPORT_INTERVAL = Duration.ofSeconds(30);

  public TelemetrySettings {
    exporter = exporter == null || exporter.isBlank() ? "" : exporter.trim().toLowerCase(Locale.ROOT);
    endpoint = Objects.requireNonNullElse(endpoint, "").trim();
    resourceAttributes = Objects.requireNonNullElse(resourceAttributes, "").trim();
    instanceId = Objects.requireNonNullElse(instanceId, "").trim();
    exportInterval = Objects.requireNonNullElse(exportInterval, DEFAULT_EXPORT_INTERVAL);
    if (exportInterval.isNegative() || exportInterval.isZero()) {
      throw new IllegalArgumentException("exportInterval must be positive");
    }
  }

  /**
   * Settings that defer entirely to {@code OTEL_*} environment variables and system properties.
   *
   * @return empty settings
   */
  public static TelemetrySettings fromEnvironment() {
    return new TelemetrySettings("", "", "", "", DEFAULT_EXPORT_INTERVAL);
  }

  /**
   * Settings that turn export off.
   *
   * @return {@code exporter=none} settings
   */
  public static TelemetrySettings disabledSettings() {
    return new TelemetrySettings("none", "", "", "", DEFAULT_EXPORT_INTERVAL);
  }

  public boolean disabled() {
    return "none".equals(exporter);
  }
}

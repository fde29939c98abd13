package ca.gc.cra.diagsink.api;

import ca.gc.cra.diagsink.application.port.MetricsPort;
import ca.gc.cra.diagsink.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.diagsink.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.diagsink.validation.Net;
import ca.gc.cra.diagsink.validation.Numbers;
import ca.gc.cra.diagsink.validation.Strings;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the telemetry keys of the effective configuration into exporter settings and a metrics adapter.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;
  private static final long MIN_EXPORT_INTERVAL_MS = 1_000L;
  private static final long MAX_EXPORT_INTERVAL_MS = 3_600_000L;

  private TelemetryConfigurator() {}

  /**
   * Reads {@code metricsExporter}, {@code otelEndpoint}, {@code otelResourceAttributes} and
   * {@code otelExportIntervalMs}. Blank values defer to the {@code OTEL_*} environment. The
   * configured {@code hostId} becomes the metrics instance id so metrics and uploaded objects
   * name the same host.
   *
   * @param config effective configuration
   * @return validated settings
   * @throws IllegalArgumentException when a value is malformed
   */
  static TelemetrySettings fromConfig(Map<String, String> config) {
    if (config == null || config.isEmpty()) {
      return TelemetrySettings.fromEnvironment();
    }
    String exporter = trim(config.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    String endpoint = trim(config.get("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      endpoint = Net.validateHttpEndpoint("otelEndpoint", endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
    }
    String attributes = trim(config.get("otelResourceAttributes"));
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      log.debug("Configuring OpenTelemetry resource attribute override");
    }
    long intervalMs = Numbers.parseBoundedLong(
        "otelExportIntervalMs",
        config.get("otelExportIntervalMs"),
        TelemetrySettings.DEFAULT_EXPORT_INTERVAL.toMillis(),
        MIN_EXPORT_INTERVAL_MS,
        MAX_EXPORT_INTERVAL_MS);
    return new TelemetrySettings(
        exporter, endpoint, attributes, trim(config.get("hostId")), Duration.ofMillis(intervalMs));
  }

  /**
   * Creates the metrics adapter for the settings. Callers close it when it implements
   * {@link AutoCloseable}.
   *
   * @param settings telemetry settings
   * @return metrics port
   */
  static MetricsPort createMetrics(TelemetrySettings settings) {
    if (settings.disabled()) {
      log.info("Metrics export disabled (metricsExporter=none)");
      return MetricsPort.NO_OP;
    }
    return new OpenTelemetryMetricsAdapter(settings);
  }

  static void closeMetrics(MetricsPort metrics) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}

/**
 * OpenTelemetry export for {@link ca.gc.cra.diagsink.application.port.MetricsPort}: OTLP gRPC with a
 * periodic reader, resource attributes naming the recording host, and a no-op fallback when the
 * exporter cannot start.
 */
package ca.gc.cra.diagsink.infrastructure.metrics;

package ca.gc.cra.diagsink.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for the sink.
 * <p>Explicit settings win over {@code otel.*} system properties, which win over {@code OTEL_*}
 * environment variables. Any failure while building the exporter degrades to a no-op meter so
 * metrics never stop a recording.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String SCOPE = "ca.gc.cra.diagsink";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {}

  static MeterHandle initialize(TelemetrySettings settings) {
    Objects.requireNonNull(settings, "settings");
    String exporter = resolve(settings.exporter(), "otel.metrics.exporter", "OTEL_METRICS_EXPORTER")
        .orElse("otlp");
    if ("none".equalsIgnoreCase(exporter)) {
      log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
      return MeterHandle.noop();
    }
    if (!"otlp".equalsIgnoreCase(exporter)) {
      log.warn("Unknown metrics exporter '{}'; using otlp", exporter);
    }
    String endpoint = resolve(settings.endpoint(), "otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT")
        .orElse(DEFAULT_ENDPOINT);
    String attributes = resolve(settings.resourceAttributes(), "otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES")
        .orElse("");
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(settings.exportInterval())
          .build();
      MeterHandle handle = build(reader, instanceId(settings), parseResourceAttributes(attributes));
      log.info("OpenTelemetry metrics exporting to {} every {} s", endpoint, settings.exportInterval().toSeconds());
      return handle;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop meter", ex);
      return MeterHandle.noop();
    }
  }

  static MeterHandle forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), "test-instance", Attributes.empty());
  }

  private static MeterHandle build(MetricReader reader, String instanceId, Attributes extras) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault()
        .merge(Resource.create(Attributes.of(
            SERVICE_NAME, "diagsink",
            SERVICE_VERSION, version,
            SERVICE_INSTANCE_ID, instanceId)))
        .merge(Resource.create(extras));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(SCOPE).setInstrumentationVersion(version).build();
    return new MeterHandle(meter, provider);
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String entry = token.trim();
      if (entry.isEmpty()) {
        continue;
      }
      int eq = entry.indexOf('=');
      if (eq <= 0 || eq == entry.length() - 1) {
        log.warn("Ignoring malformed resource attribute entry: {}", entry);
        continue;
      }
      builder.put(AttributeKey.stringKey(entry.substring(0, eq).trim()), entry.substring(eq + 1).trim());
    }
    return builder.build();
  }

  private static String instanceId(TelemetrySettings settings) {
    if (!settings.instanceId().isEmpty()) {
      return settings.instanceId();
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Unable to resolve local host name for service.instance.id", ex);
      return "unknown";
    }
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "0.0.0-dev" : version;
  }

  private static Optional<String> resolve(String explicit, String property, String env) {
    return Stream.of(explicit, System.getProperty(property), System.getenv(env))
        .filter(value -> value != null && !value.isBlank())
        .map(String::trim)
        .findFirst();
  }

  /** Meter plus the provider that owns it; the provider is {@code null} for the no-op meter. */
  record MeterHandle(Meter meter, SdkMeterProvider provider) implements AutoCloseable {
    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(SCOPE), null);
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        await(provider.shutdown(), "shutdown");
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }

    private static void await(CompletableResultCode result, String action) {
      result.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics {} did not complete within {} s", action, SHUTDOWN_TIMEOUT_SECONDS);
      }
    }
  }
}

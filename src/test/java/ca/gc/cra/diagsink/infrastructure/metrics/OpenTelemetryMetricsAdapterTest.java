package ca.gc.cra.diagsink.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("sink.rotation.completed");
    adapter.increment("sink.rotation.completed");
    adapter.increment("sink.rotation.completed");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "sink.rotation.completed").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("sink.rotation.completed",
        point.getAttributes().get(AttributeKey.stringKey("diagsink.metric.key")));
    assertEquals("diagsink", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("test-instance",
        counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id")));
    assertFalse(adapter.isNoop());
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("sink.upload.bytes", 100L);
    adapter.observe("sink.upload.bytes", 300L);

    MetricData histogram = find(reader.collectAllMetrics(), "sink.upload.bytes").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(400.0, point.getSum());
  }

  @Test
  void sanitizesMetricNames() {
    assertEquals("sink.append_dropped", OpenTelemetryMetricsAdapter.sanitizeName(" Sink.Append Dropped "));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("diagsink.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void disabledExporterYieldsNoopAdapter() {
    OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(TelemetrySettings.disabledSettings());
    noop.increment("sink.append.written");
    assertTrue(noop.isNoop());
    noop.close();
  }

  @Test
  void parsesResourceAttributesAndSkipsMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=lab, run = 7,broken,=x");
    assertEquals("lab", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("7", attributes.get(AttributeKey.stringKey("run")));
    assertEquals(2, attributes.size());
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}

package ca.gc.cra.diagsink.config;

import ca.gc.cra.diagsink.application.port.LatencyEventSource;
import ca.gc.cra.diagsink.application.port.MetricsPort;
import ca.gc.cra.diagsink.application.port.ObjectStorePort;
import ca.gc.cra.diagsink.application.sink.DiagnosticSink;
import ca.gc.cra.diagsink.application.sink.RotatingSegmentWriter;
import ca.gc.cra.diagsink.application.sink.RotationMonitor;
import ca.gc.cra.diagsink.application.sink.SegmentCatalog;
import ca.gc.cra.diagsink.application.sink.SegmentUploader;
import ca.gc.cra.diagsink.application.sink.UploadCoordinator;
import ca.gc.cra.diagsink.domain.segment.SegmentNaming;
import ca.gc.cra.diagsink.infrastructure.events.KafkaLatencyEventSource;
import ca.gc.cra.diagsink.infrastructure.storage.DirectoryObjectStoreAdapter;
import ca.gc.cra.diagsink.infrastructure.storage.DisabledObjectStoreAdapter;
import ca.gc.cra.diagsink.infrastructure.storage.S3ObjectStoreAdapter;
import java.io.IOException;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires sink components from a {@link SinkConfig}.
 * <p><strong>Why:</strong> Keeps adapter selection (S3, directory, Kafka) in one place so CLIs and
 * embedding benchmarks build identical graphs.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final SinkConfig config;
  private final MetricsPort metrics;

  public CompositionRoot(SinkConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public SinkConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public SegmentNaming naming() {
    return new SegmentNaming(config.fileBase());
  }

  /**
   * Creates the object store selected by {@code storeMode}. The S3 client is built on first upload.
   *
   * @return object store
   * @throws IOException if the directory store cannot be created
   */
  public ObjectStorePort objectStore() throws IOException {
    return switch (config.storeMode()) {
      case S3 -> S3ObjectStoreAdapter.create(
          config.bucket(),
          config.s3Region().orElse(null),
          config.s3Endpoint().orElse(null),
          config.createBucket());
      case DIRECTORY -> new DirectoryObjectStoreAdapter(config.storeDirectory().orElseThrow());
      case NONE -> new DisabledObjectStoreAdapter();
    };
  }

  /**
   * Creates an uploader for the configured segment directory.
   *
   * @param store destination store
   * @return uploader
   */
  public SegmentUploader segmentUploader(ObjectStorePort store) {
    SegmentCatalog catalog = new SegmentCatalog(config.outputDirectory(), naming());
    return new SegmentUploader(catalog, store, metrics, config.hostId(), config.storePrefix());
  }

  /**
   * Opens the writer and assembles the sink. The monitor is not started.
   *
   * @param store destination store for {@link DiagnosticSink#uploadDiagnostics()}
   * @return sink ready to {@link DiagnosticSink#start()}
   * @throws IOException if the base segment cannot be opened
   */
  public DiagnosticSink diagnosticSink(ObjectStorePort store) throws IOException {
    RotatingSegmentWriter writer = new RotatingSegmentWriter(config.outputDirectory(), naming(), metrics);
    RotationMonitor monitor = new RotationMonitor(
        writer, metrics, config.rotateBytes(), config.checkInterval(), config.reclaimInterval());
    UploadCoordinator coordinator = new UploadCoordinator(writer, segmentUploader(store));
    return new DiagnosticSink(writer, monitor, coordinator, metrics);
  }

  /**
   * Creates the Kafka latency event source.
   *
   * @return event source subscribed to {@code kafkaTopic}
   * @throws IllegalStateException if {@code kafkaBootstrap} is not configured
   */
  public LatencyEventSource kafkaEventSource() {
    String bootstrap = config.kafkaBootstrap()
        .orElseThrow(() -> new IllegalStateException("kafkaBootstrap is not configured"));
    return new KafkaLatencyEventSource(bootstrap, config.kafkaTopic(), metrics);
  }
}

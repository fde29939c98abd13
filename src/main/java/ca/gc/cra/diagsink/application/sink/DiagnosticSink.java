package ca.gc.cra.diagsink.application.sink;

import ca.gc.cra.diagsink.application.port.LatencyEventListener;
import ca.gc.cra.diagsink.application.port.MetricsPort;
import ca.gc.cra.diagsink.domain.event.LatencyEvent;
import ca.gc.cra.diagsink.domain.segment.UploadReport;
import ca.gc.cra.diagsink.logging.Logs;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Listener that records latency events to rotating segments and uploads them
 * at the end of a run.
 * <p><strong>Why:</strong> A failing disk must never stall or crash the benchmark. Append failures
 * are logged and the record is dropped; nothing is retried on the emitting thread.</p>
 * <p><strong>Role:</strong> Facade over {@link RotatingSegmentWriter}, {@link RotationMonitor}, and
 * {@link UploadCoordinator}, wired by {@code CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> {@link #onEvent(LatencyEvent)} is safe from any number of threads;
 * lifecycle methods are meant for a single controlling thread.</p>
 * <p><strong>Observability:</strong> Drops are counted as {@code sink.append.dropped}; the first drop
 * and every {@value #DROP_LOG_INTERVAL}th after it are logged at WARN.</p>
 *
 * @since 0.1.0
 */
public final class DiagnosticSink implements LatencyEventListener, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DiagnosticSink.class);

  static final long DROP_LOG_INTERVAL = 1_000L;

  private final RotatingSegmentWriter writer;
  private final RotationMonitor monitor;
  private final UploadCoordinator coordinator;
  private final MetricsPort metrics;
  private final AtomicLong dropped = new AtomicLong();

  public DiagnosticSink(
      RotatingSegmentWriter writer,
      RotationMonitor monitor,
      UploadCoordinator coordinator,
      MetricsPort metrics) {
    this.writer = Objects.requireNonNull(writer, "writer");
    this.monitor = Objects.requireNonNull(monitor, "monitor");
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /** Starts the rotation monitor. */
  public void start() {
    monitor.start();
  }

  @Override
  public void onEvent(LatencyEvent event) {
    if (event == null) {
      return;
    }
    try {
      writer.append(event);
    } catch (IOException | RuntimeException ex) {
      metrics.increment(MetricsPort.APPEND_DROPPED);
      long count = dropped.incrementAndGet();
      if (Logs.sampled(count, DROP_LOG_INTERVAL)) {
        log.warn(
            "Dropped diagnostics record ({} dropped so far): {}",
            count,
            Logs.preview(event.toLine()),
            ex);
      }
    }
  }

  /**
   * Stops the monitor, drains the writer, and uploads every local segment.
   * <p>A failure to close the active segment is logged and the upload still runs, shipping
   * whatever reached the disk.</p>
   *
   * @return upload outcomes
   * @throws IOException if the segment directory cannot be listed
   */
  public UploadReport uploadDiagnostics() throws IOException {
    monitor.stop();
    drain();
    return coordinator.uploadAll();
  }

  /**
   * Stops the monitor and drains the writer without uploading. Idempotent.
   */
  @Override
  public void close() {
    monitor.stop();
    if (coordinator.state() == SinkState.RECORDING) {
      drain();
    }
  }

  private void drain() {
    try {
      coordinator.flush();
    } catch (IOException ex) {
      log.error("Failed to close active diagnostics segment in {}", writer.directory(), ex);
    }
  }

  public long droppedCount() {
    return dropped.get();
  }

  public SinkState state() {
    return coordinator.state();
  }

  public RotatingSegmentWriter writer() {
    return writer;
  }

  public RotationMonitor monitor() {
    return monitor;
  }
}

package ca.gc.cra.diagsink.application.sink;

import ca.gc.cra.diagsink.domain.segment.UploadReport;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Drains the writer and ships its segments to object storage.
 * <p><strong>Why:</strong> Segments are only complete once every handle that wrote to them is closed;
 * uploading earlier would ship truncated buffers.</p>
 * <p><strong>Role:</strong> Owns the sink state machine
 * {@code RECORDING -> DRAINING -> UPLOADED}. The move out of {@code RECORDING} is one way.</p>
 * <p><strong>Thread-safety:</strong> {@link #flush()} may race with the monitor's rotation and reclaim;
 * {@link #uploadAll()} is intended for a single end-of-run caller.</p>
 *
 * @since 0.1.0
 */
public final class UploadCoordinator {
  private static final Logger log = LoggerFactory.getLogger(UploadCoordinator.class);

  private final RotatingSegmentWriter writer;
  private final SegmentUploader uploader;
  private final AtomicReference<SinkState> state = new AtomicReference<>(SinkState.RECORDING);
  private volatile UploadReport lastReport;

  public UploadCoordinator(RotatingSegmentWriter writer, SegmentUploader uploader) {
    this.writer = Objects.requireNonNull(writer, "writer");
    this.uploader = Objects.requireNonNull(uploader, "uploader");
  }

  /**
   * Drains the writer: refuses further rotations, closes retired segments, then the active one.
   * Moves the sink to {@link SinkState#DRAINING}. Safe while the monitor is still ticking. Repeated
   * calls retry retired segments that failed to close and are otherwise harmless.
   *
   * @throws IOException if the active segment fails to close
   */
  public void flush() throws IOException {
    if (state.compareAndSet(SinkState.RECORDING, SinkState.DRAINING)) {
      log.info("Draining diagnostics writer in {}", writer.directory());
    }
    ReclaimResult reclaimed = writer.drain();
    if (reclaimed.failed() > 0) {
      log.warn("{} retired segment(s) failed to close during drain", reclaimed.remaining());
    }
  }

  /**
   * Uploads every local segment. Allowed after {@link #flush()}; may be rerun after a partial failure.
   * Segments whose handle is still open are reported as failures.
   *
   * @return per-file outcomes
   * @throws IllegalStateException if the writer has not been flushed
   * @throws IOException if the segment directory cannot be listed
   */
  public UploadReport uploadAll() throws IOException {
    SinkState current = state.get();
    if (current == SinkState.RECORDING) {
      throw new IllegalStateException("flush() must be called before uploadAll()");
    }
    Set<Long> open = writer.openSequences();
    if (!open.isEmpty()) {
      log.warn("Segment(s) {} are still open and will be reported as failed", open);
    }
    UploadReport report = uploader.uploadAll(open);
    lastReport = report;
    state.set(SinkState.UPLOADED);
    return report;
  }

  public SinkState state() {
    return state.get();
  }

  /**
   * Returns the report of the most recent upload.
   *
   * @return last report, or empty before the first upload
   */
  public Optional<UploadReport> lastReport() {
    return Optional.ofNullable(lastReport);
  }
}

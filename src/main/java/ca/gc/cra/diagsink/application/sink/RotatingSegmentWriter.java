package ca.gc.cra.diagsink.application.sink;

import ca.gc.cra.diagsink.application.port.MetricsPort;
import ca.gc.cra.diagsink.domain.event.LatencyEvent;
import ca.gc.cra.diagsink.domain.segment.SegmentInfo;
import ca.gc.cra.diagsink.domain.segment.SegmentNaming;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns the active append-only segment and swaps it for a fresh one on rotation.
 * <p><strong>Why:</strong> Benchmark threads emit latency events at high rates; the sink must never
 * interleave lines, lose a record across a rotation, or stall producers on file creation.</p>
 * <p><strong>Role:</strong> Application-layer writer shared by producers, the {@link RotationMonitor},
 * and the {@link UploadCoordinator}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serialize whole-line appends to the active segment.</li>
 *   <li>Publish a new active segment atomically and retire the previous one.</li>
 *   <li>Close retired segments on request, keeping failures for the next attempt.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All public methods are safe for concurrent use. The active
 * segment is an {@link AtomicReference}; retired segments live in a concurrent set.</p>
 * <p><strong>Performance:</strong> Producers only contend on the active segment's monitor. Opening the
 * next file happens before the reference swap, so appends never wait on file creation.</p>
 *
 * @since 0.1.0
 */
public final class RotatingSegmentWriter {
  private static final Logger log = LoggerFactory.getLogger(RotatingSegmentWriter.class);

  private final Path directory;
  private final SegmentNaming naming;
  private final MetricsPort metrics;
  private final SegmentOpener opener;

  private final AtomicReference<SegmentHandle> active = new AtomicReference<>();
  private final Set<SegmentHandle> retired = ConcurrentHashMap.newKeySet();
  private final Object rotationLock = new Object();

  // Guarded by rotationLock.
  private long nextSequence = 1L;
  private volatile boolean drained;

  /**
   * Opens the base segment in {@code directory}, appending to it when it already exists.
   *
   * @param directory segment directory; created if absent
   * @param naming local naming rules
   * @param metrics metrics sink
   * @throws IOException if the directory or the base segment cannot be opened
   */
  public RotatingSegmentWriter(Path directory, SegmentNaming naming, MetricsPort metrics)
      throws IOException {
    this(directory, naming, metrics, SegmentOpener.FILES);
  }

  RotatingSegmentWriter(Path directory, SegmentNaming naming, MetricsPort metrics, SegmentOpener opener)
      throws IOException {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.naming = Objects.requireNonNull(naming, "naming");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.opener = Objects.requireNonNull(opener, "opener");
    Files.createDirectories(directory);
    Path basePath = directory.resolve(naming.fileName(0L));
    long existing = Files.exists(basePath) ? Files.size(basePath) : 0L;
    OutputStream out = opener.open(basePath, true);
    active.set(new SegmentHandle(basePath, 0L, out, existing));
    log.info("Opened diagnostics segment {} ({} bytes already present)", basePath, existing);
  }

  /**
   * Appends one record and a trailing newline to the active segment.
   * <p>If the segment observed by this call is retired and closed before the write acquires its
   * lock, the record is written to the segment that replaced it. Every record lands in exactly one
   * segment.</p>
   *
   * @param record record bytes without the trailing newline; must not be {@code null}
   * @throws SegmentClosedException if the writer has drained
   * @throws IOException if the disk write fails
   */
  public void append(byte[] record) throws IOException {
    Objects.requireNonNull(record, "record");
    while (true) {
      SegmentHandle handle = active.get();
      if (handle.write(record)) {
        metrics.increment(MetricsPort.APPEND_WRITTEN);
        metrics.observe(MetricsPort.APPEND_BYTES, record.length + 1L);
        return;
      }
      if (active.get() == handle) {
        throw new SegmentClosedException("Diagnostics writer drained; record rejected");
      }
      // Lost the race with a rotation and a reclaim; retry against the new active segment.
    }
  }

  /**
   * Appends a latency event rendered as {@code "<latency> ; <diagnostics>"}.
   *
   * @param event event to write; must not be {@code null}
   * @throws IOException if the append fails
   */
  public void append(LatencyEvent event) throws IOException {
    append(Objects.requireNonNull(event, "event").toLineBytes());
  }

  /**
   * Creates the next segment, publishes it as active, and retires the previous one.
   *
   * @return snapshot of the new active segment
   * @throws RotationException if the writer has drained or the new file cannot be opened; the
   *     previous segment stays active
   */
  public SegmentInfo rotate() throws RotationException {
    synchronized (rotationLock) {
      if (drained) {
        throw new RotationException("Diagnostics writer drained; rotation refused");
      }
      long sequence = nextSequence;
      Path path = directory.resolve(naming.fileName(sequence));
      SegmentHandle next;
      try {
        next = new SegmentHandle(path, sequence, opener.open(path, false), 0L);
      } catch (IOException | RuntimeException ex) {
        throw new RotationException("Failed to create diagnostics segment " + path, ex);
      }
      SegmentHandle previous = active.getAndSet(next);
      retired.add(previous);
      nextSequence = sequence + 1;
      metrics.increment(MetricsPort.ROTATION_COMPLETED);
      log.info("Rotated diagnostics segment {} -> {}", previous.path(), path);
      return next.info();
    }
  }

  /**
   * Returns a lock-free snapshot of the active segment. The size may trail concurrent appends.
   *
   * @return active segment snapshot
   */
  public SegmentInfo currentSegmentInfo() {
    return active.get().info();
  }

  /**
   * Closes every retired segment once. Segments that close are removed; segments whose close fails
   * stay retired for the next pass. Safe to run concurrently with itself.
   *
   * @return counts for this pass
   */
  public ReclaimResult reclaimRetired() {
    if (retired.isEmpty()) {
      return ReclaimResult.NONE;
    }
    int closed = 0;
    int failed = 0;
    for (SegmentHandle handle : retired) {
      try {
        handle.close();
        if (retired.remove(handle)) {
          closed++;
          metrics.increment(MetricsPort.RECLAIM_CLOSED);
          log.debug("Closed retired diagnostics segment {}", handle.path());
        }
      } catch (IOException | RuntimeException ex) {
        failed++;
        metrics.increment(MetricsPort.RECLAIM_FAILED);
        log.warn("Failed to close retired diagnostics segment {}; will retry", handle.path(), ex);
      }
    }
    return new ReclaimResult(closed, failed, retired.size());
  }

  /**
   * Closes the active segment and ends the writing phase. Later appends fail with
   * {@link SegmentClosedException} and later rotations are refused. Idempotent.
   *
   * @throws IOException if the active segment fails to close
   */
  public void closeActive() throws IOException {
    SegmentHandle handle;
    synchronized (rotationLock) {
      drained = true;
      handle = active.get();
    }
    handle.close();
    log.info("Closed active diagnostics segment {}", handle.path());
  }

  /**
   * Ends the writing phase in one step: refuses further rotations, closes every retired segment and
   * then the active one. A rotation already holding the rotation lock completes first, so its
   * retired segment is part of this reclaim pass.
   *
   * @return reclaim counts for the retired segments
   * @throws IOException if the active segment fails to close
   */
  public ReclaimResult drain() throws IOException {
    SegmentHandle handle;
    synchronized (rotationLock) {
      drained = true;
      handle = active.get();
    }
    ReclaimResult reclaimed = reclaimRetired();
    handle.close();
    log.info("Drained diagnostics writer; closed active segment {}", handle.path());
    return reclaimed;
  }

  /**
   * Sequences of segments whose handle is still open: retired segments that failed to close, and
   * the active segment until it is closed. Their files may miss buffered records.
   *
   * @return open sequences in increasing order
   */
  public Set<Long> openSequences() {
    Set<Long> open = new TreeSet<>();
    for (SegmentHandle handle : retired) {
      open.add(handle.sequence());
    }
    SegmentHandle current = active.get();
    if (!current.isClosed()) {
      open.add(current.sequence());
    }
    return open;
  }

  /**
   * Flushes buffered bytes of the active segment to the file.
   *
   * @throws IOException if flushing fails
   */
  public void flush() throws IOException {
    active.get().flush();
  }

  public boolean isDrained() {
    return drained;
  }

  public int retiredCount() {
    return retired.size();
  }

  public Path directory() {
    return directory;
  }

  public SegmentNaming naming() {
    return naming;
  }
}

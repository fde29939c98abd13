package ca.gc.cra.diagsink.application.sink;

import ca.gc.cra.diagsink.application.port.MetricsPort;
import ca.gc.cra.diagsink.domain.segment.SegmentInfo;
import ca.gc.cra.diagsink.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that rotates the active segment once it crosses the size threshold and closes
 * retired segments on its own cadence.
 * <p>One scheduler thread ticks at the check interval. Each tick reads the active segment, rotates
 * when {@code size >= rotateBytes}, then reclaims retired segments when the reclaim interval has
 * elapsed. Every step is guarded; a failing step is logged and counted and the next tick still
 * runs.</p>
 * <p>{@link #stop()} is observed between ticks: a rotation in progress completes before the
 * scheduler thread exits.</p>
 *
 * @since 0.1.0
 */
public final class RotationMonitor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RotationMonitor.class);

  static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final RotatingSegmentWriter writer;
  private final MetricsPort metrics;
  private final long rotateBytes;
  private final Duration checkInterval;
  private final long reclaimIntervalNanos;
  private final LongSupplier nanoClock;
  private final Object tickLock = new Object();

  // Guarded by tickLock.
  private long lastReclaimAt;
  private ScheduledExecutorService scheduler;
  private volatile boolean stopRequested;

  /**
   * Creates a monitor.
   *
   * @param writer writer to rotate and reclaim
   * @param metrics metrics sink
   * @param rotateBytes rotation threshold in bytes; must be positive
   * @param checkInterval tick interval; must be positive
   * @param reclaimInterval minimum time between reclaim passes; zero reclaims on every tick
   */
  public RotationMonitor(
      RotatingSegmentWriter writer,
      MetricsPort metrics,
      long rotateBytes,
      Duration checkInterval,
      Duration reclaimInterval) {
    this(writer, metrics, rotateBytes, checkInterval, reclaimInterval, System::nanoTime);
  }

  RotationMonitor(
      RotatingSegmentWriter writer,
      MetricsPort metrics,
      long rotateBytes,
      Duration checkInterval,
      Duration reclaimInterval,
      LongSupplier nanoClock) {
    this.writer = Objects.requireNonNull(writer, "writer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (rotateBytes <= 0) {
      throw new IllegalArgumentException("rotateBytes must be positive");
    }
    Objects.requireNonNull(checkInterval, "checkInterval");
    Objects.requireNonNull(reclaimInterval, "reclaimInterval");
    if (checkInterval.isZero() || checkInterval.isNegative()) {
      throw new IllegalArgumentException("checkInterval must be positive");
    }
    if (reclaimInterval.isNegative()) {
      throw new IllegalArgumentException("reclaimInterval must not be negative");
    }
    this.rotateBytes = rotateBytes;
    this.checkInterval = checkInterval;
    this.reclaimIntervalNanos = reclaimInterval.toNanos();
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    this.lastReclaimAt = nanoClock.getAsLong();
  }

  /**
   * Starts periodic ticks. Calling start on a running monitor has no effect.
   *
   * @throws IllegalStateException if the monitor was stopped
   */
  public void start() {
    synchronized (tickLock) {
      if (stopRequested) {
        throw new IllegalStateException("Rotation monitor already stopped");
      }
      if (scheduler != null) {
        return;
      }
      scheduler = ExecutorFactories.newMonitorScheduler(
          "diagsink-monitor",
          (thread, ex) -> log.error("Uncaught exception in rotation monitor thread {}", thread.getName(), ex));
      long intervalMillis = Math.max(1L, checkInterval.toMillis());
      scheduler.scheduleWithFixedDelay(this::tick, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }
    log.info(
        "Rotation monitor started (rotateBytes={}, checkInterval={} ms, reclaimInterval={} ms)",
        rotateBytes,
        checkInterval.toMillis(),
        TimeUnit.NANOSECONDS.toMillis(reclaimIntervalNanos));
  }

  /**
   * Runs one tick on the calling thread.
   *
   * @return {@code true} when the tick rotated the active segment
   */
  public boolean runOnce() {
    synchronized (tickLock) {
      if (stopRequested) {
        return false;
      }
      boolean rotated = checkSize();
      maybeReclaim();
      return rotated;
    }
  }

  private void tick() {
    try {
      runOnce();
    } catch (RuntimeException ex) {
      metrics.increment(MetricsPort.MONITOR_TICK_FAILED);
      log.error("Rotation monitor tick failed; continuing", ex);
    }
  }

  private boolean checkSize() {
    if (writer.isDrained()) {
      return false;
    }
    try {
      SegmentInfo info = writer.currentSegmentInfo();
      if (info.approximateSize() < rotateBytes) {
        return false;
      }
      log.debug("Segment {} reached {} bytes (threshold {})", info.path(), info.approximateSize(), rotateBytes);
      writer.rotate();
      return true;
    } catch (RotationException ex) {
      metrics.increment(MetricsPort.ROTATION_FAILED);
      log.error("Rotation failed; keeping current segment", ex);
    } catch (RuntimeException ex) {
      metrics.increment(MetricsPort.MONITOR_TICK_FAILED);
      log.error("Rotation check failed", ex);
    }
    return false;
  }

  private void maybeReclaim() {
    long now = nanoClock.getAsLong();
    if (now - lastReclaimAt < reclaimIntervalNanos) {
      return;
    }
    lastReclaimAt = now;
    try {
      ReclaimResult result = writer.reclaimRetired();
      if (result.failed() > 0) {
        log.warn("Reclaim left {} retired segment(s) open", result.remaining());
      }
    } catch (RuntimeException ex) {
      metrics.increment(MetricsPort.MONITOR_TICK_FAILED);
      log.error("Reclaim pass failed", ex);
    }
  }

  /**
   * Cancels future ticks and waits for an in-flight tick to finish. Idempotent.
   */
  public void stop() {
    stopRequested = true;
    ScheduledExecutorService executor;
    synchronized (tickLock) {
      executor = scheduler;
      scheduler = null;
    }
    if (executor == null) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Rotation monitor still running after {} ms; forcing shutdown", SHUTDOWN_TIMEOUT.toMillis());
        executor.shutdownNow();
      }
    } catch (InterruptedException ie) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    log.info("Rotation monitor stopped");
  }

  public boolean isStopped() {
    return stopRequested;
  }

  @Override
  public void close() {
    stop();
  }
}

package ca.gc.cra.diagsink.domain.segment;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Point-in-time view of the active segment used by the rotation monitor.
 *
 * @param path segment file path
 * @param sequence monotonic sequence index; the base segment is {@code 0}
 * @param approximateSize bytes written so far; read without the append lock
 * @since 0.1.0
 */
public record SegmentInfo(Path path, long sequence, long approximateSize) {
  public SegmentInfo {
    Objects.requireNonNull(path, "path");
    if (sequence < 0) {
      throw new IllegalArgumentException("sequence must not be negative");
    }
  }
}

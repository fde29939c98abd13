package ca.gc.cra.diagsink.domain.event;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Immutable latency observation emitted by a running benchmark.
 * <p><strong>Why:</strong> The sink persists the two payload columns verbatim; their meaning belongs to the benchmark.</p>
 * <p><strong>Role:</strong> Domain value delivered through {@link ca.gc.cra.diagsink.application.port.LatencyEventListener}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe across threads.</p>
 *
 * @param latency first payload column, typically the request latency
 * @param diagnostics second payload column, typically the client diagnostics string
 * @since 0.1.0
 */
public record LatencyEvent(String latency, String diagnostics) {
  /** Column separator written between the two payload fields. */
  public static final String SEPARATOR = " ; ";

  /**
   * Replaces {@code null} columns with empty text.
   */
  public LatencyEvent {
    latency = latency == null ? "" : latency;
    diagnostics = diagnostics == null ? "" : diagnostics;
  }

  /**
   * Renders the event as a single segment line without the trailing newline.
   *
   * @return {@code "<latency> ; <diagnostics>"}
   */
  public String toLine() {
    return latency + SEPARATOR + diagnostics;
  }

  /**
   * Encodes {@link #toLine()} as UTF-8.
   *
   * @return encoded line bytes
   */
  public byte[] toLineBytes() {
    return toLine().getBytes(StandardCharsets.UTF_8);
  }
}

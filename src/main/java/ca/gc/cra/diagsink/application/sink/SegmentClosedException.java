package ca.gc.cra.diagsink.application.sink;

import java.io.IOException;

/**
 * Raised when a record is appended after the writer has drained.
 *
 * @since 0.1.0
 */
public final class SegmentClosedException extends IOException {
  private static final long serialVersionUID = 1L;

  public SegmentClosedException(String message) {
    super(message);
  }
}

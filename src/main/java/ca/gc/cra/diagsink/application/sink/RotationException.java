package ca.gc.cra.diagsink.application.sink;

import java.io.IOException;

/**
 * Raised when a new segment cannot be opened. The previous segment stays active.
 *
 * @since 0.1.0
 */
public final class RotationException extends IOException {
  private static final long serialVersionUID = 1L;

  public RotationException(String message) {
    super(message);
  }

  public RotationException(String message, Throwable cause) {
    super(message, cause);
  }
}

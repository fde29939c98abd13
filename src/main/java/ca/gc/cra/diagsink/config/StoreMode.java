package ca.gc.cra.diagsink.config;

import java.util.Locale;

/**
 * Destination for uploaded segments.
 *
 * @since 0.1.0
 */
public enum StoreMode {
  /** Amazon S3 or an S3 compatible endpoint. */
  S3,
  /** Local directory; segments are copied. */
  DIRECTORY,
  /** Uploads disabled; segments stay on local disk. */
  NONE;

  /**
   * Parses a case-insensitive mode name.
   *
   * @param value raw value; {@code null} or blank yields {@link #S3}
   * @return parsed mode
   * @throws IllegalArgumentException if the value names no mode
   */
  public static StoreMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return S3;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "S3" -> S3;
      case "DIRECTORY", "DIR", "FILE" -> DIRECTORY;
      case "NONE", "OFF" -> NONE;
      default -> throw new IllegalArgumentException("storeMode must be S3, DIRECTORY, or NONE (was " + value + ")");
    };
  }
}

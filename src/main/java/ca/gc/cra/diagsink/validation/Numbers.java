package ca.gc.cra.diagsink.validation;

/**
 * Numeric validation for sink configuration (thresholds, intervals, ports).
 * <p>Stateless; violations raise {@link IllegalArgumentException} with the parameter name.</p>
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal long and checks its range.
   *
   * @param name parameter name included in diagnostics
   * @param raw candidate text; {@code null} or blank yields {@code defaultValue}
   * @param defaultValue value used when {@code raw} is blank
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer in range
   */
  public static long parseBoundedLong(String name, String raw, long defaultValue, long min, long max) {
    if (raw == null || raw.isBlank()) {
      return requireRange(name, defaultValue, min, max);
    }
    try {
      return requireRange(name, Long.parseLong(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer between " + min + " and " + max, ex);
    }
  }
}

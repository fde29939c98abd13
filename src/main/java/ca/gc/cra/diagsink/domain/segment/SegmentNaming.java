package ca.gc.cra.diagsink.domain.segment;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Local file layout for rotated segments.
 * <p><strong>Why:</strong> Keeps the writer, the catalog, and the uploader agreeing on which files belong to a sink.</p>
 * <p>Sequence {@code 0} is the base name itself. The segment created by the k-th rotation has
 * sequence {@code k} and is named {@code <base>-<k-1>}, so rotation suffixes start at zero.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class SegmentNaming {
  private final String baseName;

  /**
   * Creates naming rules for the given base file name.
   *
   * @param baseName base segment file name; must not be blank or contain path separators
   * @throws IllegalArgumentException if {@code baseName} is blank or contains a separator
   */
  public SegmentNaming(String baseName) {
    Objects.requireNonNull(baseName, "baseName");
    String trimmed = baseName.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("baseName must not be blank");
    }
    if (trimmed.indexOf('/') >= 0 || trimmed.indexOf('\\') >= 0) {
      throw new IllegalArgumentException("baseName must be a file name, not a path: " + baseName);
    }
    this.baseName = trimmed;
  }

  public String baseName() {
    return baseName;
  }

  /**
   * Returns the file name for a sequence index.
   *
   * @param sequence sequence index; must be non-negative
   * @return local file name
   */
  public String fileName(long sequence) {
    if (sequence < 0) {
      throw new IllegalArgumentException("sequence must not be negative");
    }
    return sequence == 0 ? baseName : baseName + "-" + (sequence - 1);
  }

  /**
   * Parses a file name produced by {@link #fileName(long)}.
   *
   * @param fileName candidate file name; {@code null} yields empty
   * @return sequence index, or empty when the name is not one of this sink's segments
   */
  public OptionalLong sequenceOf(String fileName) {
    if (fileName == null) {
      return OptionalLong.empty();
    }
    if (fileName.equals(baseName)) {
      return OptionalLong.of(0L);
    }
    String prefix = baseName + "-";
    if (!fileName.startsWith(prefix) || fileName.length() == prefix.length()) {
      return OptionalLong.empty();
    }
    String suffix = fileName.substring(prefix.length());
    for (int i = 0; i < suffix.length(); i++) {
      if (!Character.isDigit(suffix.charAt(i))) {
        return OptionalLong.empty();
      }
    }
    // Leading zeros would alias another segment.
    if (suffix.length() > 1 && suffix.charAt(0) == '0') {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Math.addExact(Long.parseLong(suffix), 1L));
    } catch (NumberFormatException | ArithmeticException ex) {
      // Too large to be a segment this writer produced.
      return OptionalLong.empty();
    }
  }
}

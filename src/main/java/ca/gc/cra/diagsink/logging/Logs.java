package ca.gc.cra.diagsink.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Keeps benchmark payloads short and single-line in operator logs.
 * <p><strong>Why:</strong> Client diagnostics strings can run to kilobytes and may carry line breaks; a
 * dropped or malformed record is logged as a bounded one-line preview.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so truncating mid-codepoint never throws.
 * @since 0.1.0
 */
public final class Logs {
  /** Default preview budget for record payloads. */
  public static final int DEFAULT_PREVIEW_BYTES = 256;

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * One-line preview of a record payload: line breaks and tabs escaped, cut to
   * {@link #DEFAULT_PREVIEW_BYTES}.
   *
   * @param payload record text; may be {@code null}
   * @return loggable preview
   */
  public static String preview(String payload) {
    if (payload == null) {
      return NULL_PLACEHOLDER;
    }
    return truncate(escapeControls(payload), DEFAULT_PREVIEW_BYTES);
  }

  /**
   * Sampling gate for repeated warnings: true for the first occurrence and every
   * {@code interval}-th after it.
   *
   * @param occurrence 1-based occurrence count
   * @param interval sampling interval; must be positive
   * @return {@code true} when this occurrence should be logged
   */
  public static boolean sampled(long occurrence, long interval) {
    if (interval <= 0) {
      throw new IllegalArgumentException("interval must be positive");
    }
    return occurrence == 1 || (occurrence > 0 && occurrence % interval == 0);
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer kept = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return kept + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }

  private static String escapeControls(String value) {
    StringBuilder sb = null;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      String replacement = switch (c) {
        case '\n' -> "\\n";
        case '\r' -> "\\r";
        case '\t' -> "\\t";
        default -> null;
      };
      if (replacement == null) {
        if (sb != null) {
          sb.append(c);
        }
        continue;
      }
      if (sb == null) {
        sb = new StringBuilder(value.length() + 8).append(value, 0, i);
      }
      sb.append(replacement);
    }
    return sb == null ? value : sb.toString();
  }
}

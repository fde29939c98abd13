package ca.gc.cra.diagsink.domain.segment;

import java.util.Objects;

/**
 * Deterministic object key for an uploaded segment.
 * <p>Keys follow {@code [<prefix>/]<hostId>-<hostId>-<sequence>.out}; the prefix is omitted when blank.
 * Keys are unique per host per run because sequence indexes never repeat within a run.</p>
 *
 * @param value rendered object key
 * @since 0.1.0
 */
public record RemoteObjectName(String value) {
  private static final String EXTENSION = ".out";

  public RemoteObjectName {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      throw new IllegalArgumentException("object name must not be blank");
    }
  }

  /**
   * Builds the object key for a segment.
   *
   * @param prefix optional key prefix; {@code null} or blank omits it, trailing slashes are trimmed
   * @param hostId host identifier; must not be blank
   * @param sequence segment sequence index
   * @return object name
   */
  public static RemoteObjectName of(String prefix, String hostId, long sequence) {
    Objects.requireNonNull(hostId, "hostId");
    String host = hostId.trim();
    if (host.isEmpty()) {
      throw new IllegalArgumentException("hostId must not be blank");
    }
    if (sequence < 0) {
      throw new IllegalArgumentException("sequence must not be negative");
    }
    String key = host + "-" + host + "-" + sequence + EXTENSION;
    String normalizedPrefix = normalizePrefix(prefix);
    return new RemoteObjectName(normalizedPrefix.isEmpty() ? key : normalizedPrefix + "/" + key);
  }

  private static String normalizePrefix(String prefix) {
    if (prefix == null) {
      return "";
    }
    String trimmed = prefix.trim();
    int end = trimmed.length();
    while (end > 0 && trimmed.charAt(end - 1) == '/') {
      end--;
    }
    return trimmed.substring(0, end);
  }

  @Override
  public String toString() {
    return value;
  }
}

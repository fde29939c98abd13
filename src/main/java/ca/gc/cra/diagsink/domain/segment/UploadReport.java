package ca.gc.cra.diagsink.domain.segment;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Outcome of one batch upload of local segments.
 * <p><strong>Why:</strong> Per-file failures never abort a batch, so callers need both lists to decide what to log or retry.</p>
 * <p><strong>Thread-safety:</strong> Immutable; lists are defensive copies.</p>
 *
 * @param succeeded object names uploaded successfully, in sequence order
 * @param failed per-file failures, in sequence order
 * @since 0.1.0
 */
public record UploadReport(List<RemoteObjectName> succeeded, List<Failure> failed) {
  public UploadReport {
    succeeded = List.copyOf(Objects.requireNonNull(succeeded, "succeeded"));
    failed = List.copyOf(Objects.requireNonNull(failed, "failed"));
  }

  /**
   * Returns an empty report for runs without local segments.
   *
   * @return report with no entries
   */
  public static UploadReport empty() {
    return new UploadReport(List.of(), List.of());
  }

  /**
   * Indicates whether every attempted file was uploaded.
   *
   * @return {@code true} when no failures were recorded
   */
  public boolean isComplete() {
    return failed.isEmpty();
  }

  /**
   * Returns the number of files the batch attempted.
   *
   * @return succeeded plus failed count
   */
  public int attempted() {
    return succeeded.size() + failed.size();
  }

  /**
   * A segment that could not be uploaded.
   *
   * @param path local segment path
   * @param objectName object key the upload targeted; {@code null} when no key could be derived
   * @param error failure raised while preparing or storing the file
   */
  public record Failure(Path path, RemoteObjectName objectName, Exception error) {
    public Failure {
      Objects.requireNonNull(path, "path");
      Objects.requireNonNull(error, "error");
    }
  }
}

package ca.gc.cra.diagsink.api;

import ca.gc.cra.diagsink.domain.segment.UploadReport;

/**
 * <strong>What:</strong> Process exit codes shared by the diagsink commands.
 * <p><strong>Why:</strong> Benchmark orchestration scripts branch on the status, for example to rerun
 * {@code upload} when a run ended with {@link #UPLOAD_INCOMPLETE}.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Recorded and uploaded, or uploaded, without failures. */
  SUCCESS(0),
  /** Malformed arguments or YAML; usage was printed. */
  INVALID_ARGS(2),
  /** Segment directory or configuration file could not be read or written. */
  IO_ERROR(3),
  /** Arguments parsed but the store or source could not be built from them. */
  CONFIG_ERROR(4),
  /** Anything else that stopped the command. */
  RUNTIME_FAILURE(5),
  /** At least one segment failed to upload; rerun {@code upload} to retry. */
  UPLOAD_INCOMPLETE(6),
  /** The recording thread was interrupted; segments were still finalized. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value passed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }

  /**
   * Maps an upload batch to the command outcome.
   *
   * @param report finished batch
   * @return {@link #SUCCESS} when every segment was stored, otherwise {@link #UPLOAD_INCOMPLETE}
   */
  public static ExitCode forUpload(UploadReport report) {
    return report.isComplete() ? SUCCESS : UPLOAD_INCOMPLETE;
  }
}

package ca.gc.cra.diagsink.application.sink;

/**
 * Lifecycle of a sink run. Transitions only move forward.
 *
 * @since 0.1.0
 */
public enum SinkState {
  /** Producers append; the monitor rotates and reclaims. */
  RECORDING,
  /** Flush called; every segment is closed and no further appends are accepted. */
  DRAINING,
  /** Upload finished; a report is available. Re-uploading is allowed. */
  UPLOADED
}

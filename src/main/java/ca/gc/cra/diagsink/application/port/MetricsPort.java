package ca.gc.cra.diagsink.application.port;

/**
 * <strong>What:</strong> Counters and histograms emitted by the sink.
 * <p><strong>Why:</strong> Lets the writer, monitor, uploader and event sources report activity without
 * binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP}
 * when export is disabled.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from producer,
 * monitor and upload threads.</p>
 * <p><strong>Performance:</strong> {@link #increment(String)} sits on the append path and must not block.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /** Records appended to a segment. */
  String APPEND_WRITTEN = "sink.append.written";
  /** Bytes per appended record, newline included. */
  String APPEND_BYTES = "sink.append.bytes";
  /** Records dropped because the append failed. */
  String APPEND_DROPPED = "sink.append.dropped";
  String ROTATION_COMPLETED = "sink.rotation.completed";
  String ROTATION_FAILED = "sink.rotation.failed";
  String RECLAIM_CLOSED = "sink.reclaim.closed";
  String RECLAIM_FAILED = "sink.reclaim.failed";
  /** Monitor steps that threw; the next tick still runs. */
  String MONITOR_TICK_FAILED = "sink.monitor.tick.failed";
  String UPLOAD_SUCCEEDED = "sink.upload.succeeded";
  String UPLOAD_FAILED = "sink.upload.failed";
  /** Size of each uploaded segment. */
  String UPLOAD_BYTES = "sink.upload.bytes";
  /** Source records that could not be decoded into a latency event. */
  String SOURCE_MALFORMED = "sink.source.malformed";

  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name, usually one of the constants above; never {@code null}
   */
  void increment(String key);

  /**
   * Records one histogram observation.
   *
   * @param key dotted metric name; never {@code null}
   * @param value observed value, in bytes for the sink's histograms
   */
  void observe(String key, long value);

  /** Discards every update. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}

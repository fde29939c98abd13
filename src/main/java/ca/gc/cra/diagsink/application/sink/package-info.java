/**
 * Rotating diagnostic sink: segment writer, rotation monitor, and upload coordinator.
 * <p><strong>Role:</strong> Application use cases between event sources and object storage.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.diagsink.application.sink.RotatingSegmentWriter} is shared by
 * producer threads and the monitor; the active segment is published through an atomic reference and
 * retired segments live in a concurrent set.</p>
 * <p><strong>Metrics:</strong> Emits {@code sink.append.*}, {@code sink.rotation.*}, {@code sink.reclaim.*} and
 * {@code sink.upload.*} counters.</p>
 */
package ca.gc.cra.diagsink.application.sink;

/**
 * Application layer: sink use cases and the ports they depend on.
 * <p><strong>Role:</strong> Coordinates segment writing, rotation, and upload without binding to storage or transport SDKs.</p>
 * <p><strong>Concurrency:</strong> Documented per class; the writer is shared by producer threads and the monitor.</p>
 * <p><strong>Metrics:</strong> Emits {@code sink.*} counters through {@link ca.gc.cra.diagsink.application.port.MetricsPort}.</p>
 */
package ca.gc.cra.diagsink.application;

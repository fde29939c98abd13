/**
 * Core domain model for the diagnostic sink: latency events, local segments, and remote naming.
 * <p><strong>Role:</strong> Domain layer values shared by the capture path, the rotation monitor, and the upload stage.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe to share across producer and monitor threads.</p>
 * <p><strong>Metrics:</strong> Segment sequence indexes and object names tag {@code sink.*} log lines.</p>
 */
package ca.gc.cra.diagsink.domain;

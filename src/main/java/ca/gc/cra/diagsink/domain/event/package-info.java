/**
 * Latency event values delivered by benchmark event sources.
 * <p><strong>Role:</strong> Opaque two-column payload carried from the source to the segment writer.</p>
 * <p><strong>Concurrency:</strong> Immutable records.</p>
 */
package ca.gc.cra.diagsink.domain.event;

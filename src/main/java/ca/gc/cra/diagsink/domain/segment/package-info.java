/**
 * Segment naming, snapshots, and upload reporting.
 * <p><strong>Role:</strong> Value types describing rotated local files and their remote object names.</p>
 * <p><strong>Concurrency:</strong> Immutable; safe for concurrent reads.</p>
 * <p><strong>Performance:</strong> Naming helpers are allocation-light string operations.</p>
 */
package ca.gc.cra.diagsink.domain.segment;

/**
 * Ports consumed by the sink use cases.
 * <p><strong>Role:</strong> Boundaries for event sources, object storage, and metrics.</p>
 * <p><strong>Concurrency:</strong> Each port documents its threading contract.</p>
 */
package ca.gc.cra.diagsink.application.port;

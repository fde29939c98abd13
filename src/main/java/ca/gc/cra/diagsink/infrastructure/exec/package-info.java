/**
 * Executor factories for the sink's background threads.
 * <p><strong>Role:</strong> Infrastructure utilities configuring the rotation monitor scheduler and transport threads.</p>
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 */
package ca.gc.cra.diagsink.infrastructure.exec;

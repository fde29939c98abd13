/**
 * CLI entry points for recording benchmark diagnostics and uploading the resulting segments.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, and
 * invokes the sink through {@code CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded during setup; {@code record} hands the
 * run over to the Kafka poll thread and the rotation monitor until shutdown.</p>
 * <p><strong>Security:</strong> Validates user-supplied paths and network targets before opening them.</p>
 */
package ca.gc.cra.diagsink.api;

/**
 * <strong>Purpose:</strong> Input validation for configuration and CLI arguments.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.</p>
 * <p><strong>Observability:</strong> Failures raise {@link java.lang.IllegalArgumentException}; nothing is logged here.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.diagsink.validation;

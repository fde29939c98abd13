/**
 * Object store adapters for uploading diagnostics segments.
 * <p>Both adapters overwrite existing objects, so a batch can be rerun after a partial failure.</p>
 */
package ca.gc.cra.diagsink.infrastructure.storage;

/**
 * Infrastructure adapters: object stores, event transports, metrics exporters, and executors.
 */
package ca.gc.cra.diagsink.infrastructure;

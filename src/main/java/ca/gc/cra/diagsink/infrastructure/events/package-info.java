/**
 * Latency event sources: in-process publish/subscribe and a Kafka topic consumer.
 * <p><strong>Concurrency:</strong> Listeners run on the publishing thread or on the Kafka poll thread.</p>
 * <p><strong>Metrics:</strong> Counts undecodable Kafka records as {@code sink.source.malformed}.</p>
 */
package ca.gc.cra.diagsink.infrastructure.events;

package ca.gc.cra.diagsink.application.port;

/**
 * <strong>What:</strong> Port for subscribing to benchmark latency events.
 * <p><strong>Why:</strong> The sink only consumes; emission rate and threading belong to the source.</p>
 * <p><strong>Role:</strong> Input port implemented by in-process and Kafka adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Deliver each event to every subscribed listener.</li>
 *   <li>Stop delivery and release transport resources on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Events may be delivered concurrently from many threads.</p>
 *
 * @since 0.1.0
 */
public interface LatencyEventSource extends AutoCloseable {
  /**
   * Registers a listener for all subsequent events.
   *
   * @param listener listener to invoke; must not be {@code null}
   */
  void subscribe(LatencyEventListener listener);

  /**
   * Starts delivery for sources that own a transport thread. In-process sources deliver on the
   * publisher's thread and need no start.
   *
   * @throws Exception if the transport cannot be started
   */
  default void start() throws Exception {}

  /**
   * Stops delivery and releases resources.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  default void close() throws Exception {}
}

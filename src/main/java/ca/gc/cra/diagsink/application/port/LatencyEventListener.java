package ca.gc.cra.diagsink.application.port;

import ca.gc.cra.diagsink.domain.event.LatencyEvent;

/**
 * Callback receiving latency events from a {@link LatencyEventSource}.
 * <p>Invoked on the emitting thread; implementations must be thread-safe and must not block on
 * retries, since a stalled callback stalls the benchmark.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LatencyEventListener {
  /**
   * Handles one event.
   *
   * @param event event to handle; never {@code null}
   */
  void onEvent(LatencyEvent event);
}

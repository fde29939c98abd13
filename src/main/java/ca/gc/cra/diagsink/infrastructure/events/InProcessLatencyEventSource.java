package ca.gc.cra.diagsink.infrastructure.events;

import ca.gc.cra.diagsink.application.port.LatencyEventListener;
import ca.gc.cra.diagsink.application.port.LatencyEventSource;
import ca.gc.cra.diagsink.domain.event.LatencyEvent;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-JVM event source for benchmarks that embed the sink. Listeners run on the publishing thread;
 * a listener that throws does not prevent delivery to the others.
 *
 * @since 0.1.0
 */
public final class InProcessLatencyEventSource implements LatencyEventSource {
  private static final Logger log = LoggerFactory.getLogger(InProcessLatencyEventSource.class);

  private final CopyOnWriteArrayList<LatencyEventListener> listeners = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  @Override
  public void subscribe(LatencyEventListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Delivers one event to every listener. Events published after {@link #close()} are ignored.
   *
   * @param event event to publish; must not be {@code null}
   */
  public void publish(LatencyEvent event) {
    Objects.requireNonNull(event, "event");
    if (closed) {
      return;
    }
    for (LatencyEventListener listener : listeners) {
      try {
        listener.onEvent(event);
      } catch (RuntimeException ex) {
        log.warn("Latency event listener {} failed", listener, ex);
      }
    }
  }

  /**
   * Convenience for {@code publish(new LatencyEvent(latency, diagnostics))}.
   *
   * @param latency first payload column
   * @param diagnostics second payload column
   */
  public void publish(String latency, String diagnostics) {
    publish(new LatencyEvent(latency, diagnostics));
  }

  public List<LatencyEventListener> listeners() {
    return List.copyOf(listeners);
  }

  @Override
  public void close() {
    closed = true;
    listeners.clear();
  }
}

package ca.gc.cra.diagsink.infrastructure.events;

import ca.gc.cra.diagsink.application.port.LatencyEventListener;
import ca.gc.cra.diagsink.application.port.LatencyEventSource;
import ca.gc.cra.diagsink.application.port.MetricsPort;
import ca.gc.cra.diagsink.domain.event.LatencyEvent;
import ca.gc.cra.diagsink.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.diagsink.logging.Logs;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Kafka consumer that turns latency event records into listener callbacks.
 * <p><strong>Why:</strong> Lets the sink run as a sidecar when the benchmark publishes its latency
 * events to a topic instead of embedding the sink in-process.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link LatencyEventSource}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Subscribe to the latency topic and poll it on a dedicated thread.</li>
 *   <li>Decode JSON record values; malformed records are counted as {@code sink.source.malformed} and skipped.</li>
 *   <li>Wake and close the consumer on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The consumer is only touched by the poll thread, except for
 * {@link Consumer#wakeup()} which Kafka allows from any thread.</p>
 *
 * @since 0.1.0
 */
public final class KafkaLatencyEventSource implements LatencyEventSource {
  private static final Logger log = LoggerFactory.getLogger(KafkaLatencyEventSource.class);
  private static final Duration POLL_TIMEOUT = Duration.ofMillis(250);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Consumer<String, String> consumer;
  private final String topic;
  private final MetricsPort metrics;
  private final LatencyEventJson json = new LatencyEventJson();
  private final CopyOnWriteArrayList<LatencyEventListener> listeners = new CopyOnWriteArrayList<>();

  private volatile boolean running;
  private Thread pollThread;

  /**
   * Creates a source bound to {@code topic}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers; must not be blank
   * @param topic latency event topic; must not be blank
   * @param metrics metrics sink
   */
  public KafkaLatencyEventSource(String bootstrapServers, String topic, MetricsPort metrics) {
    this(createConsumer(bootstrapServers), topic, metrics);
  }

  KafkaLatencyEventSource(Consumer<String, String> consumer, String topic, MetricsPort metrics) {
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    this.topic = Objects.requireNonNull(topic, "topic");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.consumer.subscribe(List.of(topic));
  }

  @Override
  public void subscribe(LatencyEventListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  @Override
  public synchronized void start() {
    if (pollThread != null) {
      return;
    }
    running = true;
    pollThread = ExecutorFactories
        .newThreadFactory("diagsink-kafka", "diagsink-kafka", false,
            (thread, ex) -> log.error("Kafka poll thread {} terminated", thread.getName(), ex))
        .newThread(this::pollLoop);
    pollThread.start();
    log.info("Consuming latency events from Kafka topic {}", topic);
  }

  private void pollLoop() {
    try {
      while (running) {
        pollOnce(POLL_TIMEOUT);
      }
    } catch (WakeupException ex) {
      if (running) {
        throw ex;
      }
    } finally {
      consumer.close(CLOSE_TIMEOUT);
      log.info("Kafka consumer for topic {} closed", topic);
    }
  }

  /**
   * Polls once and delivers decoded events.
   *
   * @param timeout poll timeout
   * @return number of events delivered
   */
  int pollOnce(Duration timeout) {
    ConsumerRecords<String, String> records = consumer.poll(timeout);
    int delivered = 0;
    for (ConsumerRecord<String, String> record : records) {
      LatencyEvent event;
      try {
        event = json.decode(record.value() == null ? "" : record.value());
      } catch (IllegalArgumentException ex) {
        metrics.increment(MetricsPort.SOURCE_MALFORMED);
        log.debug("Skipping malformed latency record at {}-{}@{}: {}",
            record.topic(), record.partition(), record.offset(),
            Logs.preview(record.value()));
        continue;
      }
      for (LatencyEventListener listener : listeners) {
        listener.onEvent(event);
      }
      delivered++;
    }
    return delivered;
  }

  @Override
  public void close() throws InterruptedException {
    Thread thread;
    synchronized (this) {
      thread = pollThread;
      running = false;
    }
    if (thread == null) {
      consumer.close(CLOSE_TIMEOUT);
      return;
    }
    consumer.wakeup();
    thread.join(CLOSE_TIMEOUT.toMillis() * 2);
    if (thread.isAlive()) {
      log.warn("Kafka poll thread did not stop within {} ms", CLOSE_TIMEOUT.toMillis() * 2);
    }
  }

  private static Consumer<String, String> createConsumer(String bootstrapServers) {
    Objects.requireNonNull(bootstrapServers, "bootstrapServers");
    String trimmed = bootstrapServers.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("bootstrapServers must not be blank");
    }
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, trimmed);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, "diagsink-" + UUID.randomUUID());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 500);
    return new KafkaConsumer<>(props);
  }
}

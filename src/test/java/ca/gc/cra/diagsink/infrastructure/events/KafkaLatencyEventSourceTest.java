package ca.gc.cra.diagsink.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.diagsink.domain.event.LatencyEvent;
import ca.gc.cra.diagsink.testutil.RecordingMetricsPort;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.Test;

class KafkaLatencyEventSourceTest {
  private static final String TOPIC = "benchmark.latency";

  @Test
  void deliversDecodedEventsAndSkipsMalformedRecords() throws Exception {
    MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    KafkaLatencyEventSource source = new KafkaLatencyEventSource(consumer, TOPIC, metrics);
    List<LatencyEvent> received = new CopyOnWriteArrayList<>();
    source.subscribe(received::add);

    TopicPartition partition = new TopicPartition(TOPIC, 0);
    consumer.rebalance(List.of(partition));
    consumer.updateBeginningOffsets(Map.of(partition, 0L));
    consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, "k", "{\"latency\":3.5,\"diagnostics\":\"op=read\"}"));
    consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 1L, "k", "not json"));
    consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 2L, "k", null));
    consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 3L, "k", "{\"latency\":\"9\"}"));

    int delivered = source.pollOnce(Duration.ofMillis(10));

    assertEquals(2, delivered);
    assertEquals(List.of(new LatencyEvent("3.5", "op=read"), new LatencyEvent("9", "")), received);
    assertEquals(2, metrics.count("sink.source.malformed"));
    source.close();
    assertTrue(consumer.closed());
  }

  @Test
  void pollThreadStopsOnClose() throws Exception {
    MockConsumer<String, String> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    KafkaLatencyEventSource source = new KafkaLatencyEventSource(consumer, TOPIC, new RecordingMetricsPort());
    List<LatencyEvent> received = new CopyOnWriteArrayList<>();
    source.subscribe(received::add);
    TopicPartition partition = new TopicPartition(TOPIC, 0);
    consumer.rebalance(List.of(partition));
    consumer.updateBeginningOffsets(Map.of(partition, 0L));
    consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, "k", "{\"latency\":1,\"diagnostics\":\"x\"}"));

    source.start();
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (received.isEmpty() && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    source.close();

    assertEquals(1, received.size());
    assertTrue(consumer.closed());
  }
}

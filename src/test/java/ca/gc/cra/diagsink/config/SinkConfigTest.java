package ca.gc.cra.diagsink.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SinkConfigTest {
  @Test
  void defaultsMatchDocumentedValues() {
    SinkConfig config = SinkConfig.fromMap(Map.of());

    assertEquals("BenchmarkDiagnostics.out", config.fileBase());
    assertEquals(100_000_000L, config.rotateBytes());
    assertEquals(Duration.ofSeconds(5), config.checkInterval());
    assertEquals(config.checkInterval(), config.reclaimInterval());
    assertEquals(StoreMode.S3, config.storeMode());
    assertEquals("diagnostics", config.bucket());
    assertEquals("benchmark.latency", config.kafkaTopic());
    assertTrue(config.createBucket());
    assertFalse(config.hostId().isBlank());
    assertEquals("", config.storePrefix());
  }

  @Test
  void parsesOverrides() {
    Map<String, String> kv = new HashMap<>();
    kv.put("out", "/tmp/diag");
    kv.put("fileBase", "Run.out");
    kv.put("rotateBytes", "100");
    kv.put("checkIntervalMs", "20");
    kv.put("reclaimIntervalMs", "0");
    kv.put("hostId", "bench01");
    kv.put("storePrefix", "runs/7");
    kv.put("storeMode", "dir");
    kv.put("storeDir", "/tmp/remote");
    kv.put("s3Endpoint", "http://localhost:9000");
    kv.put("createBucket", "false");
    kv.put("kafkaBootstrap", "localhost:9092");
    kv.put("kafkaTopic", "latency.v2");

    SinkConfig config = SinkConfig.fromMap(kv);

    assertEquals(Path.of("/tmp/diag"), config.outputDirectory());
    assertEquals("Run.out", config.fileBase());
    assertEquals(100L, config.rotateBytes());
    assertEquals(Duration.ofMillis(20), config.checkInterval());
    assertEquals(Duration.ZERO, config.reclaimInterval());
    assertEquals("bench01", config.hostId());
    assertEquals("runs/7", config.storePrefix());
    assertEquals(StoreMode.DIRECTORY, config.storeMode());
    assertEquals(Optional.of(Path.of("/tmp/remote")), config.storeDirectory());
    assertEquals(Optional.of("http://localhost:9000"), config.s3Endpoint());
    assertFalse(config.createBucket());
    assertEquals(Optional.of("localhost:9092"), config.kafkaBootstrap());
    assertEquals("latency.v2", config.kafkaTopic());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> SinkConfig.fromMap(Map.of("rotateBytes", "0")));
    assertThrows(IllegalArgumentException.class, () -> SinkConfig.fromMap(Map.of("checkIntervalMs", "1")));
    assertThrows(IllegalArgumentException.class, () -> SinkConfig.fromMap(Map.of("fileBase", "a/b.out")));
    assertThrows(IllegalArgumentException.class, () -> SinkConfig.fromMap(Map.of("hostId", "bad host")));
    assertThrows(IllegalArgumentException.class, () -> SinkConfig.fromMap(Map.of("storeMode", "ftp")));
    assertThrows(IllegalArgumentException.class, () -> SinkConfig.fromMap(Map.of("storeMode", "DIRECTORY")));
    assertThrows(IllegalArgumentException.class, () -> SinkConfig.fromMap(Map.of("kafkaBootstrap", "nohost")));
    assertThrows(IllegalArgumentException.class, () -> SinkConfig.fromMap(Map.of("bucket", "Upper")));
  }

  @Test
  void defaultHostIdIsObjectNameSafe() {
    assertTrue(SinkConfig.defaultHostId().matches("[A-Za-z0-9._-]+"));
  }
}

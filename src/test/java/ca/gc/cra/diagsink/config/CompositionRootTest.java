package ca.gc.cra.diagsink.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.diagsink.application.port.MetricsPort;
import ca.gc.cra.diagsink.application.port.ObjectStorePort;
import ca.gc.cra.diagsink.application.sink.DiagnosticSink;
import ca.gc.cra.diagsink.application.sink.SinkState;
import ca.gc.cra.diagsink.domain.event.LatencyEvent;
import ca.gc.cra.diagsink.domain.segment.UploadReport;
import ca.gc.cra.diagsink.infrastructure.storage.DirectoryObjectStoreAdapter;
import ca.gc.cra.diagsink.infrastructure.storage.DisabledObjectStoreAdapter;
import ca.gc.cra.diagsink.infrastructure.storage.S3ObjectStoreAdapter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  @Test
  void selectsStoreByMode() throws Exception {
    assertInstanceOf(S3ObjectStoreAdapter.class, root(Map.of()).objectStore());
    assertInstanceOf(DisabledObjectStoreAdapter.class, root(Map.of("storeMode", "NONE")).objectStore());
    assertInstanceOf(DirectoryObjectStoreAdapter.class,
        root(Map.of("storeMode", "DIRECTORY", "storeDir", tempDir.resolve("remote").toString())).objectStore());
  }

  @Test
  void wiresSinkThatUploadsToDirectoryStore() throws Exception {
    Path out = tempDir.resolve("segments");
    Path remote = tempDir.resolve("remote");
    CompositionRoot root = root(Map.of(
        "out", out.toString(),
        "hostId", "bench01",
        "storeMode", "DIRECTORY",
        "storeDir", remote.toString()));

    try (ObjectStorePort store = root.objectStore()) {
      DiagnosticSink sink = root.diagnosticSink(store);
      sink.start();
      sink.onEvent(new LatencyEvent("4", "op=scan"));
      UploadReport report = sink.uploadDiagnostics();

      assertEquals(1, report.succeeded().size());
      assertEquals(SinkState.UPLOADED, sink.state());
      assertEquals("4 ; op=scan\n", Files.readString(remote.resolve("bench01-bench01-0.out")));
    }
  }

  @Test
  void kafkaSourceNeedsBootstrap() {
    assertThrows(IllegalStateException.class, () -> root(Map.of()).kafkaEventSource());
  }

  private static CompositionRoot root(Map<String, String> kv) {
    return new CompositionRoot(SinkConfig.fromMap(kv), MetricsPort.NO_OP);
  }
}

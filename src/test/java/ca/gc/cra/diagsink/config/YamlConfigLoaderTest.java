package ca.gc.cra.diagsink.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void modeSectionOverridesCommonSection() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("diagsink.yaml"), """
        common:
          hostId: bench01
          bucket: shared-bucket
        record:
          bucket: record-bucket
          rotateBytes: 1048576
          kafka:
            group: ignored
        upload:
          bucket: upload-bucket
        """);

    Map<String, String> record = YamlConfigLoader.load(yaml, "record").orElseThrow();

    assertEquals("bench01", record.get("hostId"));
    assertEquals("record-bucket", record.get("bucket"));
    assertEquals("1048576", record.get("rotateBytes"));
    assertEquals("ignored", record.get("kafka.group"));
    assertEquals("upload-bucket", YamlConfigLoader.load(yaml, "UPLOAD").orElseThrow().get("bucket"));
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "record").isEmpty());
  }

  @Test
  void scalarListsAreJoinedWithCommas() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("lists.yaml"), """
        upload:
          otelResourceAttributes: [service.name=diagsink, env=perf]
        """);

    assertEquals(
        "service.name=diagsink,env=perf",
        YamlConfigLoader.load(yaml, "upload").orElseThrow().get("otelResourceAttributes"));
  }

  @Test
  void rejectsUnknownSectionsNestedListsAndMalformedDocuments() throws Exception {
    Path typo = Files.writeString(tempDir.resolve("typo.yaml"), "recrod:\n  rotateBytes: 10\n");
    Path nested = Files.writeString(tempDir.resolve("nested.yaml"), "record:\n  kafkaBootstrap: [[a], b]\n");
    Path broken = Files.writeString(tempDir.resolve("broken.yaml"), "record: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(typo, "record"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(nested, "record"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "record"));
  }
}

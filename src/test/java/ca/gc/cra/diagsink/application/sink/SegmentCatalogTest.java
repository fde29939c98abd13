package ca.gc.cra.diagsink.application.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.diagsink.domain.segment.SegmentNaming;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SegmentCatalogTest {
  @TempDir Path tempDir;

  @Test
  void listsSegmentsInSequenceOrderAndSkipsStrangers() throws Exception {
    for (String name : List.of(
        "Diag.out-10", "Diag.out", "Diag.out-1", "Diag.out-0", "Diag.out-01", "Diag.out-x", "Other.out", "Diag.out.bak")) {
      Files.writeString(tempDir.resolve(name), name);
    }
    Files.createDirectory(tempDir.resolve("Diag.out-2"));

    List<SegmentCatalog.Entry> entries = new SegmentCatalog(tempDir, new SegmentNaming("Diag.out")).list();

    assertEquals(List.of(0L, 1L, 2L, 11L), entries.stream().map(SegmentCatalog.Entry::sequence).toList());
    assertEquals(tempDir.resolve("Diag.out-10"), entries.get(3).path());
  }

  @Test
  void missingDirectoryIsEmpty() throws Exception {
    SegmentCatalog catalog = new SegmentCatalog(tempDir.resolve("absent"), new SegmentNaming("Diag.out"));
    assertTrue(catalog.list().isEmpty());
  }
}

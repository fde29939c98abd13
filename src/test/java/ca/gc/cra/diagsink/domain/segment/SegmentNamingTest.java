package ca.gc.cra.diagsink.domain.segment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class SegmentNamingTest {
  private final SegmentNaming naming = new SegmentNaming("BenchmarkDiagnostics.out");

  @Test
  void baseFileIsSequenceZeroAndSuffixesStartAtZero() {
    assertEquals("BenchmarkDiagnostics.out", naming.fileName(0));
    assertEquals("BenchmarkDiagnostics.out-0", naming.fileName(1));
    assertEquals("BenchmarkDiagnostics.out-9", naming.fileName(10));
  }

  @Test
  void sequenceOfReversesFileName() {
    assertEquals(OptionalLong.of(0), naming.sequenceOf("BenchmarkDiagnostics.out"));
    assertEquals(OptionalLong.of(1), naming.sequenceOf("BenchmarkDiagnostics.out-0"));
    assertEquals(OptionalLong.of(13), naming.sequenceOf("BenchmarkDiagnostics.out-12"));
  }

  @Test
  void sequenceOfRejectsForeignNames() {
    assertTrue(naming.sequenceOf("BenchmarkDiagnostics.out-").isEmpty());
    assertTrue(naming.sequenceOf("BenchmarkDiagnostics.out-007").isEmpty());
    assertTrue(naming.sequenceOf("BenchmarkDiagnostics.out-1a").isEmpty());
    assertTrue(naming.sequenceOf("BenchmarkDiagnostics.out.gz").isEmpty());
    assertTrue(naming.sequenceOf(null).isEmpty());
  }

  @Test
  void sequenceOfRejectsSuffixThatWouldOverflow() {
    assertTrue(naming.sequenceOf("BenchmarkDiagnostics.out-" + Long.MAX_VALUE).isEmpty());
    assertTrue(naming.sequenceOf("BenchmarkDiagnostics.out-99999999999999999999").isEmpty());
    assertEquals(OptionalLong.of(Long.MAX_VALUE),
        naming.sequenceOf("BenchmarkDiagnostics.out-" + (Long.MAX_VALUE - 1)));
  }

  @Test
  void rejectsPathsAndBlankNames() {
    assertThrows(IllegalArgumentException.class, () -> new SegmentNaming(" "));
    assertThrows(IllegalArgumentException.class, () -> new SegmentNaming("logs/diag.out"));
    assertThrows(IllegalArgumentException.class, () -> naming.fileName(-1));
  }
}

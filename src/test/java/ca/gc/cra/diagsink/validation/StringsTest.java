package ca.gc.cra.diagsink.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {
  @Test
  void trimsAndRejectsBlank() {
    assertEquals("x", Strings.requireNonBlank("name", "  x "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "  "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\nb"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void validatesTopicsBucketsAndHostIds() {
    assertEquals("benchmark.latency", Strings.sanitizeTopic("kafkaTopic", "benchmark.latency"));
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeTopic("kafkaTopic", "bad topic"));
    assertEquals("diag-bucket.1", Strings.requireBucketName("bucket", "diag-bucket.1"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireBucketName("bucket", "Diag"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireBucketName("bucket", "ab"));
    assertEquals("bench-01.lab", Strings.requireHostId("hostId", "bench-01.lab"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireHostId("hostId", "bench/01"));
  }

  @Test
  void printableAsciiHonoursLimit() {
    assertEquals("a=b", Strings.requirePrintableAscii("attrs", "a=b", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "a=bc", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "é", 3));
  }
}

package ca.gc.cra.diagsink.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {
  @Test
  void parseFallsBackToDefaultAndEnforcesBounds() {
    assertEquals(5_000L, Numbers.parseBoundedLong("checkIntervalMs", " ", 5_000L, 10L, 60_000L));
    assertEquals(250L, Numbers.parseBoundedLong("checkIntervalMs", " 250 ", 5_000L, 10L, 60_000L));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseBoundedLong("checkIntervalMs", "5", 5_000L, 10L, 60_000L));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseBoundedLong("checkIntervalMs", "fast", 5_000L, 10L, 60_000L));
  }
}

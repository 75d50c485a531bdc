package ca.gc.cra.facet.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreReturnedUnchanged() {
    String value = "Revenue was $500";
    assertSame(value, Logs.snippet(value));
    assertEquals("<null>", Logs.snippet(null));
  }

  @Test
  void longValuesAreTruncatedWithByteCounts() {
    String value = "x".repeat(100);

    assertEquals("x".repeat(80) + "... (truncated, 80 of 100 bytes)", Logs.snippet(value));
  }

  @Test
  void truncationNeverSplitsAMultiByteCharacter() {
    // "€" is three bytes in UTF-8; a four-byte budget keeps one and drops the partial second.
    String result = Logs.truncate("€€€", 4);

    assertTrue(result.startsWith("€... "), result);
    assertTrue(result.endsWith("(truncated, 4 of 9 bytes)"), result);
  }

  @Test
  void rejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }
}

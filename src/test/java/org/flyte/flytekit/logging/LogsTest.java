package org.flyte.flytekit.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateLeavesShortValuesAlone() {
    assertEquals("admin", Logs.truncate("admin", 16));
  }

  @Test
  void truncateMarksShortenedValues() {
    String truncated = Logs.truncate("abcdefghij", 4);

    assertTrue(truncated.startsWith("abcd"));
    assertTrue(truncated.contains("truncated, 4 of 10 bytes"));
  }

  @Test
  void truncateRejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("admin", 0));
  }

  @Test
  void dumpRendersNullAndDocuments() {
    assertEquals("<null>", Logs.dump(null));
    assertEquals("{admin={endpoint=localhost}}", Logs.dump(Map.of("admin", Map.of("endpoint", "localhost"))));
  }

  @Test
  void dumpBoundsLargeDocuments() {
    String large = "x".repeat(Logs.DOCUMENT_DUMP_BYTES * 2);

    assertTrue(Logs.dump(large).contains("truncated"));
  }
}

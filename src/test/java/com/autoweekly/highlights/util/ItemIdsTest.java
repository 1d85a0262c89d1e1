package com.autoweekly.highlights.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ItemIdsTest {

  @Test
  void lastDashTokenWithoutExtensionIsTheId() {
    assertEquals("abc123", ItemIds.extractItemId("2025-04-14-Report-abc123.pdf"));
    assertEquals("abc123", ItemIds.extractItemId("2025-04-14-Report-abc123.PDF"));
    assertEquals("x9", ItemIds.extractItemId("/tmp/inbox/GS-China-x9.txt"));
  }

  @Test
  void nameWithoutDashIsItsOwnId() {
    assertEquals("notes", ItemIds.extractItemId("notes.pdf"));
    assertEquals("README", ItemIds.extractItemId("README"));
  }

  @Test
  void trailingDashFallsBackToBaseName() {
    assertEquals("report-", ItemIds.extractItemId("report-.pdf"));
  }

  @Test
  void sameConventionGivesSameIdAcrossRuns() {
    assertEquals(
        ItemIds.extractItemId("2025-09-08-MS-Semis-q7k2.pdf"),
        ItemIds.extractItemId("2025-09-09-MS-Semis-update-q7k2.pdf"));
  }

  @Test
  void extension() {
    assertEquals("pdf", ItemIds.extension("a-b.pdf"));
    assertEquals("", ItemIds.extension("noext"));
    assertEquals("", ItemIds.extension(".DS_Store"));
  }

  @Test
  void dispatchOrderIsNewestDatePrefixFirst() {
    List<String> names =
        new ArrayList<>(
            List.of(
                "2025-09-08-GS-a1.pdf", "2025-09-10-MS-b2.pdf", "plain.pdf", "2025-09-09-UBS-c3.pdf"));
    names.sort(ItemIds.DISPATCH_ORDER);
    assertEquals(
        List.of(
            "plain.pdf", "2025-09-10-MS-b2.pdf", "2025-09-09-UBS-c3.pdf", "2025-09-08-GS-a1.pdf"),
        names);
  }
}

package com.autoweekly.highlights.service;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class BoilerplateCleanerTest {

  private final BoilerplateCleaner cleaner = new BoilerplateCleaner();

  @Test
  void keepsDisclosuresLineAndDropsEverythingAfter() {
    String text =
        String.join(
            "\n",
            "a1.pdf",
            "",
            "Revenue grew 12% y/y.",
            "Important Disclosures",
            "Analyst certification ...",
            "Legal entities ...");

    assertEquals(
        "a1.pdf\n\nRevenue grew 12% y/y.\nImportant Disclosures", cleaner.clean(text));
  }

  @Test
  void crossReferenceToDisclosuresIsNotABoundary() {
    String text = "Thesis\nPlease see disclosures at the end.\nValuation\nDISCLOSURES\ntail";

    assertEquals(
        "Thesis\nPlease see disclosures at the end.\nValuation\nDISCLOSURES", cleaner.clean(text));
  }

  @Test
  void chineseDisclaimerMarker() {
    String text = "正文\n请阅读最后一页的免责声明\n估值\n免责声明\n法律条款";

    assertEquals("正文\n请阅读最后一页的免责声明\n估值\n免责声明", cleaner.clean(text));
  }

  @Test
  void textWithoutBoundaryIsKeptWhole() {
    assertEquals("one\ntwo\n", cleaner.clean("one\ntwo\n"));
    assertEquals("", cleaner.clean(""));
    assertEquals("", cleaner.clean(null));
  }

  @Test
  void boundaryIsPluggable() {
    BoilerplateCleaner custom = new BoilerplateCleaner(line -> line.startsWith("---"));

    assertEquals("body\n---", custom.clean("body\n---\nfooter"));
  }
}

package com.autoweekly.highlights.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EmbeddedDateParserTest {

  private final EmbeddedDateParser parser = new EmbeddedDateParser();

  @Test
  void isoDates() {
    assertEquals(date(2025, 9, 10), parser.findFirst("Published 2025-09-10 by GS"));
    assertEquals(date(2025, 9, 3), parser.findFirst("as of 2025/9/3."));
  }

  @Test
  void twoDigitDayIsNotTruncated() {
    assertEquals(date(2025, 9, 21), parser.findFirst("2025-09-21"));
    assertEquals(date(2025, 9, 30), parser.findFirst("2025年9月30日"));
  }

  @Test
  void chineseDates() {
    assertEquals(date(2025, 9, 10), parser.findFirst("报告日期：2025年9月10日"));
    assertEquals(date(2025, 9, 10), parser.findFirst("2025 年 09 月 10 日"));
  }

  @Test
  void englishDates() {
    assertEquals(date(2025, 9, 10), parser.findFirst("London, 10 September 2025"));
    assertEquals(date(2025, 9, 7), parser.findFirst("07 Sep. 2025 research"));
    assertEquals(date(2025, 9, 10), parser.findFirst("September 10, 2025"));
    assertEquals(date(2025, 9, 10), parser.findFirst("Sept 10 2025"));
  }

  @Test
  void isoFormIsPreferredOverEarlierEnglishForm() {
    assertEquals(date(2025, 8, 1), parser.findFirst("September 10, 2025 ... data as of 2025-08-01"));
  }

  @Test
  void invalidCandidatesAreSkipped() {
    assertEquals(date(2025, 9, 5), parser.findFirst("2025-02-30 then 2025-09-05"));
    assertEquals(date(2025, 9, 9), parser.findFirst("12 Widgets 2025, 9 September 2025"));
  }

  @Test
  void noDate() {
    assertTrue(parser.findFirst("no dates here 123").isEmpty());
    assertTrue(parser.findFirst("").isEmpty());
    assertTrue(parser.findFirst(null).isEmpty());
  }

  @Test
  void stripsLeadingDates() {
    assertEquals("BigBank", parser.stripLeadingDate("2025-09-10,BigBank"));
    assertEquals("BigBank", parser.stripLeadingDate("2025-09-10， BigBank"));
    assertEquals("CICC", parser.stripLeadingDate("2025年9月10日 CICC"));
    assertEquals("Jefferies", parser.stripLeadingDate("10 Sep 2025, Jefferies"));
    assertEquals("UBS", parser.stripLeadingDate("September 10, 2025 UBS"));
    assertEquals("Morgan Stanley", parser.stripLeadingDate("Morgan Stanley"));
    assertEquals("", parser.stripLeadingDate(null));
  }

  @Test
  void stripsDateShapedPrefixThatIsNotARealDate() {
    assertEquals("GS", parser.stripLeadingDate("2025-02-30, GS"));
    assertEquals("UBS", parser.stripLeadingDate("31 Foo 2025 UBS"));
    assertEquals("CICC", parser.stripLeadingDate("2025年2月30日，CICC"));
  }

  private static Optional<LocalDate> date(int y, int m, int d) {
    return Optional.of(LocalDate.of(y, m, d));
  }
}

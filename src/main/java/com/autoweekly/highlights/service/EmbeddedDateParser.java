package com.autoweekly.highlights.service;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds calendar dates written in free text.
 *
 * <p>Recognized forms, tried in this order over the whole text:
 *
 * <ol>
 *   <li>ISO numeric: {@code 2025-09-10}, {@code 2025/9/10}
 *   <li>Chinese: {@code 2025年9月10日}
 *   <li>Day month year: {@code 10 September 2025}, {@code 07 Sep. 2025}
 *   <li>Month day year: {@code September 10, 2025}, {@code Sep 10 2025}
 * </ol>
 *
 * <p>Only years 2000-2099 are recognized. Matches that are not real dates (e.g. {@code 2025-02-30}
 * or an unknown month word) are skipped. Stateless and thread-safe.
 */
public final class EmbeddedDateParser {

  private static final String YEAR = "(20\\d{2})";
  private static final String MONTH_NUM = "(1[0-2]|0?[1-9])";
  private static final String DAY_NUM = "(3[01]|[12]\\d|0?[1-9])";
  private static final String SEP = "\\s*[,，]?\\s*";

  private static final Pattern ISO =
      Pattern.compile("(?<!\\d)" + YEAR + "[-/]" + MONTH_NUM + "[-/]" + DAY_NUM + "(?!\\d)");

  private static final Pattern CHINESE =
      Pattern.compile(
          "(?<!\\d)" + YEAR + "\\s*年\\s*" + MONTH_NUM + "\\s*月\\s*" + DAY_NUM + "(?!\\d)\\s*日?");

  private static final Pattern DAY_MONTH_YEAR =
      Pattern.compile("\\b" + DAY_NUM + "\\s+([A-Za-z]{3,9})\\.?\\s+" + YEAR + "\\b");

  private static final Pattern MONTH_DAY_YEAR =
      Pattern.compile("\\b([A-Za-z]{3,9})\\.?\\s+" + DAY_NUM + ",?\\s+" + YEAR + "\\b");

  private static final Pattern LEADING_ISO =
      Pattern.compile("^\\s*" + YEAR + "[-/]" + MONTH_NUM + "[-/]" + DAY_NUM + "(?!\\d)" + SEP);

  private static final Pattern LEADING_DAY_MONTH_YEAR =
      Pattern.compile("^\\s*" + DAY_NUM + "\\s+([A-Za-z]{3,9})\\.?\\s+" + YEAR + "\\b" + SEP);

  private static final Pattern LEADING_MONTH_DAY_YEAR =
      Pattern.compile("^\\s*([A-Za-z]{3,9})\\.?\\s+" + DAY_NUM + ",?\\s+" + YEAR + "\\b" + SEP);

  private static final Pattern LEADING_CHINESE =
      Pattern.compile(
          "^\\s*" + YEAR + "\\s*年\\s*" + MONTH_NUM + "\\s*月\\s*" + DAY_NUM + "(?!\\d)\\s*日?" + SEP);

  private static final Map<String, Integer> MONTHS =
      Map.ofEntries(
          Map.entry("jan", 1),
          Map.entry("january", 1),
          Map.entry("feb", 2),
          Map.entry("february", 2),
          Map.entry("mar", 3),
          Map.entry("march", 3),
          Map.entry("apr", 4),
          Map.entry("april", 4),
          Map.entry("may", 5),
          Map.entry("jun", 6),
          Map.entry("june", 6),
          Map.entry("jul", 7),
          Map.entry("july", 7),
          Map.entry("aug", 8),
          Map.entry("august", 8),
          Map.entry("sep", 9),
          Map.entry("sept", 9),
          Map.entry("september", 9),
          Map.entry("oct", 10),
          Map.entry("october", 10),
          Map.entry("nov", 11),
          Map.entry("november", 11),
          Map.entry("dec", 12),
          Map.entry("december", 12));

  private static final Function<Matcher, Optional<LocalDate>> NUMERIC =
      m -> toDate(m.group(1), Integer.parseInt(m.group(2)), m.group(3));

  private static final Function<Matcher, Optional<LocalDate>> DMY =
      m -> month(m.group(2)).flatMap(mo -> toDate(m.group(3), mo, m.group(1)));

  private static final Function<Matcher, Optional<LocalDate>> MDY =
      m -> month(m.group(1)).flatMap(mo -> toDate(m.group(3), mo, m.group(2)));

  private static final List<Map.Entry<Pattern, Function<Matcher, Optional<LocalDate>>>> SEARCH =
      List.of(
          Map.entry(ISO, NUMERIC),
          Map.entry(CHINESE, NUMERIC),
          Map.entry(DAY_MONTH_YEAR, DMY),
          Map.entry(MONTH_DAY_YEAR, MDY));

  private static final List<Pattern> LEADING =
      List.of(LEADING_ISO, LEADING_DAY_MONTH_YEAR, LEADING_MONTH_DAY_YEAR, LEADING_CHINESE);

  /** First recognizable date in {@code text}, or empty. {@code null} is treated as no text. */
  public Optional<LocalDate> findFirst(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    for (Map.Entry<Pattern, Function<Matcher, Optional<LocalDate>>> form : SEARCH) {
      Matcher m = form.getKey().matcher(text);
      while (m.find()) {
        Optional<LocalDate> date = form.getValue().apply(m);
        if (date.isPresent()) {
          return date;
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Removes any leading date-shaped expressions (and the comma after them) from {@code s}. The
   * prefix is removed even when it is not a real calendar date, e.g. {@code 2025-02-30}.
   */
  public String stripLeadingDate(String s) {
    if (s == null || s.isEmpty()) {
      return s == null ? "" : s;
    }
    String out = s;
    for (Pattern leading : LEADING) {
      Matcher m = leading.matcher(out);
      if (m.find()) {
        out = out.substring(m.end());
      }
    }
    return out.strip();
  }

  private static Optional<Integer> month(String word) {
    return Optional.ofNullable(MONTHS.get(word.toLowerCase(Locale.ROOT)));
  }

  private static Optional<LocalDate> toDate(String year, int month, String day) {
    try {
      return Optional.of(LocalDate.of(Integer.parseInt(year), month, Integer.parseInt(day)));
    } catch (DateTimeException | NumberFormatException e) {
      return Optional.empty();
    }
  }
}

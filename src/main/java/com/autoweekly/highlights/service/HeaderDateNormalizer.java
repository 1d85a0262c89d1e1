package com.autoweekly.highlights.service;

import com.autoweekly.highlights.config.PipelineSettings;
import com.autoweekly.highlights.model.HighlightEntry;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;
import lombok.extern.log4j.Log4j2;

/**
 * Turns a free-text summary into a {@link HighlightEntry} with a canonical header.
 *
 * <p>The first non-blank line is the header candidate; every later non-blank line becomes a
 * bullet. The header is then rewritten as {@code YYYY-MM-DD,<source>: <title>}:
 *
 * <ol>
 *   <li>If the header already starts with {@code YYYY-MM-DD[,]source: title}, that date is used.
 *   <li>Otherwise the first date found in the header, then the summary, then the cleaned report
 *       text is used.
 * </ol>
 *
 * In both cases the date is kept only when it lies within {@code dateWindowDays} of the reference
 * date (inclusive); otherwise, or when no date is found, the reference date is used. Source and
 * title are split on the first colon ({@code :} or {@code ：}).
 *
 * <p>Never throws on malformed input: an empty summary yields a date-only header and no bullets.
 */
@Log4j2
public class HeaderDateNormalizer {

  private static final Pattern DATED_HEADER =
      Pattern.compile("^\\s*(\\d{4}-\\d{2}-\\d{2})\\s*[,，]?\\s*([^:：]+?)\\s*[:：]\\s*(.+)$");

  private static final Pattern COLON_SPLIT = Pattern.compile("^(.*?)\\s*[:：]\\s*(.*)$");

  private final EmbeddedDateParser dates;
  private final LocalDate referenceDate;
  private final int windowDays;
  private final PipelineSettings settings;

  public HeaderDateNormalizer(EmbeddedDateParser dates, PipelineSettings settings) {
    this.dates = Objects.requireNonNull(dates);
    this.settings = Objects.requireNonNull(settings);
    this.referenceDate = Objects.requireNonNull(settings.getReferenceDate(), "referenceDate");
    this.windowDays = settings.getDateWindowDays();
  }

  /**
   * Normalizes one summary.
   *
   * @param cleanedText cleaned report text used as a last source of date hints; may be {@code null}
   */
  public HighlightEntry normalize(String itemId, String summaryText, String cleanedText) {
    SplitSummary split = split(summaryText);
    CanonicalHeader header = canonicalize(split.getHeader(), summaryText, cleanedText);
    log.debug(
        "normalize itemId={} header={} bullets={}",
        itemId,
        header.render(),
        split.getBullets().size());
    return HighlightEntry.builder()
        .itemId(itemId)
        .header(header.render())
        .date(header.getDate())
        .bullets(split.getBullets())
        .link(settings.linkFor(itemId))
        .build();
  }

  /** Splits a summary into its header candidate and bullet lines. */
  public SplitSummary split(String summaryText) {
    if (summaryText == null || summaryText.isBlank()) {
      return new SplitSummary("", List.of());
    }
    String[] lines = summaryText.strip().split("\\r?\\n", -1);

    int first = 0;
    while (first < lines.length && lines[first].isBlank()) {
      first++;
    }
    String candidate = lines[first].strip();
    String header;
    if (candidate.length() >= 2 && candidate.startsWith("**") && candidate.endsWith("**")) {
      header = stripChar(candidate, '*').strip();
    } else if (candidate.startsWith("- ") || candidate.startsWith("* ")) {
      header = candidate.substring(2).strip();
    } else {
      header = candidate;
    }

    List<String> bullets = new ArrayList<>();
    for (int i = first + 1; i < lines.length; i++) {
      String bullet = toBullet(lines[i].strip());
      if (bullet != null) {
        bullets.add(bullet);
      }
    }
    return new SplitSummary(header, List.copyOf(bullets));
  }

  /** Rewrites a header candidate into canonical form. */
  public CanonicalHeader canonicalize(String header, String summaryText, String cleanedText) {
    String h = header == null ? "" : header.strip();

    Matcher dated = DATED_HEADER.matcher(h);
    if (dated.matches()) {
      LocalDate date = parseIso(dated.group(1)).filter(this::withinWindow).orElse(referenceDate);
      return new CanonicalHeader(date, trimCommas(dated.group(2)), dated.group(3).strip());
    }

    Optional<LocalDate> candidate = dates.findFirst(h);
    if (candidate.isEmpty()) {
      candidate = dates.findFirst(summaryText);
    }
    if (candidate.isEmpty()) {
      candidate = dates.findFirst(cleanedText);
    }
    LocalDate date = candidate.filter(this::withinWindow).orElse(referenceDate);
    if (candidate.isPresent() && !date.equals(candidate.get())) {
      log.debug(
          "normalize.date.outOfWindow found={} reference={} windowDays={}",
          candidate.get(),
          referenceDate,
          windowDays);
    }

    String left = h;
    String title = "";
    Matcher colon = COLON_SPLIT.matcher(h);
    if (colon.matches()) {
      left = colon.group(1);
      title = colon.group(2).strip();
    }
    return new CanonicalHeader(date, trimCommas(dates.stripLeadingDate(left)), title);
  }

  boolean withinWindow(LocalDate candidate) {
    return Math.abs(ChronoUnit.DAYS.between(referenceDate, candidate)) <= windowDays;
  }

  private static String toBullet(String line) {
    if (line.isEmpty()) {
      return null;
    }
    if (line.startsWith("- ")) {
      return line;
    }
    if (line.startsWith("* ") || line.startsWith("• ")) {
      return "- " + line.substring(2).strip();
    }
    String plain = line.replace("*", "").replace("#", "").strip();
    return plain.isEmpty() ? null : "- " + plain;
  }

  private static Optional<LocalDate> parseIso(String s) {
    try {
      return Optional.of(LocalDate.parse(s));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static String stripChar(String s, char c) {
    int start = 0;
    int end = s.length();
    while (start < end && s.charAt(start) == c) {
      start++;
    }
    while (end > start && s.charAt(end - 1) == c) {
      end--;
    }
    return s.substring(start, end);
  }

  private static String trimCommas(String s) {
    int start = 0;
    int end = s.length();
    while (start < end && isTrimmable(s.charAt(start))) {
      start++;
    }
    while (end > start && isTrimmable(s.charAt(end - 1))) {
      end--;
    }
    return s.substring(start, end);
  }

  private static boolean isTrimmable(char c) {
    return c == ',' || c == '，' || Character.isWhitespace(c);
  }

  /** Header candidate and bullet lines of a summary. */
  @Value
  public static class SplitSummary {
    String header;
    List<String> bullets;
  }

  /** Parsed parts of a canonical header. */
  @Value
  public static class CanonicalHeader {
    LocalDate date;
    String source;
    String title;

    /** {@code date,source: title}, dropping the empty parts. */
    public String render() {
      if (title.isEmpty()) {
        return source.isEmpty() ? date.toString() : date + "," + source;
      }
      return date + "," + source + ": " + title;
    }
  }
}

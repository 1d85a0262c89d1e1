package com.autoweekly.highlights.service;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Truncates converted report text at the start of the legal boilerplate.
 *
 * <p>Lines are copied in order; the first line matching the boundary predicate is kept and
 * everything after it is dropped. This is a heuristic: a report that mentions "disclosures" in its
 * body is cut early, and one whose disclaimer section uses other wording is kept whole.
 */
public class BoilerplateCleaner {

  /**
   * Default boundary: {@code disclosures} without {@code see} on the same line, or {@code 免责声明}
   * without {@code 阅读}. Case-insensitive.
   */
  public static final Predicate<String> DEFAULT_BOUNDARY =
      line -> {
        String low = line.toLowerCase(Locale.ROOT);
        return (low.contains("disclosures") && !low.contains("see"))
            || (low.contains("免责声明") && !low.contains("阅读"));
      };

  private final Predicate<String> boundary;

  public BoilerplateCleaner() {
    this(DEFAULT_BOUNDARY);
  }

  public BoilerplateCleaner(Predicate<String> boundary) {
    this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
  }

  public String clean(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String[] lines = text.split("\n", -1);
    StringBuilder out = new StringBuilder(text.length());
    for (int i = 0; i < lines.length; i++) {
      if (i > 0) {
        out.append('\n');
      }
      out.append(lines[i]);
      if (boundary.test(lines[i])) {
        break;
      }
    }
    return out.toString();
  }
}

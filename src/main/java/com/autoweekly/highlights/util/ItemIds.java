package com.autoweekly.highlights.util;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Naming helpers for raw report files.
 *
 * <p>Raw files follow the broker export convention {@code YYYY-MM-DD-<words>-<id>.<ext>}; the
 * trailing token is the stable report id.
 */
public final class ItemIds {

  /** Descending by the first three {@code -}-separated tokens of the file name. */
  public static final Comparator<String> DISPATCH_ORDER =
      Comparator.comparing(ItemIds::dispatchSortKey).reversed();

  private ItemIds() {}

  /**
   * Extracts the item id: the last {@code -}-delimited token of the base name with the extension
   * stripped.
   *
   * <p>{@code 2025-04-14-Report-abc123.pdf -> abc123}, {@code notes.txt -> notes}.
   */
  public static String extractItemId(String fileName) {
    String base = baseName(fileName);
    int dot = base.lastIndexOf('.');
    if (dot > 0) {
      base = base.substring(0, dot);
    }
    int dash = base.lastIndexOf('-');
    if (dash < 0 || dash == base.length() - 1) {
      return base;
    }
    return base.substring(dash + 1);
  }

  /** Extension of the file name without the dot, or an empty string. */
  public static String extension(String fileName) {
    String base = baseName(fileName);
    int dot = base.lastIndexOf('.');
    return dot > 0 && dot < base.length() - 1 ? base.substring(dot + 1) : "";
  }

  /** The date-prefix part of the name used to order dispatch; the whole name if it has no dash. */
  public static String dispatchSortKey(String fileName) {
    if (!fileName.contains("-")) {
      return fileName;
    }
    String[] parts = fileName.split("-", -1);
    int n = Math.min(3, parts.length);
    return String.join("-", Arrays.copyOfRange(parts, 0, n));
  }

  private static String baseName(String fileName) {
    int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
    return slash >= 0 ? fileName.substring(slash + 1) : fileName;
  }
}

package com.autoweekly.highlights.util;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;

/** Resolves the weekly period anchor. */
public final class WeekPeriods {

  public static final DateTimeFormatter PERIOD_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

  private WeekPeriods() {}

  /** Friday of the week containing {@code day}; {@code day} itself when it is a Friday. */
  public static LocalDate fridayOf(LocalDate day) {
    return day.with(TemporalAdjusters.nextOrSame(DayOfWeek.FRIDAY));
  }

  /**
   * Parses a configured period, or falls back to the Friday of {@code today}'s week when the value
   * is blank.
   *
   * @throws IllegalStateException if the configured value is not an ISO date
   */
  public static LocalDate resolve(String configured, LocalDate today) {
    if (configured == null || configured.isBlank()) {
      return fridayOf(today);
    }
    try {
      return LocalDate.parse(configured.trim(), PERIOD_FORMAT);
    } catch (DateTimeParseException e) {
      throw new IllegalStateException(
          "highlights.period must be yyyy-MM-dd but was '" + configured + "'", e);
    }
  }
}

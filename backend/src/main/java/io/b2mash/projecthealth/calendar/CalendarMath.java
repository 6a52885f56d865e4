package io.b2mash.projecthealth.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Calendar-day and working-day arithmetic for project durations. A working day is any Monday to
 * Friday; no holiday calendar is applied.
 *
 * <p>Duration spans ({@link #totalDays}, {@link #workingDays}) are inclusive and symmetric in
 * argument order. Remaining counts ({@link #signedDaysBetween}, {@link #signedWorkingDaysBetween})
 * keep their sign so that an end date in the past reads as overdue.
 */
public final class CalendarMath {

  private static final int DAYS_PER_WEEK = 7;
  private static final int WORKING_DAYS_PER_WEEK = 5;

  private CalendarMath() {}

  /**
   * Returns the inclusive number of calendar days covered by the two dates. A single day counts as
   * one.
   */
  public static int totalDays(LocalDate a, LocalDate b) {
    return saturate(Math.abs(ChronoUnit.DAYS.between(a, b)) + 1);
  }

  /** Returns the number of Monday-Friday days in the inclusive range between the two dates. */
  public static int workingDays(LocalDate a, LocalDate b) {
    LocalDate from = a.isAfter(b) ? b : a;
    LocalDate to = a.isAfter(b) ? a : b;
    long span = ChronoUnit.DAYS.between(from, to) + 1;

    // whole weeks contribute five working days each; only the trailing partial week is walked
    long count = (span / DAYS_PER_WEEK) * WORKING_DAYS_PER_WEEK;
    for (long offset = span - span % DAYS_PER_WEEK; offset < span; offset++) {
      if (isWorkingDay(from.plusDays(offset))) {
        count++;
      }
    }
    return saturate(count);
  }

  /** Returns {@code to - from} in days, negative when {@code to} is the earlier date. */
  public static int signedDaysBetween(LocalDate from, LocalDate to) {
    return saturate(ChronoUnit.DAYS.between(from, to));
  }

  /**
   * Counts the working days in the inclusive range between the two dates and negates the count when
   * {@code to} lies before {@code from}.
   */
  public static int signedWorkingDaysBetween(LocalDate from, LocalDate to) {
    int count = workingDays(from, to);
    return to.isBefore(from) ? -count : count;
  }

  public static boolean isWorkingDay(LocalDate day) {
    DayOfWeek dow = day.getDayOfWeek();
    return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
  }

  /** Clamps to +/- {@link Integer#MAX_VALUE} so spans between extreme dates never overflow. */
  static int saturate(long value) {
    return (int) Math.max(-Integer.MAX_VALUE, Math.min(Integer.MAX_VALUE, value));
  }
}

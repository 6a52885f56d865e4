package io.b2mash.projecthealth.duration;

import io.b2mash.projecthealth.calendar.CalendarMath;
import io.b2mash.projecthealth.milestone.MilestoneInput;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Derives a project's effective start and end dates and the corresponding day counts from its
 * milestones. Pure function of its inputs: {@code today} is always supplied by the caller.
 */
public final class DurationCalculator {

  private DurationCalculator() {}

  /**
   * Computes the duration profile for the given milestones as seen on {@code today}.
   *
   * <p>Start is the earliest milestone date; end is the latest milestone end date (falling back to
   * the milestone date). Milestones without a date are ignored. When no milestone carries a date
   * every field of the result is null.
   */
  public static DurationResult computeDuration(List<MilestoneInput> milestones, LocalDate today) {
    Objects.requireNonNull(today, "today");
    if (milestones == null || milestones.isEmpty()) {
      return DurationResult.empty();
    }

    LocalDate start = null;
    LocalDate end = null;
    for (MilestoneInput milestone : milestones) {
      if (milestone == null || !milestone.hasDate()) {
        continue;
      }
      if (start == null || milestone.date().isBefore(start)) {
        start = milestone.date();
      }
      LocalDate milestoneEnd = milestone.effectiveEndDate();
      if (end == null || milestoneEnd.isAfter(end)) {
        end = milestoneEnd;
      }
    }

    return forRange(start, end, today);
  }

  /**
   * Computes the duration profile for an explicit date range, such as manually overridden project
   * dates. Returns {@link DurationResult#empty()} when either bound is missing.
   */
  public static DurationResult forRange(LocalDate start, LocalDate end, LocalDate today) {
    Objects.requireNonNull(today, "today");
    if (start == null || end == null) {
      return DurationResult.empty();
    }

    return new DurationResult(
        start,
        end,
        CalendarMath.totalDays(start, end),
        CalendarMath.workingDays(start, end),
        CalendarMath.signedDaysBetween(today, end),
        CalendarMath.signedWorkingDaysBetween(today, end));
  }
}

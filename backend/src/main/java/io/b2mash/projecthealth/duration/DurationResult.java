package io.b2mash.projecthealth.duration;

import java.time.LocalDate;

/**
 * Duration profile of a project, derived from its milestone dates (or from manually overridden
 * dates). All fields are null together when no date information is available.
 *
 * @param startDate earliest milestone date
 * @param endDate latest milestone end (or date)
 * @param totalDays inclusive calendar days between start and end
 * @param workingDays Monday-Friday days between start and end, never more than totalDays
 * @param totalDaysRemaining signed calendar days from today to end; negative when overdue
 * @param workingDaysRemaining signed working days from today to end; negative when overdue
 */
public record DurationResult(
    LocalDate startDate,
    LocalDate endDate,
    Integer totalDays,
    Integer workingDays,
    Integer totalDaysRemaining,
    Integer workingDaysRemaining) {

  private static final DurationResult EMPTY =
      new DurationResult(null, null, null, null, null, null);

  public static DurationResult empty() {
    return EMPTY;
  }

  public boolean hasDates() {
    return startDate != null && endDate != null;
  }

  public boolean isOverdue() {
    return totalDaysRemaining != null && totalDaysRemaining < 0;
  }
}

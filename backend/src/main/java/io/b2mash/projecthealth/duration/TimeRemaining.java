package io.b2mash.projecthealth.duration;

/**
 * Share of the project window still ahead of today.
 *
 * @param percentage rounded remaining/total ratio; 0 when overdue, null when unknown. Not clamped:
 *     a schedule that starts after today reads above 100
 * @param bucket urgency category for the percentage
 */
public record TimeRemaining(Integer percentage, TimeRemainingBucket bucket) {

  private static final TimeRemaining UNKNOWN = new TimeRemaining(null, TimeRemainingBucket.UNKNOWN);
  private static final TimeRemaining OVERDUE = new TimeRemaining(0, TimeRemainingBucket.OVERDUE);

  public static TimeRemaining unknown() {
    return UNKNOWN;
  }

  public static TimeRemaining overdue() {
    return OVERDUE;
  }

  /** True when more time remains than the whole planned window spans. */
  public boolean exceedsWindow() {
    return percentage != null && percentage > 100;
  }
}

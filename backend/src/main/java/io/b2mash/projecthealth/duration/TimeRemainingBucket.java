package io.b2mash.projecthealth.duration;

/** Urgency category derived from the share of the project window that is still ahead. */
public enum TimeRemainingBucket {
  UNKNOWN("no schedule data"),
  OVERDUE("overdue"),
  SUBSTANTIAL("substantial time"),
  PLENTY("plenty of time"),
  MODERATE("moderate time"),
  LITTLE("little time");

  static final int SUBSTANTIAL_ABOVE = 60;
  static final int PLENTY_FROM = 30;
  static final int MODERATE_FROM = 15;

  private final String description;

  TimeRemainingBucket(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }

  /**
   * Maps a non-negative time-remaining percentage to its bucket: above 60 is substantial, 30-60
   * plenty, 15-29 moderate, 0-14 little.
   */
  public static TimeRemainingBucket forPercentage(int percentage) {
    if (percentage > SUBSTANTIAL_ABOVE) {
      return SUBSTANTIAL;
    }
    if (percentage >= PLENTY_FROM) {
      return PLENTY;
    }
    if (percentage >= MODERATE_FROM) {
      return MODERATE;
    }
    return LITTLE;
  }
}

package io.b2mash.projecthealth.duration;

/** Converts a duration profile into a time-remaining percentage and urgency bucket. */
public final class TimeRemainingClassifier {

  private TimeRemainingClassifier() {}

  public static TimeRemaining classify(DurationResult duration) {
    if (duration == null
        || duration.totalDays() == null
        || duration.totalDays() == 0
        || duration.totalDaysRemaining() == null) {
      return TimeRemaining.unknown();
    }

    int remaining = duration.totalDaysRemaining();
    if (remaining < 0) {
      return TimeRemaining.overdue();
    }

    int percentage =
        (int) Math.min(Integer.MAX_VALUE, Math.round(remaining * 100.0 / duration.totalDays()));
    return new TimeRemaining(percentage, TimeRemainingBucket.forPercentage(percentage));
  }

  /**
   * Returns a short human-readable summary of the remaining time, e.g. "12 days remaining (9
   * working days)" or "3 days overdue".
   */
  public static String describe(DurationResult duration) {
    if (duration == null || duration.totalDaysRemaining() == null) {
      return "No schedule data";
    }

    int remaining = duration.totalDaysRemaining();
    if (remaining < 0) {
      return days(-remaining) + " overdue";
    }
    if (remaining == 0) {
      return "Due today";
    }

    String summary = days(remaining) + " remaining";
    if (duration.workingDaysRemaining() != null) {
      summary += " (" + plural(duration.workingDaysRemaining(), "working day") + ")";
    }
    return summary;
  }

  private static String days(int count) {
    return plural(count, "day");
  }

  private static String plural(int count, String noun) {
    return count == 1 ? "1 " + noun : count + " " + noun + "s";
  }
}

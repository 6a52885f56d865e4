package io.b2mash.projecthealth.health.dto;

import io.b2mash.projecthealth.calendar.CalendarMath;
import io.b2mash.projecthealth.milestone.MilestoneInput;
import io.b2mash.projecthealth.milestone.MilestoneStatus;
import java.time.LocalDate;

/**
 * One milestone as seen by the analyzer. {@code daysFromToday} is negative for past dates and null
 * when the milestone has no date.
 */
public record MilestoneDetail(
    String title,
    LocalDate date,
    int completion,
    int weight,
    Integer daysFromToday,
    MilestoneStatus status) {

  public static MilestoneDetail of(MilestoneInput milestone, LocalDate today) {
    Integer daysFromToday =
        milestone.hasDate() ? CalendarMath.signedDaysBetween(today, milestone.date()) : null;
    return new MilestoneDetail(
        milestone.title(),
        milestone.date(),
        milestone.effectiveCompletion(),
        milestone.effectiveWeight(),
        daysFromToday,
        milestone.status());
  }

  public boolean isPastAndIncomplete() {
    return daysFromToday != null && daysFromToday < 0 && completion < 100;
  }
}

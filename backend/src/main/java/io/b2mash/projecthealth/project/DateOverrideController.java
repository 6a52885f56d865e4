package io.b2mash.projecthealth.project;

import io.b2mash.projecthealth.duration.DurationCalculator;
import io.b2mash.projecthealth.duration.DurationResult;
import io.b2mash.projecthealth.milestone.MilestoneInput;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Two-state machine deciding whether a project's start/end dates follow the milestone-derived
 * duration (AUTO) or stay at manually edited values (MANUAL). Both dates always switch together.
 *
 * <p>Operations report rejected transitions through their boolean result; callers decide whether
 * that is an error.
 */
public final class DateOverrideController {

  private DateOverrideController() {}

  public static DateMode modeOf(DateSchedule schedule) {
    return DateMode.of(schedule.isDatesOverridden());
  }

  /**
   * In AUTO mode, copies the computed start/end onto the schedule when they differ from the stored
   * values. Does nothing in MANUAL mode or when there is nothing to change.
   *
   * @return true if the stored dates were written
   */
  public static boolean syncAutoDates(DateSchedule schedule, DurationResult computed) {
    if (modeOf(schedule) != DateMode.AUTO) {
      return false;
    }
    if (Objects.equals(schedule.getStartDate(), computed.startDate())
        && Objects.equals(schedule.getEndDate(), computed.endDate())) {
      return false;
    }
    schedule.setDates(computed.startDate(), computed.endDate());
    return true;
  }

  /**
   * Switches AUTO to MANUAL. The computed dates, which are the ones in force while in AUTO mode,
   * become the editable baseline even if the stored copy has not caught up with them yet.
   *
   * @return false if the schedule was already in MANUAL mode
   */
  public static boolean enableOverride(DateSchedule schedule, DurationResult computed) {
    if (!modeOf(schedule).canTransitionTo(DateMode.MANUAL)) {
      return false;
    }
    syncAutoDates(schedule, computed);
    schedule.setDatesOverridden(true);
    return true;
  }

  /**
   * Replaces both dates while in MANUAL mode.
   *
   * @return false if the schedule is in AUTO mode, where dates follow the milestones
   */
  public static boolean applyManualDates(
      DateSchedule schedule, LocalDate startDate, LocalDate endDate) {
    if (modeOf(schedule) != DateMode.MANUAL) {
      return false;
    }
    schedule.setDates(startDate, endDate);
    return true;
  }

  /**
   * Switches MANUAL back to AUTO, discarding the manual dates in favour of the computed ones.
   *
   * @return false if the schedule was already in AUTO mode
   */
  public static boolean disableOverride(DateSchedule schedule, DurationResult computed) {
    if (!modeOf(schedule).canTransitionTo(DateMode.AUTO)) {
      return false;
    }
    schedule.setDatesOverridden(false);
    schedule.setDates(computed.startDate(), computed.endDate());
    return true;
  }

  /**
   * Returns the duration the rest of the engine should use: the milestone-derived duration in AUTO
   * mode, or the duration of the manually set dates in MANUAL mode.
   */
  public static DurationResult effectiveDuration(
      ProjectHealthInput project, List<MilestoneInput> milestones, LocalDate today) {
    if (project.datesOverridden()) {
      return DurationCalculator.forRange(project.startDate(), project.endDate(), today);
    }
    return DurationCalculator.computeDuration(milestones, today);
  }
}

package io.b2mash.projecthealth.health;

import io.b2mash.projecthealth.duration.DurationResult;
import io.b2mash.projecthealth.duration.TimeRemaining;
import io.b2mash.projecthealth.duration.TimeRemainingBucket;
import io.b2mash.projecthealth.duration.TimeRemainingClassifier;
import io.b2mash.projecthealth.milestone.MilestoneInput;
import io.b2mash.projecthealth.milestone.WeightedCompletionCalculator;
import io.b2mash.projecthealth.project.DateOverrideController;
import io.b2mash.projecthealth.project.ProjectHealthInput;
import io.b2mash.projecthealth.project.ProjectStatus;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deterministic, time-aware project health classification. Pure utility class with no Spring
 * dependencies.
 *
 * <p>Rules, first match wins:
 *
 * <ol>
 *   <li>Manual calculation type -> manual color and percentage
 *   <li>Completed -> green, 100
 *   <li>Cancelled -> red, 0
 *   <li>Draft or on hold -> yellow, weighted completion
 *   <li>Active with milestones -> weighted completion against the time-remaining bucket
 *   <li>Active without milestones -> green, 0
 * </ol>
 *
 * <p>Thresholds loosen while much of the schedule is ahead and tighten towards and past the
 * deadline. Once a project is overdue green is unreachable.
 */
public final class HealthStatusEngine {

  static final Map<TimeRemainingBucket, CompletionThresholds> THRESHOLDS = thresholds();

  private HealthStatusEngine() {}

  /**
   * Calculates the health of a project as seen on {@code today}.
   *
   * @param project project status, calculation mode and date override state
   * @param milestones the project's milestones, may be empty
   * @param today the current date, supplied by the caller
   * @return the computed health with color, percentage and reasoning
   */
  public static HealthResult computeHealth(
      ProjectHealthInput project, List<MilestoneInput> milestones, LocalDate today) {
    Objects.requireNonNull(project, "project");
    Objects.requireNonNull(today, "today");
    List<MilestoneInput> safeMilestones = milestones != null ? milestones : List.of();

    // Rule 1: manual override
    if (project.isManual()) {
      return manual(project);
    }

    ProjectStatus status = project.effectiveStatus();

    // Rules 2-4: lifecycle status decides
    if (status == ProjectStatus.COMPLETED) {
      return statusBased(StatusColor.GREEN, 100, "Project is completed: green at 100%");
    }
    if (status == ProjectStatus.CANCELLED) {
      return statusBased(StatusColor.RED, 0, "Project is cancelled: red at 0%");
    }
    if (status.isPaused()) {
      int completion = WeightedCompletionCalculator.weightedCompletion(safeMilestones);
      return statusBased(
          StatusColor.YELLOW,
          completion,
          "Project is %s: held at yellow with %d%% weighted completion"
              .formatted(status.label(), completion));
    }

    // Rule 6: active project not yet planned out
    if (safeMilestones.isEmpty()) {
      return new HealthResult(
          StatusColor.GREEN,
          0,
          "Active project with no milestones: green at 0% until milestones are planned",
          HealthBasis.NO_MILESTONES,
          null);
    }

    // Rule 5: completion against time remaining
    int completion = WeightedCompletionCalculator.weightedCompletion(safeMilestones);
    DurationResult duration =
        DateOverrideController.effectiveDuration(project, safeMilestones, today);
    TimeRemaining timeRemaining = TimeRemainingClassifier.classify(duration);
    return timeAware(completion, timeRemaining);
  }

  private static HealthResult manual(ProjectHealthInput project) {
    StatusColor color =
        project.manualStatusColor() != null ? project.manualStatusColor() : StatusColor.GREEN;
    int percentage =
        project.manualHealthPercentage() != null
            ? clampPercentage(project.manualHealthPercentage())
            : 0;

    var reasoning =
        new StringBuilder(
            "Manual override: status set to %s at %d%%".formatted(color.label(), percentage));
    if (project.manualStatusColor() == null) {
      reasoning.append(" (no manual color set, defaulted to green)");
    }
    if (project.manualHealthPercentage() == null) {
      reasoning.append(" (no manual percentage set, defaulted to 0%)");
    }
    return new HealthResult(color, percentage, reasoning.toString(), HealthBasis.MANUAL, null);
  }

  private static HealthResult statusBased(StatusColor color, int percentage, String reasoning) {
    return new HealthResult(color, percentage, reasoning, HealthBasis.STATUS_BASED, null);
  }

  private static HealthResult timeAware(int completion, TimeRemaining timeRemaining) {
    TimeRemainingBucket bucket = timeRemaining.bucket();
    CompletionThresholds thresholds = THRESHOLDS.get(bucket);
    StatusColor color = thresholds.colorFor(completion);

    String reasoning;
    HealthBasis basis;
    if (bucket == TimeRemainingBucket.UNKNOWN) {
      basis = HealthBasis.MILESTONE_ONLY;
      reasoning =
          "Milestone-only calculation: %d%% weighted completion, no schedule data (%s) = %s"
              .formatted(completion, thresholds.describe(), color.label());
    } else if (bucket == TimeRemainingBucket.OVERDUE) {
      basis = HealthBasis.TIME_AWARE;
      reasoning =
          "Overdue: %d%% weighted completion with 0%% time remaining (%s) = %s"
              .formatted(completion, thresholds.describe(), color.label());
    } else {
      basis = HealthBasis.TIME_AWARE;
      reasoning =
          "Time-aware calculation: %d%% weighted completion with %d%% time remaining (%s; %s) = %s"
              .formatted(
                  completion,
                  timeRemaining.percentage(),
                  bucket.description(),
                  thresholds.describe(),
                  color.label());
      if (timeRemaining.exceedsWindow()) {
        reasoning +=
            ". Time remaining exceeds the planned window: the schedule starts after today or"
                + " was shortened";
      }
    }
    return new HealthResult(color, completion, reasoning, basis, timeRemaining);
  }

  private static int clampPercentage(int value) {
    return Math.max(0, Math.min(100, value));
  }

  private static Map<TimeRemainingBucket, CompletionThresholds> thresholds() {
    var table = new EnumMap<TimeRemainingBucket, CompletionThresholds>(TimeRemainingBucket.class);
    table.put(TimeRemainingBucket.UNKNOWN, new CompletionThresholds(70, 40));
    table.put(
        TimeRemainingBucket.OVERDUE,
        new CompletionThresholds(CompletionThresholds.UNREACHABLE, 90));
    table.put(TimeRemainingBucket.SUBSTANTIAL, new CompletionThresholds(10, 5));
    table.put(TimeRemainingBucket.PLENTY, new CompletionThresholds(20, 10));
    table.put(TimeRemainingBucket.MODERATE, new CompletionThresholds(40, 25));
    table.put(TimeRemainingBucket.LITTLE, new CompletionThresholds(80, 60));
    return Collections.unmodifiableMap(table);
  }
}

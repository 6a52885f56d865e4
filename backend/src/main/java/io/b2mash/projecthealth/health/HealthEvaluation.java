package io.b2mash.projecthealth.health;

import io.b2mash.projecthealth.duration.DurationResult;
import io.b2mash.projecthealth.duration.TimeRemaining;
import io.b2mash.projecthealth.duration.TimeRemainingClassifier;
import io.b2mash.projecthealth.milestone.MilestoneInput;
import io.b2mash.projecthealth.milestone.WeightedCompletionCalculator;
import io.b2mash.projecthealth.project.DateMode;
import io.b2mash.projecthealth.project.DateOverrideController;
import io.b2mash.projecthealth.project.ProjectHealthInput;
import java.time.LocalDate;
import java.util.List;

/**
 * Everything the engine derives for one project on one day: the health result together with the
 * duration profile and time-remaining figures it was based on.
 *
 * @param health color, percentage and reasoning
 * @param duration effective duration (milestone-derived, or from overridden dates)
 * @param timeRemaining time-remaining percentage and bucket for the effective duration
 * @param timeRemainingDescription human-readable remaining-time summary
 * @param weightedCompletion weighted milestone completion, regardless of which rule fired
 * @param dateMode whether dates follow the milestones or are overridden
 * @param asOf the day the evaluation was computed for
 */
public record HealthEvaluation(
    HealthResult health,
    DurationResult duration,
    TimeRemaining timeRemaining,
    String timeRemainingDescription,
    int weightedCompletion,
    DateMode dateMode,
    LocalDate asOf) {

  public static HealthEvaluation evaluate(
      ProjectHealthInput project, List<MilestoneInput> milestones, LocalDate today) {
    DurationResult duration = DateOverrideController.effectiveDuration(project, milestones, today);
    return new HealthEvaluation(
        HealthStatusEngine.computeHealth(project, milestones, today),
        duration,
        TimeRemainingClassifier.classify(duration),
        TimeRemainingClassifier.describe(duration),
        WeightedCompletionCalculator.weightedCompletion(milestones),
        DateMode.of(project.datesOverridden()),
        today);
  }
}

package io.b2mash.projecthealth.health;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.projecthealth.duration.TimeRemainingBucket;
import io.b2mash.projecthealth.milestone.MilestoneInput;
import io.b2mash.projecthealth.project.HealthCalculationType;
import io.b2mash.projecthealth.project.ProjectHealthInput;
import io.b2mash.projecthealth.project.ProjectStatus;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class HealthStatusEngineTest {

  private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);
  private static final LocalDate JAN_31 = LocalDate.of(2024, 1, 31);
  // 100 days inclusive, so days remaining equal the time-remaining percentage
  private static final LocalDate APR_9 = LocalDate.of(2024, 4, 9);

  @Test
  void activeWithoutScheduleUsesMilestoneOnlyThresholds() {
    var milestones = List.of(undated(75), undated(75));

    var result = HealthStatusEngine.computeHealth(active(), milestones, JAN_1);

    assertThat(result.color()).isEqualTo(StatusColor.GREEN);
    assertThat(result.percentage()).isEqualTo(75);
    assertThat(result.basis()).isEqualTo(HealthBasis.MILESTONE_ONLY);
    assertThat(result.timeRemaining().bucket()).isEqualTo(TimeRemainingBucket.UNKNOWN);
    assertThat(result.reasoning())
        .isEqualTo(
            "Milestone-only calculation: 75% weighted completion, no schedule data"
                + " (green at >= 70%, yellow at >= 40%) = green");
  }

  @Test
  void overdueProjectNeedsNinetyPercentForYellow() {
    LocalDate today = LocalDate.of(2024, 1, 10);
    var nearlyDone =
        List.of(dated(LocalDate.of(2023, 12, 1), 95), dated(LocalDate.of(2024, 1, 7), 95));
    var halfDone =
        List.of(dated(LocalDate.of(2023, 12, 1), 50), dated(LocalDate.of(2024, 1, 7), 50));

    var yellow = HealthStatusEngine.computeHealth(active(), nearlyDone, today);
    var red = HealthStatusEngine.computeHealth(active(), halfDone, today);

    assertThat(yellow.color()).isEqualTo(StatusColor.YELLOW);
    assertThat(yellow.percentage()).isEqualTo(95);
    assertThat(yellow.timeRemaining().bucket()).isEqualTo(TimeRemainingBucket.OVERDUE);
    assertThat(red.color()).isEqualTo(StatusColor.RED);
    assertThat(red.percentage()).isEqualTo(50);
  }

  @Test
  void overdueProjectNeverTurnsGreen() {
    var done = List.of(dated(LocalDate.of(2023, 12, 1), 100));

    var result = HealthStatusEngine.computeHealth(active(), done, JAN_1);

    assertThat(result.color()).isEqualTo(StatusColor.YELLOW);
    assertThat(result.reasoning()).contains("green unreachable");
  }

  @Test
  void draftProjectIsHeldAtYellow() {
    var milestones = List.of(dated(JAN_1, 30), dated(JAN_31, 30));

    var result =
        HealthStatusEngine.computeHealth(
            ProjectHealthInput.automatic(ProjectStatus.DRAFT), milestones, JAN_1);

    assertThat(result.color()).isEqualTo(StatusColor.YELLOW);
    assertThat(result.percentage()).isEqualTo(30);
    assertThat(result.basis()).isEqualTo(HealthBasis.STATUS_BASED);
    assertThat(result.reasoning())
        .isEqualTo("Project is draft: held at yellow with 30% weighted completion");
  }

  @Test
  void onHoldProjectIsHeldAtYellow() {
    var result =
        HealthStatusEngine.computeHealth(
            ProjectHealthInput.automatic(ProjectStatus.ON_HOLD), List.of(undated(10)), JAN_1);

    assertThat(result.color()).isEqualTo(StatusColor.YELLOW);
    assertThat(result.reasoning()).startsWith("Project is on hold");
  }

  @Test
  void manualOverrideIgnoresMilestones() {
    var project = manual(StatusColor.RED, 20);
    var milestones = List.of(dated(JAN_1, 100), dated(JAN_31, 100));

    var result = HealthStatusEngine.computeHealth(project, milestones, JAN_1);

    assertThat(result.color()).isEqualTo(StatusColor.RED);
    assertThat(result.percentage()).isEqualTo(20);
    assertThat(result.basis()).isEqualTo(HealthBasis.MANUAL);
    assertThat(result.reasoning()).isEqualTo("Manual override: status set to red at 20%");
  }

  @Test
  void manualOverrideTakesPrecedenceOverTerminalStatus() {
    var project =
        new ProjectHealthInput(
            ProjectStatus.CANCELLED,
            HealthCalculationType.MANUAL,
            StatusColor.GREEN,
            80,
            null,
            null,
            false);

    var result = HealthStatusEngine.computeHealth(project, List.of(), JAN_1);

    assertThat(result.color()).isEqualTo(StatusColor.GREEN);
    assertThat(result.percentage()).isEqualTo(80);
  }

  @Test
  void manualOverrideWithMissingFieldsFallsBackToGreenAtZero() {
    var result = HealthStatusEngine.computeHealth(manual(null, null), List.of(), JAN_1);

    assertThat(result.color()).isEqualTo(StatusColor.GREEN);
    assertThat(result.percentage()).isZero();
    assertThat(result.reasoning())
        .contains("no manual color set, defaulted to green")
        .contains("no manual percentage set, defaulted to 0%");
  }

  @Test
  void manualPercentageIsClamped() {
    var result =
        HealthStatusEngine.computeHealth(manual(StatusColor.YELLOW, 150), List.of(), JAN_1);

    assertThat(result.percentage()).isEqualTo(100);
  }

  @Test
  void terminalStatusesDominateMilestoneData() {
    var stalled = List.of(dated(LocalDate.of(2023, 6, 1), 0));
    var finished = List.of(dated(JAN_1, 100));

    var completed =
        HealthStatusEngine.computeHealth(
            ProjectHealthInput.automatic(ProjectStatus.COMPLETED), stalled, JAN_31);
    var cancelled =
        HealthStatusEngine.computeHealth(
            ProjectHealthInput.automatic(ProjectStatus.CANCELLED), finished, JAN_31);

    assertThat(completed.color()).isEqualTo(StatusColor.GREEN);
    assertThat(completed.percentage()).isEqualTo(100);
    assertThat(cancelled.color()).isEqualTo(StatusColor.RED);
    assertThat(cancelled.percentage()).isZero();
  }

  @Test
  void activeWithoutMilestonesIsGreenAtZero() {
    var result = HealthStatusEngine.computeHealth(active(), List.of(), JAN_1);

    assertThat(result.color()).isEqualTo(StatusColor.GREEN);
    assertThat(result.percentage()).isZero();
    assertThat(result.basis()).isEqualTo(HealthBasis.NO_MILESTONES);
  }

  @Test
  void missingStatusIsTreatedAsActive() {
    var result =
        HealthStatusEngine.computeHealth(
            ProjectHealthInput.automatic(null), List.of(undated(40)), JAN_1);

    assertThat(result.color()).isEqualTo(StatusColor.YELLOW);
    assertThat(result.basis()).isEqualTo(HealthBasis.MILESTONE_ONLY);
  }

  @Test
  void substantialTimeRemainingIsLenient() {
    // Jan 1 - Jan 31 seen on Jan 2: 29 of 31 days left = 94%
    var milestones = List.of(dated(JAN_1, 10), dated(JAN_31, 10));

    var result = HealthStatusEngine.computeHealth(active(), milestones, LocalDate.of(2024, 1, 2));

    assertThat(result.color()).isEqualTo(StatusColor.GREEN);
    assertThat(result.basis()).isEqualTo(HealthBasis.TIME_AWARE);
    assertThat(result.timeRemaining().percentage()).isEqualTo(94);
    assertThat(result.reasoning())
        .isEqualTo(
            "Time-aware calculation: 10% weighted completion with 94% time remaining"
                + " (substantial time; green at >= 10%, yellow at >= 5%) = green");
  }

  @Test
  void thresholdsTightenAsTheDeadlineApproaches() {
    // Jan 15: 16/31 = 52% plenty; Jan 25: 6/31 = 19% moderate; Jan 30: 1/31 = 3% little
    assertThat(colorOn(LocalDate.of(2024, 1, 15), 15)).isEqualTo(StatusColor.YELLOW);
    assertThat(colorOn(LocalDate.of(2024, 1, 15), 20)).isEqualTo(StatusColor.GREEN);
    assertThat(colorOn(LocalDate.of(2024, 1, 25), 30)).isEqualTo(StatusColor.YELLOW);
    assertThat(colorOn(LocalDate.of(2024, 1, 25), 24)).isEqualTo(StatusColor.RED);
    assertThat(colorOn(LocalDate.of(2024, 1, 30), 70)).isEqualTo(StatusColor.YELLOW);
    assertThat(colorOn(LocalDate.of(2024, 1, 30), 80)).isEqualTo(StatusColor.GREEN);
    assertThat(colorOn(LocalDate.of(2024, 1, 30), 59)).isEqualTo(StatusColor.RED);
  }

  @Test
  void overriddenDatesDriveTheTimeRemaining() {
    var project =
        new ProjectHealthInput(
            ProjectStatus.ACTIVE,
            HealthCalculationType.AUTOMATIC,
            null,
            null,
            LocalDate.of(2024, 2, 1),
            LocalDate.of(2024, 2, 10),
            true);

    var result = HealthStatusEngine.computeHealth(project, List.of(undated(50)), JAN_1);

    assertThat(result.timeRemaining().percentage()).isEqualTo(400);
    assertThat(result.timeRemaining().bucket()).isEqualTo(TimeRemainingBucket.SUBSTANTIAL);
    assertThat(result.color()).isEqualTo(StatusColor.GREEN);
    assertThat(result.reasoning()).contains("Time remaining exceeds the planned window");
  }

  @Test
  void sameInputsGiveSameResult() {
    var milestones = List.of(dated(JAN_1, 35), dated(JAN_31, 60));
    LocalDate today = LocalDate.of(2024, 1, 20);

    assertThat(HealthStatusEngine.computeHealth(active(), milestones, today))
        .isEqualTo(HealthStatusEngine.computeHealth(active(), milestones, today));
  }

  @Test
  void extremeMilestoneDatesStillProduceAResult() {
    var milestones =
        List.of(dated(LocalDate.of(-999_999_999, 1, 1), 50), dated(LocalDate.MAX, 50));

    var result = HealthStatusEngine.computeHealth(active(), milestones, JAN_1);

    assertThat(result.basis()).isEqualTo(HealthBasis.TIME_AWARE);
    assertThat(result.timeRemaining().bucket()).isEqualTo(TimeRemainingBucket.SUBSTANTIAL);
    assertThat(result.color()).isEqualTo(StatusColor.GREEN);
  }

  @ParameterizedTest(name = "{0} at {1}% -> {2}")
  @CsvSource({
    "UNKNOWN, 70, GREEN",
    "UNKNOWN, 69, YELLOW",
    "UNKNOWN, 40, YELLOW",
    "UNKNOWN, 39, RED",
    "OVERDUE, 100, YELLOW",
    "OVERDUE, 90, YELLOW",
    "OVERDUE, 89, RED",
    "SUBSTANTIAL, 10, GREEN",
    "SUBSTANTIAL, 9, YELLOW",
    "SUBSTANTIAL, 5, YELLOW",
    "SUBSTANTIAL, 4, RED",
    "PLENTY, 20, GREEN",
    "PLENTY, 19, YELLOW",
    "PLENTY, 10, YELLOW",
    "PLENTY, 9, RED",
    "MODERATE, 40, GREEN",
    "MODERATE, 39, YELLOW",
    "MODERATE, 25, YELLOW",
    "MODERATE, 24, RED",
    "LITTLE, 80, GREEN",
    "LITTLE, 79, YELLOW",
    "LITTLE, 60, YELLOW",
    "LITTLE, 59, RED"
  })
  void completionThresholdsPerBucket(
      TimeRemainingBucket bucket, int completion, StatusColor expected) {
    var project =
        bucket == TimeRemainingBucket.UNKNOWN
            ? active()
            : new ProjectHealthInput(
                ProjectStatus.ACTIVE,
                HealthCalculationType.AUTOMATIC,
                null,
                null,
                JAN_1,
                APR_9,
                true);

    var result =
        HealthStatusEngine.computeHealth(project, List.of(undated(completion)), dayIn(bucket));

    assertThat(result.timeRemaining().bucket()).isEqualTo(bucket);
    assertThat(result.percentage()).isEqualTo(completion);
    assertThat(result.color()).isEqualTo(expected);
  }

  private static LocalDate dayIn(TimeRemainingBucket bucket) {
    return switch (bucket) {
      case SUBSTANTIAL -> APR_9.minusDays(80);
      case PLENTY -> APR_9.minusDays(45);
      case MODERATE -> APR_9.minusDays(20);
      case LITTLE -> APR_9.minusDays(5);
      case OVERDUE -> APR_9.plusDays(3);
      case UNKNOWN -> JAN_1;
    };
  }

  private static StatusColor colorOn(LocalDate today, int completion) {
    var milestones = List.of(dated(JAN_1, completion), dated(JAN_31, completion));
    return HealthStatusEngine.computeHealth(active(), milestones, today).color();
  }

  private static ProjectHealthInput active() {
    return ProjectHealthInput.automatic(ProjectStatus.ACTIVE);
  }

  private static ProjectHealthInput manual(StatusColor color, Integer percentage) {
    return new ProjectHealthInput(
        ProjectStatus.ACTIVE, HealthCalculationType.MANUAL, color, percentage, null, null, false);
  }

  private static MilestoneInput dated(LocalDate date, int completion) {
    return new MilestoneInput("m", date, null, completion, 3, null);
  }

  private static MilestoneInput undated(int completion) {
    return new MilestoneInput("m", null, null, completion, 3, null);
  }
}

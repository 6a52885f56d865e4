package io.b2mash.projecthealth.project;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.projecthealth.duration.DurationCalculator;
import io.b2mash.projecthealth.milestone.MilestoneInput;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DateOverrideControllerTest {

  private static final LocalDate TODAY = LocalDate.of(2024, 1, 10);

  private final List<MilestoneInput> milestones =
      List.of(
          new MilestoneInput("Design", LocalDate.of(2024, 1, 2), null, 100, 3, null),
          new MilestoneInput(
              "Build", LocalDate.of(2024, 1, 15), LocalDate.of(2024, 2, 9), 20, 5, null));

  private Project project;

  @BeforeEach
  void setUp() {
    project = new Project("Roadmap", ProjectStatus.ACTIVE);
  }

  @Test
  void autoModeFollowsComputedDates() {
    var computed = DurationCalculator.computeDuration(milestones, TODAY);

    assertThat(DateOverrideController.syncAutoDates(project, computed)).isTrue();
    assertThat(DateOverrideController.syncAutoDates(project, computed)).isFalse();
    assertThat(project.getStartDate()).isEqualTo(LocalDate.of(2024, 1, 2));
    assertThat(project.getEndDate()).isEqualTo(LocalDate.of(2024, 2, 9));
  }

  @Test
  void enablingOverrideFreezesComputedDatesEvenWhenNothingWasStored() {
    var computed = DurationCalculator.computeDuration(milestones, TODAY);
    assertThat(project.getStartDate()).isNull();

    assertThat(DateOverrideController.enableOverride(project, computed)).isTrue();

    assertThat(DateOverrideController.modeOf(project)).isEqualTo(DateMode.MANUAL);
    assertThat(project.getStartDate()).isEqualTo(LocalDate.of(2024, 1, 2));
    assertThat(project.getEndDate()).isEqualTo(LocalDate.of(2024, 2, 9));
  }

  @Test
  void manualModeIgnoresLaterComputedDates() {
    DateOverrideController.enableOverride(
        project, DurationCalculator.computeDuration(milestones, TODAY));
    var shifted =
        DurationCalculator.computeDuration(
            List.of(new MilestoneInput("Late", LocalDate.of(2024, 5, 1), null, 0, 3, null)),
            TODAY);

    assertThat(DateOverrideController.syncAutoDates(project, shifted)).isFalse();
    assertThat(project.getStartDate()).isEqualTo(LocalDate.of(2024, 1, 2));
  }

  @Test
  void manualDatesOnlyApplyInManualMode() {
    var start = LocalDate.of(2024, 3, 1);
    var end = LocalDate.of(2024, 3, 29);

    var computed = DurationCalculator.computeDuration(milestones, TODAY);

    assertThat(DateOverrideController.applyManualDates(project, start, end)).isFalse();
    assertThat(DateOverrideController.enableOverride(project, computed)).isTrue();
    assertThat(DateOverrideController.enableOverride(project, computed)).isFalse();
    assertThat(DateOverrideController.applyManualDates(project, start, end)).isTrue();
    assertThat(DateOverrideController.modeOf(project)).isEqualTo(DateMode.MANUAL);
    assertThat(project.getStartDate()).isEqualTo(start);
    assertThat(project.getEndDate()).isEqualTo(end);
  }

  @Test
  void overrideRoundTripRestoresComputedDates() {
    var computed = DurationCalculator.computeDuration(milestones, TODAY);
    DateOverrideController.syncAutoDates(project, computed);

    DateOverrideController.enableOverride(project, computed);
    DateOverrideController.applyManualDates(
        project, LocalDate.of(2023, 11, 1), LocalDate.of(2024, 6, 30));
    assertThat(DateOverrideController.disableOverride(project, computed)).isTrue();

    assertThat(DateOverrideController.modeOf(project)).isEqualTo(DateMode.AUTO);
    assertThat(project.getStartDate()).isEqualTo(computed.startDate());
    assertThat(project.getEndDate()).isEqualTo(computed.endDate());
    assertThat(DateOverrideController.disableOverride(project, computed)).isFalse();
  }

  @Test
  void effectiveDurationUsesOverriddenDates() {
    var overridden =
        new ProjectHealthInput(
            ProjectStatus.ACTIVE,
            HealthCalculationType.AUTOMATIC,
            null,
            null,
            LocalDate.of(2024, 1, 8),
            LocalDate.of(2024, 1, 19),
            true);

    var duration = DateOverrideController.effectiveDuration(overridden, milestones, TODAY);

    assertThat(duration.startDate()).isEqualTo(LocalDate.of(2024, 1, 8));
    assertThat(duration.totalDays()).isEqualTo(12);
    assertThat(duration.workingDays()).isEqualTo(10);
    assertThat(
            DateOverrideController.effectiveDuration(
                    ProjectHealthInput.automatic(ProjectStatus.ACTIVE), milestones, TODAY)
                .endDate())
        .isEqualTo(LocalDate.of(2024, 2, 9));
  }
}

package io.b2mash.projecthealth.health.dto;

import io.b2mash.projecthealth.duration.DurationResult;
import io.b2mash.projecthealth.duration.TimeRemaining;
import io.b2mash.projecthealth.health.HealthEvaluation;
import io.b2mash.projecthealth.health.HealthResult;
import io.b2mash.projecthealth.project.DateMode;
import io.b2mash.projecthealth.project.ProjectStatus;
import java.time.LocalDate;
import java.util.UUID;

/** Health and duration view of a stored project, as returned by the project health endpoints. */
public record ProjectHealthDetail(
    UUID projectId,
    String title,
    ProjectStatus status,
    HealthResult health,
    DurationResult duration,
    TimeRemaining timeRemaining,
    String timeRemainingDescription,
    int weightedCompletion,
    DateMode dateMode,
    LocalDate asOf) {

  public static ProjectHealthDetail of(
      UUID projectId, String title, ProjectStatus status, HealthEvaluation evaluation) {
    return new ProjectHealthDetail(
        projectId,
        title,
        status,
        evaluation.health(),
        evaluation.duration(),
        evaluation.timeRemaining(),
        evaluation.timeRemainingDescription(),
        evaluation.weightedCompletion(),
        evaluation.dateMode(),
        evaluation.asOf());
  }
}

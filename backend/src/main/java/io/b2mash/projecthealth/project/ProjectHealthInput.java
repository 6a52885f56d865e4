package io.b2mash.projecthealth.project;

import io.b2mash.projecthealth.health.StatusColor;
import java.time.LocalDate;

/**
 * Project fields read by the health engine.
 *
 * @param status lifecycle status; null is treated as ACTIVE
 * @param healthCalculationType automatic or manual; null is treated as AUTOMATIC
 * @param manualStatusColor color used in manual mode, may be null
 * @param manualHealthPercentage percentage used in manual mode, may be null
 * @param startDate stored project start date (authoritative only while dates are overridden)
 * @param endDate stored project end date (authoritative only while dates are overridden)
 * @param datesOverridden true when start/end dates are frozen at manually edited values
 */
public record ProjectHealthInput(
    ProjectStatus status,
    HealthCalculationType healthCalculationType,
    StatusColor manualStatusColor,
    Integer manualHealthPercentage,
    LocalDate startDate,
    LocalDate endDate,
    boolean datesOverridden) {

  /** Input for an automatically calculated project with milestone-derived dates. */
  public static ProjectHealthInput automatic(ProjectStatus status) {
    return new ProjectHealthInput(
        status, HealthCalculationType.AUTOMATIC, null, null, null, null, false);
  }

  public ProjectStatus effectiveStatus() {
    return status != null ? status : ProjectStatus.ACTIVE;
  }

  public boolean isManual() {
    return healthCalculationType == HealthCalculationType.MANUAL;
  }
}

package io.b2mash.projecthealth.health.dto;

import io.b2mash.projecthealth.health.StatusColor;
import io.b2mash.projecthealth.project.HealthCalculationType;
import io.b2mash.projecthealth.project.ProjectStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.LocalDate;
import java.util.List;

/**
 * Unsaved project state to evaluate. {@code asOf} defaults to today when omitted.
 */
public record HealthPreviewRequest(
    ProjectStatus status,
    HealthCalculationType healthCalculationType,
    StatusColor manualStatusColor,
    @Min(0) @Max(100) Integer manualHealthPercentage,
    String startDate,
    String endDate,
    boolean datesOverridden,
    LocalDate asOf,
    List<MilestonePreview> milestones) {}

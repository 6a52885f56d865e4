package io.b2mash.projecthealth.project;

import io.b2mash.projecthealth.duration.DurationCalculator;
import io.b2mash.projecthealth.duration.DurationResult;
import io.b2mash.projecthealth.exception.InvalidStateException;
import io.b2mash.projecthealth.exception.ResourceNotFoundException;
import io.b2mash.projecthealth.health.ProjectHealthService;
import io.b2mash.projecthealth.health.dto.ProjectHealthDetail;
import io.b2mash.projecthealth.milestone.Milestone;
import io.b2mash.projecthealth.milestone.MilestoneRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Switches a project's start/end dates between milestone-derived (auto) and manually edited
 * (manual) mode. Every change is followed by a health recalculation so stored figures reflect the
 * dates now in force.
 */
@Service
public class ProjectDateService {

  private static final Logger log = LoggerFactory.getLogger(ProjectDateService.class);

  private final ProjectRepository projectRepository;
  private final MilestoneRepository milestoneRepository;
  private final ProjectHealthService projectHealthService;
  private final Clock clock;

  public ProjectDateService(
      ProjectRepository projectRepository,
      MilestoneRepository milestoneRepository,
      ProjectHealthService projectHealthService,
      Clock clock) {
    this.projectRepository = projectRepository;
    this.milestoneRepository = milestoneRepository;
    this.projectHealthService = projectHealthService;
    this.clock = clock;
  }

  /** Freezes the dates derived from the current milestones as the editable baseline. */
  @Transactional
  public ProjectHealthDetail enableOverride(UUID projectId) {
    var project = requireProject(projectId);
    if (!DateOverrideController.enableOverride(project, computeDuration(projectId))) {
      throw new InvalidStateException(
          projectId,
          "Dates already overridden",
          "Project dates are already set manually");
    }
    log.info(
        "Project {} dates switched to manual at {} to {}",
        projectId,
        project.getStartDate(),
        project.getEndDate());
    return projectHealthService.recalculate(project);
  }

  /** Sets both manual dates. Only valid while the override is enabled. */
  @Transactional
  public ProjectHealthDetail updateManualDates(
      UUID projectId, LocalDate startDate, LocalDate endDate) {
    if (startDate.isAfter(endDate)) {
      throw new InvalidStateException(
          projectId,
          "Invalid date range",
          "Start date must be on or before end date");
    }
    var project = requireProject(projectId);
    if (!DateOverrideController.applyManualDates(project, startDate, endDate)) {
      throw new InvalidStateException(
          projectId,
          "Dates not overridden",
          "Enable the date override before editing project dates");
    }
    log.info("Project {} manual dates set to {} to {}", projectId, startDate, endDate);
    return projectHealthService.recalculate(project);
  }

  /** Discards the manual dates and goes back to the dates derived from the milestones. */
  @Transactional
  public ProjectHealthDetail disableOverride(UUID projectId) {
    var project = requireProject(projectId);
    DurationResult computed = computeDuration(projectId);
    if (!DateOverrideController.disableOverride(project, computed)) {
      throw new InvalidStateException(
          projectId,
          "Dates not overridden",
          "Project dates already follow its milestones");
    }
    log.info(
        "Project {} dates switched back to automatic: {} to {}",
        projectId,
        computed.startDate(),
        computed.endDate());
    return projectHealthService.recalculate(project);
  }

  private DurationResult computeDuration(UUID projectId) {
    var milestones =
        milestoneRepository.findByProjectIdOrderByDateAsc(projectId).stream()
            .map(Milestone::toInput)
            .toList();
    return DurationCalculator.computeDuration(milestones, LocalDate.now(clock));
  }

  private Project requireProject(UUID projectId) {
    return projectRepository
        .findById(projectId)
        .orElseThrow(() -> ResourceNotFoundException.project(projectId));
  }
}

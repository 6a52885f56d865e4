package io.b2mash.projecthealth.health;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.projecthealth.duration.DurationCalculator;
import io.b2mash.projecthealth.duration.DurationResult;
import io.b2mash.projecthealth.exception.ResourceNotFoundException;
import io.b2mash.projecthealth.health.dto.ProjectHealthDetail;
import io.b2mash.projecthealth.health.dto.RecalculationSummary;
import io.b2mash.projecthealth.milestone.Milestone;
import io.b2mash.projecthealth.milestone.MilestoneInput;
import io.b2mash.projecthealth.milestone.MilestoneRepository;
import io.b2mash.projecthealth.project.DateOverrideController;
import io.b2mash.projecthealth.project.Project;
import io.b2mash.projecthealth.project.ProjectRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Loads projects and milestones, runs the health engine against today's date and writes the
 * computed color, percentage and duration columns back. Read results are cached in Caffeine for one
 * minute per project and day; every recalculation evicts the project's entries.
 */
@Service
public class ProjectHealthService {

  private static final Logger log = LoggerFactory.getLogger(ProjectHealthService.class);

  private final ProjectRepository projectRepository;
  private final MilestoneRepository milestoneRepository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  private final Cache<String, ProjectHealthDetail> healthCache =
      Caffeine.newBuilder().maximumSize(5_000).expireAfterWrite(Duration.ofMinutes(1)).build();

  public ProjectHealthService(
      ProjectRepository projectRepository,
      MilestoneRepository milestoneRepository,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.projectRepository = projectRepository;
    this.milestoneRepository = milestoneRepository;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  /**
   * Computes the current health of a project from its stored milestones without persisting
   * anything. The result is served from the health cache for up to one minute per (project, day)
   * and is evicted whenever the project is recalculated.
   *
   * @param projectId the project to evaluate
   * @return health, duration and time-remaining figures as of today
   */
  @Transactional(readOnly = true)
  public ProjectHealthDetail getProjectHealth(UUID projectId) {
    LocalDate today = LocalDate.now(clock);
    String key = cacheKey(projectId, today);
    ProjectHealthDetail cached = healthCache.getIfPresent(key);
    if (cached != null) {
      return cached;
    }

    Project project = requireProject(projectId);
    ProjectHealthDetail result = evaluate(project, loadMilestones(projectId), today);
    healthCache.put(key, result);
    return result;
  }

  /**
   * Recomputes and persists health and duration for a project. In automatic date mode the stored
   * start/end dates follow the milestones.
   */
  @Transactional
  public ProjectHealthDetail recalculate(UUID projectId) {
    return recalculate(requireProject(projectId));
  }

  /** Recomputes and persists health and duration for an already loaded project. */
  @Transactional
  public ProjectHealthDetail recalculate(Project project) {
    LocalDate today = LocalDate.now(clock);
    List<MilestoneInput> milestones = loadMilestones(project.getId());

    DurationResult computed = DurationCalculator.computeDuration(milestones, today);
    if (DateOverrideController.syncAutoDates(project, computed)) {
      log.debug(
          "Project {} dates follow milestones: {} to {}",
          project.getId(),
          computed.startDate(),
          computed.endDate());
    }

    ProjectHealthDetail detail = evaluate(project, milestones, today);
    project.applyDuration(detail.duration());
    project.applyHealth(detail.health(), clock.instant());
    projectRepository.save(project);
    evict(project.getId());

    log.debug(
        "Recalculated project {}: {} at {}% ({})",
        project.getId(),
        detail.health().color(),
        detail.health().percentage(),
        detail.health().basis());
    return detail;
  }

  /**
   * Recalculates every project, one transaction per project. A failing project is recorded in the
   * summary and does not stop the others.
   */
  public RecalculationSummary recalculateAll() {
    List<Project> projects = transactionTemplate.execute(tx -> projectRepository.findAll());
    if (projects == null || projects.isEmpty()) {
      log.info("Health recalculation skipped: no projects found");
      return RecalculationSummary.of(0, 0, List.of());
    }

    log.info("Recalculating health for {} projects", projects.size());
    var summary = recalculateEach(projects.stream().map(Project::getId).toList());
    log.info(
        "Health recalculation complete: {}/{} projects updated",
        summary.updatedCount(),
        summary.totalCount());
    return summary;
  }

  /** Recalculates the given projects, one transaction per project. */
  public RecalculationSummary recalculateProjects(Collection<UUID> projectIds) {
    if (projectIds == null || projectIds.isEmpty()) {
      return RecalculationSummary.of(0, 0, List.of());
    }
    return recalculateEach(List.copyOf(projectIds));
  }

  private RecalculationSummary recalculateEach(List<UUID> projectIds) {
    int updated = 0;
    List<String> errors = new ArrayList<>();
    for (UUID projectId : projectIds) {
      try {
        transactionTemplate.execute(tx -> recalculate(requireProject(projectId)));
        updated++;
      } catch (RuntimeException e) {
        log.error("Failed to recalculate health for project {}", projectId, e);
        errors.add("Failed to recalculate project " + projectId + ": " + e.getMessage());
      }
    }
    if (!errors.isEmpty()) {
      log.warn("Health recalculation finished with {} errors", errors.size());
    }
    return RecalculationSummary.of(updated, projectIds.size(), errors);
  }

  Project requireProject(UUID projectId) {
    return projectRepository
        .findById(projectId)
        .orElseThrow(() -> ResourceNotFoundException.project(projectId));
  }

  List<MilestoneInput> loadMilestones(UUID projectId) {
    return milestoneRepository.findByProjectIdOrderByDateAsc(projectId).stream()
        .map(Milestone::toInput)
        .toList();
  }

  void evict(UUID projectId) {
    String prefix = projectId + ":";
    healthCache.asMap().keySet().removeIf(key -> key.startsWith(prefix));
  }

  private ProjectHealthDetail evaluate(
      Project project, List<MilestoneInput> milestones, LocalDate today) {
    var evaluation = HealthEvaluation.evaluate(project.toHealthInput(), milestones, today);
    return ProjectHealthDetail.of(
        project.getId(), project.getTitle(), project.getStatus(), evaluation);
  }

  private static String cacheKey(UUID projectId, LocalDate today) {
    return projectId + ":" + today;
  }
}

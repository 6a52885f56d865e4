package io.b2mash.projecthealth.duration;

import io.b2mash.projecthealth.calendar.CalendarMath;
import io.b2mash.projecthealth.duration.dto.DurationInconsistency;
import io.b2mash.projecthealth.duration.dto.DurationStats;
import io.b2mash.projecthealth.duration.dto.DurationValidationReport;
import io.b2mash.projecthealth.duration.dto.ProjectRef;
import io.b2mash.projecthealth.project.Project;
import io.b2mash.projecthealth.project.ProjectRepository;
import io.b2mash.projecthealth.project.ProjectStatus;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reports over the duration columns written by the health recalculation: which projects still lack
 * them, aggregate figures, and consistency checks on stored values.
 */
@Service
public class ProjectDurationService {

  private static final Logger log = LoggerFactory.getLogger(ProjectDurationService.class);

  /** Stored total days may drift from the stored dates by this much before being reported. */
  static final int TOTAL_DAYS_TOLERANCE = 1;

  private final ProjectRepository projectRepository;

  public ProjectDurationService(ProjectRepository projectRepository) {
    this.projectRepository = projectRepository;
  }

  /** Projects with at least one duration column still empty. */
  @Transactional(readOnly = true)
  public List<ProjectRef> findProjectsNeedingDurationUpdate() {
    var projects =
        projectRepository.findWithMissingDuration().stream()
            .map(p -> new ProjectRef(p.getId(), p.getTitle()))
            .toList();
    log.debug("Found {} projects needing duration updates", projects.size());
    return projects;
  }

  @Transactional(readOnly = true)
  public DurationStats getDurationStats() {
    var projects = projectRepository.findByStatusNot(ProjectStatus.CANCELLED);
    var withDuration =
        projects.stream()
            .filter(p -> p.getTotalDays() != null && p.getWorkingDays() != null)
            .toList();

    long averageTotalDays = 0;
    long averageWorkingDays = 0;
    if (!withDuration.isEmpty()) {
      averageTotalDays =
          Math.round(withDuration.stream().mapToInt(Project::getTotalDays).average().orElse(0));
      averageWorkingDays =
          Math.round(withDuration.stream().mapToInt(Project::getWorkingDays).average().orElse(0));
    }

    return new DurationStats(
        projects.size(),
        withDuration.size(),
        projects.size() - withDuration.size(),
        averageTotalDays,
        averageWorkingDays);
  }

  /**
   * Checks stored duration data of non-cancelled projects for partial values and for total days
   * that no longer match the stored start and end dates.
   */
  @Transactional(readOnly = true)
  public DurationValidationReport validateDurations() {
    var projects = projectRepository.findByStatusNot(ProjectStatus.CANCELLED);
    List<DurationInconsistency> inconsistencies = new ArrayList<>();
    int validProjects = 0;

    for (Project project : projects) {
      List<String> issues = findIssues(project);
      if (issues.isEmpty()) {
        validProjects++;
      } else {
        issues.forEach(
            issue -> inconsistencies.add(new DurationInconsistency(project.getId(), issue)));
      }
    }

    if (!inconsistencies.isEmpty()) {
      log.warn(
          "Duration validation found {} inconsistencies across {} projects",
          inconsistencies.size(),
          projects.size() - validProjects);
    }
    return new DurationValidationReport(
        validProjects, projects.size() - validProjects, List.copyOf(inconsistencies));
  }

  static List<String> findIssues(Project project) {
    boolean hasStart = project.getDurationStartDate() != null;
    boolean hasEnd = project.getDurationEndDate() != null;
    boolean hasTotal = project.getTotalDays() != null;
    boolean hasWorking = project.getWorkingDays() != null;

    List<String> issues = new ArrayList<>();
    if (hasStart != hasEnd) {
      issues.add("Inconsistent start/end dates");
    }
    if (hasTotal != hasWorking) {
      issues.add("Inconsistent total/working days");
    }
    if ((hasStart && hasEnd) != (hasTotal && hasWorking)) {
      issues.add("Inconsistent date and duration data");
    }
    if (hasStart && hasEnd && hasTotal) {
      int actual =
          CalendarMath.totalDays(project.getDurationStartDate(), project.getDurationEndDate());
      if (Math.abs(actual - project.getTotalDays()) > TOTAL_DAYS_TOLERANCE) {
        issues.add(
            "Total days mismatch: calculated %d, stored %d"
                .formatted(actual, project.getTotalDays()));
      }
    }
    if (hasTotal && hasWorking && project.getWorkingDays() > project.getTotalDays()) {
      issues.add("Working days exceed total days");
    }
    return issues;
  }
}

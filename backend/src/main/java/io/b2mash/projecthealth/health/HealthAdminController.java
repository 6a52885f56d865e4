package io.b2mash.projecthealth.health;

import io.b2mash.projecthealth.duration.ProjectDurationService;
import io.b2mash.projecthealth.duration.dto.DurationStats;
import io.b2mash.projecthealth.duration.dto.DurationValidationReport;
import io.b2mash.projecthealth.duration.dto.ProjectRef;
import io.b2mash.projecthealth.health.dto.HealthIssue;
import io.b2mash.projecthealth.health.dto.RecalculationSummary;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Maintenance endpoints spanning all projects. */
@RestController
@RequestMapping("/api/admin/health")
public class HealthAdminController {

  private final ProjectHealthService projectHealthService;
  private final ProjectDurationService projectDurationService;
  private final ProjectHealthAnalyzer projectHealthAnalyzer;

  public HealthAdminController(
      ProjectHealthService projectHealthService,
      ProjectDurationService projectDurationService,
      ProjectHealthAnalyzer projectHealthAnalyzer) {
    this.projectHealthService = projectHealthService;
    this.projectDurationService = projectDurationService;
    this.projectHealthAnalyzer = projectHealthAnalyzer;
  }

  @PostMapping("/recalculate")
  public ResponseEntity<RecalculationSummary> recalculateAll() {
    return ResponseEntity.ok(projectHealthService.recalculateAll());
  }

  /** Recalculates only the projects whose duration columns have never been filled. */
  @PostMapping("/recalculate-pending")
  public ResponseEntity<RecalculationSummary> recalculatePending() {
    var ids =
        projectDurationService.findProjectsNeedingDurationUpdate().stream()
            .map(ProjectRef::id)
            .toList();
    return ResponseEntity.ok(projectHealthService.recalculateProjects(ids));
  }

  @GetMapping("/duration-stats")
  public ResponseEntity<DurationStats> durationStats() {
    return ResponseEntity.ok(projectDurationService.getDurationStats());
  }

  @GetMapping("/duration-issues")
  public ResponseEntity<DurationValidationReport> durationIssues() {
    return ResponseEntity.ok(projectDurationService.validateDurations());
  }

  @GetMapping("/pending-duration")
  public ResponseEntity<List<ProjectRef>> pendingDuration() {
    return ResponseEntity.ok(projectDurationService.findProjectsNeedingDurationUpdate());
  }

  @GetMapping("/issues")
  public ResponseEntity<List<HealthIssue>> issues() {
    return ResponseEntity.ok(projectHealthAnalyzer.findIssues());
  }
}

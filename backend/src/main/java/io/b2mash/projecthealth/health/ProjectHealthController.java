package io.b2mash.projecthealth.health;

import io.b2mash.projecthealth.health.dto.HealthPreviewRequest;
import io.b2mash.projecthealth.health.dto.ProjectHealthAnalysis;
import io.b2mash.projecthealth.health.dto.ProjectHealthDetail;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for project health, its analysis and unsaved previews. */
@RestController
public class ProjectHealthController {

  private final ProjectHealthService projectHealthService;
  private final ProjectHealthAnalyzer projectHealthAnalyzer;
  private final HealthPreviewService healthPreviewService;

  public ProjectHealthController(
      ProjectHealthService projectHealthService,
      ProjectHealthAnalyzer projectHealthAnalyzer,
      HealthPreviewService healthPreviewService) {
    this.projectHealthService = projectHealthService;
    this.projectHealthAnalyzer = projectHealthAnalyzer;
    this.healthPreviewService = healthPreviewService;
  }

  /**
   * Returns the health of a project as of today. Results are cached for up to one minute per
   * project and day; {@code POST .../health/recalculate} always returns freshly computed figures.
   */
  @GetMapping("/api/projects/{projectId}/health")
  public ResponseEntity<ProjectHealthDetail> getProjectHealth(@PathVariable UUID projectId) {
    return ResponseEntity.ok(projectHealthService.getProjectHealth(projectId));
  }

  @GetMapping("/api/projects/{projectId}/health/analysis")
  public ResponseEntity<ProjectHealthAnalysis> analyze(@PathVariable UUID projectId) {
    return ResponseEntity.ok(projectHealthAnalyzer.analyze(projectId));
  }

  /** Recomputes and stores the project's health and duration columns. */
  @PostMapping("/api/projects/{projectId}/health/recalculate")
  public ResponseEntity<ProjectHealthDetail> recalculate(@PathVariable UUID projectId) {
    return ResponseEntity.ok(projectHealthService.recalculate(projectId));
  }

  @PostMapping("/api/health/preview")
  public ResponseEntity<HealthEvaluation> preview(
      @Valid @RequestBody HealthPreviewRequest request) {
    return ResponseEntity.ok(healthPreviewService.preview(request));
  }
}

package io.b2mash.projecthealth.project;

import io.b2mash.projecthealth.health.dto.ProjectHealthDetail;
import io.b2mash.projecthealth.project.dto.ManualDatesRequest;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for switching project dates between automatic and manual mode. */
@RestController
public class ProjectDateController {

  private final ProjectDateService projectDateService;

  public ProjectDateController(ProjectDateService projectDateService) {
    this.projectDateService = projectDateService;
  }

  @PostMapping("/api/projects/{projectId}/dates/override")
  public ResponseEntity<ProjectHealthDetail> enableOverride(@PathVariable UUID projectId) {
    return ResponseEntity.ok(projectDateService.enableOverride(projectId));
  }

  @PutMapping("/api/projects/{projectId}/dates")
  public ResponseEntity<ProjectHealthDetail> updateManualDates(
      @PathVariable UUID projectId, @Valid @RequestBody ManualDatesRequest request) {
    return ResponseEntity.ok(
        projectDateService.updateManualDates(projectId, request.startDate(), request.endDate()));
  }

  @DeleteMapping("/api/projects/{projectId}/dates/override")
  public ResponseEntity<ProjectHealthDetail> disableOverride(@PathVariable UUID projectId) {
    return ResponseEntity.ok(projectDateService.disableOverride(projectId));
  }
}

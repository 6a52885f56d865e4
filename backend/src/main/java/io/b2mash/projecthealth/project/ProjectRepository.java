package io.b2mash.projecthealth.project;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  List<Project> findByStatusNot(ProjectStatus status);

  /** Projects with at least one duration column not yet populated. */
  @Query(
      """
      SELECT p FROM Project p
      WHERE p.totalDays IS NULL
         OR p.workingDays IS NULL
         OR p.durationStartDate IS NULL
         OR p.durationEndDate IS NULL
         OR p.totalDaysRemaining IS NULL
         OR p.workingDaysRemaining IS NULL
      ORDER BY p.createdAt
      """)
  List<Project> findWithMissingDuration();
}

package io.b2mash.projecthealth.milestone;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Milestone row owned by the editing layer. The health service only reads these; {@link
 * #toInput()} converts a row into the calculator view.
 */
@Entity
@Table(name = "milestones")
public class Milestone {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "title", nullable = false, length = 255)
  private String title;

  @Column(name = "date")
  private LocalDate date;

  @Column(name = "end_date")
  private LocalDate endDate;

  @Column(name = "completion")
  private Integer completion;

  @Column(name = "weight")
  private Integer weight;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", length = 20)
  private MilestoneStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Milestone() {}

  public Milestone(
      UUID projectId,
      String title,
      LocalDate date,
      LocalDate endDate,
      Integer completion,
      Integer weight,
      MilestoneStatus status) {
    this.projectId = projectId;
    this.title = title;
    this.date = date;
    this.endDate = endDate;
    this.completion = completion;
    this.weight = weight;
    this.status = status;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getTitle() {
    return title;
  }

  public LocalDate getDate() {
    return date;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public Integer getCompletion() {
    return completion;
  }

  public Integer getWeight() {
    return weight;
  }

  public MilestoneStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public MilestoneInput toInput() {
    return new MilestoneInput(title, date, endDate, completion, weight, status);
  }
}

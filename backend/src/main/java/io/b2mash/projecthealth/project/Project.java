package io.b2mash.projecthealth.project;

import io.b2mash.projecthealth.duration.DurationResult;
import io.b2mash.projecthealth.health.HealthResult;
import io.b2mash.projecthealth.health.StatusColor;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "projects")
public class Project implements DateSchedule {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "title", nullable = false, length = 255)
  private String title;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ProjectStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "health_calculation_type", nullable = false, length = 20)
  private HealthCalculationType healthCalculationType;

  @Enumerated(EnumType.STRING)
  @Column(name = "manual_status_color", length = 10)
  private StatusColor manualStatusColor;

  @Column(name = "manual_health_percentage")
  private Integer manualHealthPercentage;

  @Column(name = "start_date")
  private LocalDate startDate;

  @Column(name = "end_date")
  private LocalDate endDate;

  @Column(name = "dates_overridden", nullable = false)
  private boolean datesOverridden;

  @Column(name = "duration_start_date")
  private LocalDate durationStartDate;

  @Column(name = "duration_end_date")
  private LocalDate durationEndDate;

  @Column(name = "total_days")
  private Integer totalDays;

  @Column(name = "working_days")
  private Integer workingDays;

  @Column(name = "total_days_remaining")
  private Integer totalDaysRemaining;

  @Column(name = "working_days_remaining")
  private Integer workingDaysRemaining;

  @Enumerated(EnumType.STRING)
  @Column(name = "computed_status_color", length = 10)
  private StatusColor computedStatusColor;

  @Column(name = "computed_health_percentage")
  private Integer computedHealthPercentage;

  @Column(name = "health_reasoning", columnDefinition = "TEXT")
  private String healthReasoning;

  @Column(name = "health_computed_at")
  private Instant healthComputedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected Project() {}

  public Project(String title, ProjectStatus status) {
    this.title = title;
    this.status = status;
    this.healthCalculationType = HealthCalculationType.AUTOMATIC;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public ProjectStatus getStatus() {
    return status;
  }

  public HealthCalculationType getHealthCalculationType() {
    return healthCalculationType;
  }

  public StatusColor getManualStatusColor() {
    return manualStatusColor;
  }

  public Integer getManualHealthPercentage() {
    return manualHealthPercentage;
  }

  @Override
  public LocalDate getStartDate() {
    return startDate;
  }

  @Override
  public LocalDate getEndDate() {
    return endDate;
  }

  @Override
  public boolean isDatesOverridden() {
    return datesOverridden;
  }

  @Override
  public void setDates(LocalDate startDate, LocalDate endDate) {
    this.startDate = startDate;
    this.endDate = endDate;
    this.updatedAt = Instant.now();
  }

  @Override
  public void setDatesOverridden(boolean datesOverridden) {
    this.datesOverridden = datesOverridden;
    this.updatedAt = Instant.now();
  }

  public LocalDate getDurationStartDate() {
    return durationStartDate;
  }

  public LocalDate getDurationEndDate() {
    return durationEndDate;
  }

  public Integer getTotalDays() {
    return totalDays;
  }

  public Integer getWorkingDays() {
    return workingDays;
  }

  public Integer getTotalDaysRemaining() {
    return totalDaysRemaining;
  }

  public Integer getWorkingDaysRemaining() {
    return workingDaysRemaining;
  }

  public StatusColor getComputedStatusColor() {
    return computedStatusColor;
  }

  public Integer getComputedHealthPercentage() {
    return computedHealthPercentage;
  }

  public String getHealthReasoning() {
    return healthReasoning;
  }

  public Instant getHealthComputedAt() {
    return healthComputedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /** Stores the duration profile the last health calculation was based on. */
  public void applyDuration(DurationResult duration) {
    this.durationStartDate = duration.startDate();
    this.durationEndDate = duration.endDate();
    this.totalDays = duration.totalDays();
    this.workingDays = duration.workingDays();
    this.totalDaysRemaining = duration.totalDaysRemaining();
    this.workingDaysRemaining = duration.workingDaysRemaining();
  }

  public void applyHealth(HealthResult health, Instant computedAt) {
    this.computedStatusColor = health.color();
    this.computedHealthPercentage = health.percentage();
    this.healthReasoning = health.reasoning();
    this.healthComputedAt = computedAt;
  }

  public ProjectHealthInput toHealthInput() {
    return new ProjectHealthInput(
        status,
        healthCalculationType,
        manualStatusColor,
        manualHealthPercentage,
        startDate,
        endDate,
        datesOverridden);
  }
}

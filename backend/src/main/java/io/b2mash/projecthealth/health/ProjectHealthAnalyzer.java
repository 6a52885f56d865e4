package io.b2mash.projecthealth.health;

import io.b2mash.projecthealth.config.AnalysisProperties;
import io.b2mash.projecthealth.health.dto.HealthIssue;
import io.b2mash.projecthealth.health.dto.HealthMetrics;
import io.b2mash.projecthealth.health.dto.IssueSeverity;
import io.b2mash.projecthealth.health.dto.MilestoneDetail;
import io.b2mash.projecthealth.health.dto.ProjectHealthAnalysis;
import io.b2mash.projecthealth.health.dto.ProjectHealthDetail;
import io.b2mash.projecthealth.milestone.MilestoneInput;
import io.b2mash.projecthealth.project.Project;
import io.b2mash.projecthealth.project.ProjectRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Explains a project's health result and points at the inputs most likely to be distorting it:
 * stale milestones, sparse plans, completion figures that do not match the calendar.
 */
@Service
public class ProjectHealthAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(ProjectHealthAnalyzer.class);

  static final int HIGHLY_COMPLETE = 80;
  private static final int MOSTLY_UNSTARTED = 5;
  private static final int PLENTY_OF_TIME = 70;

  private final ProjectHealthService projectHealthService;
  private final ProjectRepository projectRepository;
  private final AnalysisProperties properties;
  private final Clock clock;

  public ProjectHealthAnalyzer(
      ProjectHealthService projectHealthService,
      ProjectRepository projectRepository,
      AnalysisProperties properties,
      Clock clock) {
    this.projectHealthService = projectHealthService;
    this.projectRepository = projectRepository;
    this.properties = properties;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public ProjectHealthAnalysis analyze(UUID projectId) {
    return analyze(projectHealthService.requireProject(projectId), LocalDate.now(clock));
  }

  /** Runs the analysis over every project and reports the problems found. */
  @Transactional(readOnly = true)
  public List<HealthIssue> findIssues() {
    LocalDate today = LocalDate.now(clock);
    List<Project> projects = projectRepository.findAll();
    List<HealthIssue> issues = new ArrayList<>();
    for (Project project : projects) {
      issues.addAll(issuesFor(project, analyze(project, today)));
    }
    log.info("Health analysis found {} issues across {} projects", issues.size(), projects.size());
    return issues;
  }

  ProjectHealthAnalysis analyze(Project project, LocalDate today) {
    List<MilestoneInput> milestones = projectHealthService.loadMilestones(project.getId());
    var evaluation = HealthEvaluation.evaluate(project.toHealthInput(), milestones, today);
    var detail =
        ProjectHealthDetail.of(
            project.getId(), project.getTitle(), project.getStatus(), evaluation);

    var duration = evaluation.duration();
    boolean startsInFuture = duration.startDate() != null && duration.startDate().isAfter(today);
    var metrics =
        new HealthMetrics(
            evaluation.weightedCompletion(),
            evaluation.timeRemaining().percentage(),
            startsInFuture,
            duration.isOverdue(),
            milestones.size());
    var milestoneDetails = milestones.stream().map(m -> MilestoneDetail.of(m, today)).toList();

    return new ProjectHealthAnalysis(
        detail, metrics, recommend(detail, metrics, milestoneDetails), milestoneDetails);
  }

  List<String> recommend(
      ProjectHealthDetail detail, HealthMetrics metrics, List<MilestoneDetail> milestones) {
    List<String> recommendations = new ArrayList<>();
    Integer timeRemaining = metrics.timeRemainingPercentage();
    int completion = metrics.weightedCompletion();

    if (detail.health().color() != StatusColor.GREEN) {
      if (metrics.startsInFuture()) {
        recommendations.add(
            "Project starts in the future: check that milestone dates and completion"
                + " percentages are realistic");
      } else if (metrics.overdue()) {
        recommendations.add(
            "Project is overdue: update milestone dates or mark completed milestones");
      } else if (timeRemaining != null && timeRemaining > 50 && completion < 20) {
        recommendations.add(
            "Low completion with substantial time remaining: consider breaking milestones"
                + " into smaller steps");
      } else if (timeRemaining != null && timeRemaining < 30 && completion < 60) {
        recommendations.add(
            "Limited time remaining with low completion: the project may need more resources"
                + " or a smaller scope");
      }
    }

    if (milestones.isEmpty()) {
      recommendations.add(
          "No milestones defined: add milestones to get an accurate health calculation");
    } else if (milestones.size() < properties.sparseMilestoneCount()) {
      recommendations.add("Consider adding more milestones for better project tracking");
    }

    long pastIncomplete = milestones.stream().filter(MilestoneDetail::isPastAndIncomplete).count();
    if (pastIncomplete > 0) {
      recommendations.add(pastIncomplete + " milestone(s) overdue but not marked complete");
    }

    long farFutureComplete =
        milestones.stream()
            .filter(m -> m.daysFromToday() != null)
            .filter(m -> m.daysFromToday() > properties.farFutureDays())
            .filter(m -> m.completion() > HIGHLY_COMPLETE)
            .count();
    if (farFutureComplete > 0) {
      recommendations.add(
          farFutureComplete + " milestone(s) far in the future but marked highly complete");
    }
    return recommendations;
  }

  List<HealthIssue> issuesFor(Project project, ProjectHealthAnalysis analysis) {
    List<HealthIssue> issues = new ArrayList<>();
    var metrics = analysis.metrics();

    if (metrics.startsInFuture() && analysis.health().health().color() != StatusColor.GREEN) {
      issues.add(
          issue(
              project,
              "Future project with poor health status",
              IssueSeverity.MEDIUM,
              "Review milestone completion percentages for future projects"));
    }
    if (metrics.milestoneCount() == 0) {
      issues.add(
          issue(
              project,
              "No milestones defined",
              IssueSeverity.LOW,
              "Add milestones to enable proper health tracking"));
    }
    long pastIncomplete =
        analysis.milestoneDetails().stream().filter(MilestoneDetail::isPastAndIncomplete).count();
    if (pastIncomplete > 0) {
      issues.add(
          issue(
              project,
              pastIncomplete + " overdue milestone(s) not marked complete",
              IssueSeverity.HIGH,
              "Update completion status for overdue milestones"));
    }
    Integer timeRemaining = metrics.timeRemainingPercentage();
    if (timeRemaining != null
        && timeRemaining > PLENTY_OF_TIME
        && metrics.weightedCompletion() < MOSTLY_UNSTARTED) {
      issues.add(
          issue(
              project,
              "Very low completion with substantial time remaining",
              IssueSeverity.LOW,
              "Consider if project timeline or milestone breakdown is realistic"));
    }
    return issues;
  }

  private static HealthIssue issue(
      Project project, String issue, IssueSeverity severity, String recommendation) {
    return new HealthIssue(project.getId(), project.getTitle(), issue, severity, recommendation);
  }
}

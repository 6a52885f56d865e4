package io.b2mash.projecthealth.health;

import io.b2mash.projecthealth.calendar.LenientDates;
import io.b2mash.projecthealth.health.dto.HealthPreviewRequest;
import io.b2mash.projecthealth.health.dto.MilestonePreview;
import io.b2mash.projecthealth.milestone.MilestoneInput;
import io.b2mash.projecthealth.project.ProjectHealthInput;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Evaluates unsaved project and milestone data. Nothing is read from or written to storage. */
@Service
public class HealthPreviewService {

  private static final Logger log = LoggerFactory.getLogger(HealthPreviewService.class);

  private final Clock clock;

  public HealthPreviewService(Clock clock) {
    this.clock = clock;
  }

  public HealthEvaluation preview(HealthPreviewRequest request) {
    LocalDate today = request.asOf() != null ? request.asOf() : LocalDate.now(clock);
    var project =
        new ProjectHealthInput(
            request.status(),
            request.healthCalculationType(),
            request.manualStatusColor(),
            request.manualHealthPercentage(),
            parseDate(request.startDate()),
            parseDate(request.endDate()),
            request.datesOverridden());

    List<MilestoneInput> milestones =
        request.milestones() == null
            ? List.of()
            : request.milestones().stream()
                .filter(Objects::nonNull)
                .map(HealthPreviewService::toInput)
                .toList();

    return HealthEvaluation.evaluate(project, milestones, today);
  }

  private static MilestoneInput toInput(MilestonePreview milestone) {
    return new MilestoneInput(
        milestone.title(),
        parseDate(milestone.date()),
        parseDate(milestone.endDate()),
        milestone.completion(),
        milestone.weight(),
        milestone.status());
  }

  private static LocalDate parseDate(String text) {
    var parsed = LenientDates.parse(text);
    if (parsed.isEmpty() && text != null && !text.isBlank()) {
      log.debug("Ignoring unparseable date '{}'", text);
    }
    return parsed.orElse(null);
  }
}

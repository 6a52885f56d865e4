package io.b2mash.projecthealth.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled job that recalculates the health of every project once a day, so that stored colors
 * and remaining-day counts move with the calendar even when nobody edits the project.
 */
@Component
@ConditionalOnProperty(
    prefix = "projecthealth.recalculation",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class HealthRecalculationJob {

  private static final Logger log = LoggerFactory.getLogger(HealthRecalculationJob.class);

  private final ProjectHealthService projectHealthService;

  public HealthRecalculationJob(ProjectHealthService projectHealthService) {
    this.projectHealthService = projectHealthService;
  }

  @Scheduled(
      cron = "${projecthealth.recalculation.cron:0 15 0 * * *}",
      zone = "${projecthealth.clock.zone:UTC}")
  public void recalculateAll() {
    log.info("Health recalculation job started");
    var summary = projectHealthService.recalculateAll();
    if (summary.success()) {
      log.info(
          "Health recalculation job completed: {}/{} projects updated",
          summary.updatedCount(),
          summary.totalCount());
    } else {
      log.warn(
          "Health recalculation job completed with {} failures out of {} projects",
          summary.errors().size(),
          summary.totalCount());
    }
  }
}

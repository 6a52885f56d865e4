package io.b2mash.projecthealth.health.dto;

import java.util.List;

/**
 * Outcome of a batch recalculation.
 *
 * @param success true when every project was recalculated
 * @param updatedCount projects recalculated and saved
 * @param totalCount projects attempted
 * @param errors one message per failed project
 */
public record RecalculationSummary(
    boolean success, int updatedCount, int totalCount, List<String> errors) {

  public static RecalculationSummary of(int updatedCount, int totalCount, List<String> errors) {
    return new RecalculationSummary(
        errors.isEmpty(), updatedCount, totalCount, List.copyOf(errors));
  }
}

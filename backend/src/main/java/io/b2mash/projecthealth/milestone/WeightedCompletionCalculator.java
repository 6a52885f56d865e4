package io.b2mash.projecthealth.milestone;

import java.util.List;

/**
 * Reduces a milestone list to a single completion percentage, weighting each milestone by its
 * importance (1-5, default 3).
 */
public final class WeightedCompletionCalculator {

  private WeightedCompletionCalculator() {}

  /**
   * Returns {@code round(sum(completion * weight) / sum(weight))}, or 0 for an empty list. The
   * result is always within [0, 100].
   */
  public static int weightedCompletion(List<MilestoneInput> milestones) {
    if (milestones == null || milestones.isEmpty()) {
      return 0;
    }

    long weightedSum = 0;
    long totalWeight = 0;
    for (MilestoneInput milestone : milestones) {
      if (milestone == null) {
        continue;
      }
      int weight = milestone.effectiveWeight();
      weightedSum += (long) milestone.effectiveCompletion() * weight;
      totalWeight += weight;
    }

    if (totalWeight == 0) {
      return 0;
    }
    return (int) Math.round((double) weightedSum / totalWeight);
  }
}

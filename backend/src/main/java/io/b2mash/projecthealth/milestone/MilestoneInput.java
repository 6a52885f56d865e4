package io.b2mash.projecthealth.milestone;

import java.time.LocalDate;

/**
 * Read-only view of a milestone as consumed by the health and duration calculators. Values are
 * kept as supplied; {@link #effectiveCompletion()} and {@link #effectiveWeight()} apply the
 * defaults and clamping rules so a malformed row never blocks a calculation.
 *
 * @param title display title, may be null
 * @param date milestone date; null when missing or unparseable
 * @param endDate optional end of the milestone window
 * @param completion completion percentage, null when missing
 * @param weight importance weight 1..5, null when missing
 * @param status milestone status, may be null
 */
public record MilestoneInput(
    String title,
    LocalDate date,
    LocalDate endDate,
    Integer completion,
    Integer weight,
    MilestoneStatus status) {

  public static final int DEFAULT_WEIGHT = 3;
  static final int MIN_WEIGHT = 1;
  static final int MAX_WEIGHT = 5;

  /** Completion clamped to [0, 100]; missing completion counts as 0. */
  public int effectiveCompletion() {
    if (completion == null) {
      return 0;
    }
    return Math.max(0, Math.min(100, completion));
  }

  /** Weight in [1, 5]; missing or out-of-range weights fall back to {@value #DEFAULT_WEIGHT}. */
  public int effectiveWeight() {
    if (weight == null || weight < MIN_WEIGHT || weight > MAX_WEIGHT) {
      return DEFAULT_WEIGHT;
    }
    return weight;
  }

  /** The last day this milestone covers: its end date when present, otherwise its date. */
  public LocalDate effectiveEndDate() {
    return endDate != null ? endDate : date;
  }

  public boolean hasDate() {
    return date != null;
  }
}

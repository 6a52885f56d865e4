package io.b2mash.projecthealth.health;

/** Which family of rules produced a health result. */
public enum HealthBasis {
  /** Color and percentage were set by hand. */
  MANUAL,
  /** Lifecycle status alone decided the color (completed, cancelled, draft, on hold). */
  STATUS_BASED,
  /** Completion was weighed against the share of time remaining. */
  TIME_AWARE,
  /** Completion alone decided the color because no schedule data exists. */
  MILESTONE_ONLY,
  /** Active project without milestones. */
  NO_MILESTONES
}

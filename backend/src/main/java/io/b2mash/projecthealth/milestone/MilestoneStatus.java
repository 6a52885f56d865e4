package io.b2mash.projecthealth.milestone;

/** Status a project lead assigns to an individual milestone. */
public enum MilestoneStatus {
  ON_TRACK,
  AT_RISK,
  HIGH_RISK,
  COMPLETED
}

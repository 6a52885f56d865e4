package io.b2mash.projecthealth.project;

/** Whether a project's health is derived from its milestones or set by hand. */
public enum HealthCalculationType {
  AUTOMATIC,
  MANUAL
}

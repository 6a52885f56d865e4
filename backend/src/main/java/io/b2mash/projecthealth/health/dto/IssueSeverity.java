package io.b2mash.projecthealth.health.dto;

public enum IssueSeverity {
  LOW,
  MEDIUM,
  HIGH
}

package io.b2mash.projecthealth.health.dto;

import java.util.UUID;

/** A data-quality or scheduling problem found while analyzing a project's health inputs. */
public record HealthIssue(
    UUID projectId,
    String projectTitle,
    String issue,
    IssueSeverity severity,
    String recommendation) {}

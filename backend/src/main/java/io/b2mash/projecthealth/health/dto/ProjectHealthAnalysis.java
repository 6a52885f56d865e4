package io.b2mash.projecthealth.health.dto;

import java.util.List;

/** Health detail of a project together with the figures and advice derived from it. */
public record ProjectHealthAnalysis(
    ProjectHealthDetail health,
    HealthMetrics metrics,
    List<String> recommendations,
    List<MilestoneDetail> milestoneDetails) {}

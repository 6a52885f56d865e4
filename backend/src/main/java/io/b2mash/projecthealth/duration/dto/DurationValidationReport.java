package io.b2mash.projecthealth.duration.dto;

import java.util.List;

public record DurationValidationReport(
    int validProjects, int invalidProjects, List<DurationInconsistency> inconsistencies) {}

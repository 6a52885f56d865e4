package io.b2mash.projecthealth.duration.dto;

import java.util.UUID;

public record DurationInconsistency(UUID projectId, String issue) {}

package io.b2mash.projecthealth.duration.dto;

import java.util.UUID;

public record ProjectRef(UUID id, String title) {}

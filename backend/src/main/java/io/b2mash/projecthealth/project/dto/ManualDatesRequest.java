package io.b2mash.projecthealth.project.dto;

import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

public record ManualDatesRequest(@NotNull LocalDate startDate, @NotNull LocalDate endDate) {}

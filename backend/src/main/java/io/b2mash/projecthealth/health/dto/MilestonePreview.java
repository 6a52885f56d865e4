package io.b2mash.projecthealth.health.dto;

import io.b2mash.projecthealth.milestone.MilestoneStatus;

/** Milestone as typed into a form; dates are raw text and may be blank or malformed. */
public record MilestonePreview(
    String title,
    String date,
    String endDate,
    Integer completion,
    Integer weight,
    MilestoneStatus status) {}

package io.b2mash.projecthealth.health.dto;

/**
 * Summary figures behind an analysis.
 *
 * @param weightedCompletion weighted milestone completion
 * @param timeRemainingPercentage share of the window left, null without schedule data
 * @param startsInFuture whether the effective start date lies after today
 * @param overdue whether the effective end date lies before today
 * @param milestoneCount number of milestones on the project
 */
public record HealthMetrics(
    int weightedCompletion,
    Integer timeRemainingPercentage,
    boolean startsInFuture,
    boolean overdue,
    int milestoneCount) {}

package io.b2mash.projecthealth.duration.dto;

/**
 * Aggregate duration figures over all non-cancelled projects.
 *
 * @param totalProjects non-cancelled projects
 * @param projectsWithDuration projects with both total and working days stored
 * @param projectsWithoutDuration the remainder
 * @param averageTotalDays rounded mean of total days, 0 when no project has duration data
 * @param averageWorkingDays rounded mean of working days, 0 when no project has duration data
 */
public record DurationStats(
    int totalProjects,
    int projectsWithDuration,
    int projectsWithoutDuration,
    long averageTotalDays,
    long averageWorkingDays) {}

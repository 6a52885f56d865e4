package io.b2mash.projecthealth.health;

import io.b2mash.projecthealth.duration.TimeRemaining;

/**
 * Result of the project health calculation.
 *
 * @param color the overall health color
 * @param percentage health percentage in [0, 100]
 * @param reasoning human-readable explanation naming the rule that fired and its inputs
 * @param basis the family of rules that produced the result
 * @param timeRemaining time-remaining snapshot used by time-aware rules, null otherwise
 */
public record HealthResult(
    StatusColor color,
    int percentage,
    String reasoning,
    HealthBasis basis,
    TimeRemaining timeRemaining) {}

package io.b2mash.projecthealth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Heuristics used by the health analyzer when producing recommendations.
 *
 * @param farFutureDays milestones further out than this and marked highly complete are flagged
 * @param sparseMilestoneCount projects with fewer milestones get a "add more milestones" hint
 */
@ConfigurationProperties(prefix = "projecthealth.analysis")
public record AnalysisProperties(
    @DefaultValue("30") int farFutureDays, @DefaultValue("3") int sparseMilestoneCount) {}

package io.b2mash.projecthealth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Clock configuration. Health and duration figures are computed against "today" in this zone.
 *
 * @param zone IANA zone id, e.g. {@code UTC} or {@code Europe/Copenhagen}
 */
@ConfigurationProperties(prefix = "projecthealth.clock")
public record ClockProperties(@DefaultValue("UTC") String zone) {}

package io.b2mash.projecthealth.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

  @Bean
  Clock clock(ClockProperties properties) {
    return Clock.system(ZoneId.of(properties.zone()));
  }
}

package io.github.riemr.availability.config;

import io.github.riemr.availability.domain.timeline.DefaultTimelineEngine;
import io.github.riemr.availability.domain.timeline.TimelineEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(AvailabilityProperties.class)
@Slf4j
public class TimelineEngineConfig {

    @Bean
    public Clock clock(AvailabilityProperties properties) {
        if (properties.zoneId().isBlank()) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(properties.zoneId()));
    }

    @Bean
    public TimelineEngine timelineEngine(Clock clock, AvailabilityProperties properties) {
        log.info("Timeline engine zone={}, showAppointments={}", clock.getZone(), properties.showAppointments());
        return new DefaultTimelineEngine(clock, properties.showAppointments());
    }
}

package org.gc.socialpublisher.config;

import lombok.extern.slf4j.Slf4j;
import org.gc.socialpublisher.properties.SchedulerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Slf4j
@Configuration
public class SchedulerConfig {

    /**
     * Day boundaries and HH:MM slots are evaluated in the configured scheduler timezone.
     */
    @Bean
    public Clock schedulerClock(SchedulerProperties properties) {
        ZoneId zone = ZoneId.of(properties.getTimezone());
        log.info("Scheduler timezone: {}", zone);
        return Clock.system(zone);
    }
}

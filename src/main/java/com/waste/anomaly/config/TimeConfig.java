package com.waste.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class TimeConfig {

    /**
     * System clock pinned to the configured civil zone. Every service takes this clock
     * instead of reading the default zone, so tests can pass a fixed instant.
     */
    @Bean
    public Clock clock(DetectionConfig detectionConfig) {
        return Clock.system(ZoneId.of(detectionConfig.getTimeZone()));
    }
}

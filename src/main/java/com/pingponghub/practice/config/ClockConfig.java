package com.pingponghub.practice.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Clock in the zone practices are scheduled in. Session dates and times are local to it.
 */
@Configuration
public class ClockConfig {

    private static final Logger logger = LoggerFactory.getLogger(ClockConfig.class);

    @Value("${practice.zone:Asia/Tokyo}")
    private String zone;

    @Bean
    public Clock clock() {
        ZoneId zoneId = ZoneId.of(zone);
        logger.info("Scheduling practices in zone {}", zoneId);
        return Clock.system(zoneId);
    }
}

package com.ai.leasing.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * All reminder hours, day boundaries and move-in checks use this clock's zone.
 */
@Configuration
public class TimeConfig {

    private static final Logger log = LoggerFactory.getLogger(TimeConfig.class);

    @Bean
    public Clock clock(@Value("${leasing.timezone:Asia/Jerusalem}") String timezone) {
        ZoneId zone = ZoneId.of(timezone);
        log.info("Using time zone {}", zone);
        return Clock.system(zone);
    }
}

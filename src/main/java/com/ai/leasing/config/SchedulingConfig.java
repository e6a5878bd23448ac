package com.ai.leasing.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Background jobs. Off with {@code leasing.scheduling.enabled=false}, e.g. in tests or on
 * instances that only serve requests.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "leasing.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}

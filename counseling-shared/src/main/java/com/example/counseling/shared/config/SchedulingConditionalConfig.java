package com.example.counseling.shared.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Scheduling is on unless counseling.scheduling.enabled=false (tests turn it off).
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "counseling.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConditionalConfig {
}

package com.starscape.mediavault.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the scheduled trash purge.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
}

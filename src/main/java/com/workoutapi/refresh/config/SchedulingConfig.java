package com.workoutapi.refresh.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables Spring Scheduling only when the hourly refresh is switched on.
 * One-shot runs force {@code refresh.schedule.enabled=false} through
 * {@link com.workoutapi.refresh.RunOnceModeListener} so no background refresh
 * competes with the startup batch.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "refresh.schedule.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}

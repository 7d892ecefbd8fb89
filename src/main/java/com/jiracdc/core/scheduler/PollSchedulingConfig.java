package com.jiracdc.core.scheduler;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the {@code @Scheduled} methods of {@link PollScheduler} when
 * {@code jiracdc.sync.polling-enabled=true}.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "jiracdc.sync.polling-enabled", havingValue = "true")
public class PollSchedulingConfig {
}

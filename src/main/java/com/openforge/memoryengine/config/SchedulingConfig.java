package com.openforge.memoryengine.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Activates @Scheduled methods (TTL pruning). Off when pruning is disabled so
 * tests and embedded use start no scheduler thread.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "memory.engine.prune.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}

package com.creditledger.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables scheduled tasks (the outbox relay).
 * Switched off in tests so nothing tries to reach a broker.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "lending.outbox.publisher-enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}

package com.creditledger.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core ledger beans.
 *
 * The clock is the ledger's timestamp source (appliedAt, approvedAt,
 * disbursedAt, lastUpdated). Tests replace it with a fixed clock.
 */
@Configuration
@EnableConfigurationProperties(LendingProperties.class)
public class LedgerConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }
}

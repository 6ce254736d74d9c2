package com.creditledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ledger settings bound from the {@code lending.*} block of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "lending")
public class LendingProperties {

    /**
     * Version of the scoring heuristic, reported by stats and assessments.
     * Only used to initialise the stats row; later changes need a migration.
     */
    private int modelVersion = 1;

    private Cache cache = new Cache();

    private Outbox outbox = new Outbox();

    @Data
    public static class Cache {
        /** Use Redis for the profiles/applications/loans cache regions. */
        private boolean redisEnabled = true;
    }

    @Data
    public static class Outbox {
        /** Run the scheduled Kafka relay. */
        private boolean publisherEnabled = true;

        /** Max events relayed per poll. */
        private int batchSize = 100;

        /** Failed attempts before an event is reported as needing manual intervention. */
        private int maxRetryCount = 10;
    }
}

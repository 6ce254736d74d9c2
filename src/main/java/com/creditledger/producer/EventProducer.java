package com.creditledger.producer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Sends lifecycle events to Kafka.
 *
 * Only the outbox publisher calls this. Business code writes to the outbox and
 * never talks to Kafka directly.
 *
 * The returned future completes when the broker acknowledges. Callers that need
 * the acknowledgement before marking an outbox row published must wait on it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    /**
     * @param topic target topic
     * @param key   message key (loan id), keeps one loan's events on one partition
     * @param event immutable event record
     */
    public CompletableFuture<SendResult<String, Object>> publish(String topic, String key, Object event) {
        log.debug("Publishing {} to {} with key {}", event.getClass().getSimpleName(), topic, key);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish {} with key {}", event.getClass().getSimpleName(), key, ex);
            } else {
                log.info("Published {} with key {} to partition {}",
                        event.getClass().getSimpleName(), key, result.getRecordMetadata().partition());
            }
        });

        return future;
    }
}

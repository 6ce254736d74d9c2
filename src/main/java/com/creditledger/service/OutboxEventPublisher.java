package com.creditledger.service;

import com.creditledger.config.LendingProperties;
import com.creditledger.event.LoanApplicationSubmitted;
import com.creditledger.event.LoanDisbursed;
import com.creditledger.event.LoanPaymentRecorded;
import com.creditledger.model.OutboxEvent;
import com.creditledger.producer.EventProducer;
import com.creditledger.repository.OutboxEventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * OUTBOX EVENT PUBLISHER
 * ======================
 *
 * Relays lifecycle events from the outbox table to Kafka.
 *
 * HOW IT WORKS:
 * -------------
 * 1. Every 100ms, load the oldest unpublished events (batch-size limited)
 * 2. For each: deserialize, send, WAIT for the broker ack, mark published
 * 3. A failure bumps retryCount and records the error; the next poll retries
 *
 * A loan's events are relayed in the order they were written, and a failure
 * stops the batch so a later event of the same loan cannot overtake it.
 *
 * Scheduling is switched on by SchedulingConfig; with it off, publishBatch()
 * can still be invoked directly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxEventPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 10;
    private static final long STUCK_AFTER_SECONDS = 300;
    private static final long HIGH_QUEUE_SIZE = 1000;

    private final OutboxEventRepository outboxEventRepository;
    private final EventProducer eventProducer;
    private final ObjectMapper objectMapper;
    private final LendingProperties lendingProperties;
    private final Clock clock;

    @Scheduled(fixedDelay = 100)
    @Transactional
    public void publishEvents() {
        try {
            publishBatch();
        } catch (RuntimeException e) {
            log.error("Error in outbox event publisher", e);
        }
    }

    /**
     * Relay one batch.
     *
     * @return number of events published
     */
    @Transactional
    public int publishBatch() {
        List<OutboxEvent> events = outboxEventRepository.findUnpublished(
                PageRequest.of(0, lendingProperties.getOutbox().getBatchSize()));
        if (events.isEmpty()) {
            return 0;
        }

        log.debug("Publishing {} outbox events", events.size());
        int published = 0;
        for (OutboxEvent event : events) {
            try {
                publishEvent(event);
                published++;
            } catch (Exception e) {
                handlePublishError(event, e);
                break;
            }
        }
        log.debug("Finished outbox batch: {}/{} published", published, events.size());
        return published;
    }

    private void publishEvent(OutboxEvent outboxEvent)
            throws IOException, ExecutionException, InterruptedException, TimeoutException {
        Object event = deserializeEvent(outboxEvent);

        try {
            eventProducer.publish(outboxEvent.getTopic(), outboxEvent.getEventId(), event)
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }

        outboxEvent.setPublished(true);
        outboxEvent.setPublishedAt(Instant.now(clock));
        outboxEventRepository.save(outboxEvent);

        log.info("Successfully published event: {} (type: {})",
                outboxEvent.getEventId(), outboxEvent.getEventType());
    }

    private Object deserializeEvent(OutboxEvent outboxEvent) throws IOException {
        return switch (outboxEvent.getEventType()) {
            case "LoanApplicationSubmitted" ->
                objectMapper.readValue(outboxEvent.getPayload(), LoanApplicationSubmitted.class);
            case "LoanDisbursed" ->
                objectMapper.readValue(outboxEvent.getPayload(), LoanDisbursed.class);
            case "LoanPaymentRecorded" ->
                objectMapper.readValue(outboxEvent.getPayload(), LoanPaymentRecorded.class);
            default ->
                throw new IllegalArgumentException("Unknown event type: " + outboxEvent.getEventType());
        };
    }

    private void handlePublishError(OutboxEvent event, Exception e) {
        event.setRetryCount(event.getRetryCount() + 1);
        event.setLastError(e.getMessage());
        outboxEventRepository.save(event);

        if (event.getRetryCount() >= lendingProperties.getOutbox().getMaxRetryCount()) {
            log.error("Event {} has failed {} times. Manual intervention may be required. Error: {}",
                      event.getEventId(), event.getRetryCount(), e.getMessage());
        } else {
            log.warn("Failed to publish event {} (attempt {}): {}",
                     event.getEventId(), event.getRetryCount(), e.getMessage());
        }
    }

    /**
     * Report events stuck in the outbox for more than five minutes.
     */
    @Scheduled(fixedDelay = 60000)
    public void monitorStuckEvents() {
        try {
            Instant threshold = Instant.now(clock).minusSeconds(STUCK_AFTER_SECONDS);
            List<OutboxEvent> stuckEvents = outboxEventRepository.findByPublishedFalseAndCreatedAtBefore(threshold);

            if (!stuckEvents.isEmpty()) {
                log.error("Found {} stuck events older than 5 minutes. Manual intervention may be required.",
                          stuckEvents.size());
                stuckEvents.forEach(event ->
                    log.error("Stuck event: id={}, eventId={}, eventType={}, createdAt={}, retryCount={}, lastError={}",
                              event.getId(), event.getEventId(), event.getEventType(),
                              event.getCreatedAt(), event.getRetryCount(), event.getLastError())
                );
            }

            long queueSize = outboxEventRepository.countByPublishedFalse();
            if (queueSize > HIGH_QUEUE_SIZE) {
                log.warn("Outbox queue size is {}, which is high. Consider scaling up.", queueSize);
            } else {
                log.debug("Outbox queue size: {}", queueSize);
            }
        } catch (RuntimeException e) {
            log.error("Error monitoring stuck events", e);
        }
    }
}

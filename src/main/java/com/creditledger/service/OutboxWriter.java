package com.creditledger.service;

import com.creditledger.model.OutboxEvent;
import com.creditledger.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes lifecycle events to the outbox table.
 *
 * MANDATORY propagation: the event row must commit or roll back together
 * with the ledger change that produced it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxWriter {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public void write(Object event, String eventId, String topic) {
        String eventType = event.getClass().getSimpleName();
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event for outbox: {} ({})", eventId, eventType, e);
            throw new IllegalStateException("Failed to save event to outbox", e);
        }

        OutboxEvent outboxEvent = new OutboxEvent();
        outboxEvent.setEventId(eventId);
        outboxEvent.setEventType(eventType);
        outboxEvent.setPayload(payload);
        outboxEvent.setTopic(topic);
        outboxEventRepository.save(outboxEvent);

        log.debug("Saved {} event to outbox: {}", eventType, eventId);
    }
}

package com.creditledger.repository;

import com.creditledger.model.OutboxEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for managing outbox events.
 *
 * Key queries:
 * - Find unpublished events, oldest first (for the publisher)
 * - Find old unpublished events (for alerting on stuck events)
 */
@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * Unpublished events in creation order, one page at a time.
     * FIFO keeps a loan's events in the order they happened.
     */
    @Query("SELECT e FROM OutboxEvent e WHERE e.published = false ORDER BY e.createdAt ASC, e.id ASC")
    List<OutboxEvent> findUnpublished(Pageable page);

    List<OutboxEvent> findByPublishedFalseAndCreatedAtBefore(Instant before);

    List<OutboxEvent> findByEventTypeOrderByIdAsc(String eventType);

    long countByPublishedFalse();
}

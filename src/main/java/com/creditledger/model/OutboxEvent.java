package com.creditledger.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * TRANSACTIONAL OUTBOX
 * ====================
 *
 * Lifecycle events (application submitted, loan disbursed, payment recorded)
 * are written here in the SAME transaction as the ledger change that caused
 * them. OutboxEventPublisher relays them to Kafka afterwards.
 *
 * - Ledger committed  => event row committed, it WILL be published
 * - Ledger rolled back => event row rolled back, nothing is published
 *
 * Kafka being down never blocks a disbursement or a payment.
 */
@Entity
@Table(name = "outbox_events",
       indexes = {
           @Index(name = "idx_outbox_published", columnList = "published"),
           @Index(name = "idx_outbox_created_at", columnList = "createdAt")
       })
@Data
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Business key of the event, e.g. "loan-42" or "loan-42-payment-3".
     * Also used as the Kafka message key.
     */
    @Column(nullable = false)
    private String eventId;

    /**
     * Simple class name of the event record, e.g. "LoanDisbursed".
     */
    @Column(nullable = false)
    private String eventType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private String topic;

    @Column(nullable = false)
    private Boolean published = false;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant publishedAt;

    /**
     * Failed publish attempts so far. Alerting kicks in at a threshold.
     */
    @Column(nullable = false)
    private Integer retryCount = 0;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (published == null) {
            published = false;
        }
        if (retryCount == null) {
            retryCount = 0;
        }
    }
}

package com.creditledger.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entity representing a loan application.
 *
 * riskScore and interestRate are snapshots taken when the application is
 * created; later profile updates do not touch them.
 *
 * The record is kept after disbursement for audit history. The active loan
 * that follows it shares its id.
 */
@Entity
@Table(name = "loan_applications")
@Data
@NoArgsConstructor
public class LoanApplication {

    public static final int MIN_TERM_MONTHS = 6;
    public static final int MAX_TERM_MONTHS = 360;
    public static final int MAX_PURPOSE_LENGTH = 100;

    @Id
    private Long id;

    @Column(nullable = false)
    private String borrower;

    @Column(nullable = false)
    private Long amount;

    @Column(nullable = false, length = MAX_PURPOSE_LENGTH)
    private String purpose;

    @Column(nullable = false)
    private Integer termMonths;

    @Column(nullable = false)
    private Integer riskScore;

    /** Basis points. */
    @Column(nullable = false)
    private Integer interestRate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ApplicationStatus status;

    @Column(nullable = false)
    private Instant appliedAt;

    private Instant approvedAt;

    /**
     * Forward-only: PENDING -> APPROVED -> DISBURSED.
     */
    public enum ApplicationStatus {
        PENDING,     // Waiting for the owner
        APPROVED,    // Owner approved, funds not yet released
        DISBURSED    // Active loan created, application is now read-only
    }
}

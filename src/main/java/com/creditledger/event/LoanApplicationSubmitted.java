package com.creditledger.event;

import java.time.Instant;

/**
 * Event published when a loan application is accepted into PENDING.
 *
 * Records are immutable: an event describes something that already happened.
 */
public record LoanApplicationSubmitted(
    Long applicationId,     // Ledger-assigned, monotonically increasing
    String borrower,        // Who applied
    Long amount,            // Requested principal
    Integer termMonths,
    Integer riskScore,      // Credit score snapshot
    Integer interestRate,   // Basis points, from the score band
    Instant timestamp
) {
    public LoanApplicationSubmitted {
        if (applicationId == null || applicationId <= 0) {
            throw new IllegalArgumentException("Application ID must be positive");
        }
        if (borrower == null || borrower.isBlank()) {
            throw new IllegalArgumentException("Borrower cannot be null or empty");
        }
        if (amount == null || amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}

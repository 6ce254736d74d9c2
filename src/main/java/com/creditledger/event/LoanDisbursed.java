package com.creditledger.event;

import java.time.Instant;

/**
 * Event published when funds for an approved application are released.
 *
 * loanId is the application id: the application and its active loan share it.
 */
public record LoanDisbursed(
    Long loanId,
    String borrower,
    Long principalAmount,
    Integer interestRate,   // Basis points
    Long monthlyPayment,
    Integer termMonths,
    Instant timestamp
) {
    public LoanDisbursed {
        if (loanId == null || loanId <= 0) {
            throw new IllegalArgumentException("Loan ID must be positive");
        }
        if (borrower == null || borrower.isBlank()) {
            throw new IllegalArgumentException("Borrower cannot be null or empty");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}

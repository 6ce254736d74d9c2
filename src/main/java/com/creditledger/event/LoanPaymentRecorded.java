package com.creditledger.event;

import java.time.Instant;

/**
 * Event published for every accepted repayment.
 *
 * amountApplied can be lower than amountPaid: overpayment is clamped and the
 * excess is not tracked.
 */
public record LoanPaymentRecorded(
    Long loanId,
    String borrower,
    Long amountPaid,          // What the borrower sent
    Long amountApplied,       // What actually reduced the balance
    Long outstandingBalance,  // Balance after this payment
    Integer paymentsMade,     // Counter after this payment
    Instant timestamp
) {
    public LoanPaymentRecorded {
        if (loanId == null || loanId <= 0) {
            throw new IllegalArgumentException("Loan ID must be positive");
        }
        if (outstandingBalance == null || outstandingBalance < 0) {
            throw new IllegalArgumentException("Outstanding balance cannot be negative");
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public boolean repaid() {
        return outstandingBalance == 0L;
    }
}

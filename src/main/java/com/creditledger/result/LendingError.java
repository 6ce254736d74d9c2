package com.creditledger.result;

/**
 * Business rule violations a ledger operation can report.
 *
 * These are returned to the caller inside a {@link LendingResult}. They are
 * never thrown.
 */
public enum LendingError {
    NOT_FOUND,            // Unknown profile, application or loan
    ALREADY_EXISTS,       // Record with that key is already there
    INVALID_AMOUNT,       // Amount <= 0, payment on a repaid loan, or a loan too large to price
    INSUFFICIENT_SCORE,   // Credit score below the application floor
    UNAUTHORIZED,         // Wrong role, or not the loan's borrower
    INVALID_PARAMETERS    // Out-of-range field or illegal state transition
}

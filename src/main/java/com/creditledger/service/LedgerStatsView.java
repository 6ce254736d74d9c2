package com.creditledger.service;

/**
 * Read-only snapshot of the ledger counters.
 */
public record LedgerStatsView(
    long totalLoansIssued,
    long totalAmountDisbursed,
    int modelVersion
) {
}

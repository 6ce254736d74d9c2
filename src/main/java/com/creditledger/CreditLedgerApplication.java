package com.creditledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application for the Credit Ledger.
 *
 * What lives here:
 * - Borrower profiles with a coarse risk category
 * - A weighted multi-factor risk scoring engine (integer arithmetic only)
 * - The loan lifecycle: application -> approval -> disbursement -> repayment
 * - Ledger-wide counters (loans issued, amount disbursed)
 *
 * Architecture flow:
 * Caller -> REST API -> Service (one transaction, global ledger lock) -> Database (+ Outbox)
 * Outbox Publisher -> Kafka (loan lifecycle events for downstream consumers)
 *
 * Caller identity and role are resolved upstream and passed in as request headers.
 */
@SpringBootApplication
public class CreditLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditLedgerApplication.class, args);
    }
}

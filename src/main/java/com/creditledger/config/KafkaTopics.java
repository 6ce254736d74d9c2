package com.creditledger.config;

/**
 * Centralized Kafka topic names for loan lifecycle events.
 */
public class KafkaTopics {

    // New application accepted into PENDING
    public static final String LOAN_APPLICATION_SUBMITTED = "loan.application.submitted";

    // Funds released, active loan created
    public static final String LOAN_DISBURSED = "loan.disbursed";

    // Repayment applied to an active loan
    public static final String LOAN_PAYMENT_RECORDED = "loan.payment.recorded";

    private KafkaTopics() {
    }
}

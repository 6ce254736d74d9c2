package com.creditledger.service;

/**
 * Financial data a borrower submits for their own profile.
 */
public record ProfileCommand(
    int creditScore,
    long annualIncome,
    long totalDebt,
    int employmentYears,
    int previousDefaults,
    int onTimePayments,
    int totalLoans
) {
}

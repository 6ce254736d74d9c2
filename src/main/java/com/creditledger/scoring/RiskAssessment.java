package com.creditledger.scoring;

import com.creditledger.model.RiskCategory;

/**
 * Result of a comprehensive risk assessment.
 *
 * Computed on demand from the stored profile and a candidate amount. Never
 * persisted and never tied to an application's lifecycle.
 *
 * All sub-scores are on a 0-100 scale.
 */
public record RiskAssessment(
    String borrower,
    Long requestedAmount,
    String purpose,
    Integer creditScoreComponent,      // Credit score rescaled [300,850] -> [0,100]
    Integer debtToIncomeComponent,     // 0 once DTI reaches 50%
    Integer paymentHistoryComponent,   // Neutral 50 with no loan history
    Integer employmentComponent,       // Saturates at 10 years
    Integer defaultHistoryComponent,   // 100 / 50 / 0
    Integer compositeScore,            // Weighted blend, 0-100
    Integer adjustedCompositeScore,    // After the loan-to-income discount
    Integer finalRiskScore,            // Remapped into 500-850
    RiskCategory riskCategory,
    Integer recommendedInterestRate,   // Basis points
    Long maxRecommendedAmount,
    Boolean approvalRecommendation,
    Integer modelVersion
) {
    public RiskAssessment {
        if (borrower == null || borrower.isBlank()) {
            throw new IllegalArgumentException("Borrower cannot be null or empty");
        }
        if (riskCategory == null) {
            throw new IllegalArgumentException("Risk category cannot be null");
        }
    }
}

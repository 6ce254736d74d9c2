package com.creditledger.model;

/**
 * Risk categories for credit assessment, highest threshold first.
 *
 * The same mapping serves two call sites:
 * - profile writes (raw credit score)
 * - comprehensive assessments (final blended score)
 *
 * Exact threshold values resolve to the more favorable band ({@code >=}).
 */
public enum RiskCategory {
    LOW(700, 300),        // Strong credit, cheapest rate
    MEDIUM(600, 800),     // Average credit
    HIGH(500, 1500),      // Weak credit, still eligible to apply
    VERY_HIGH(0, 2000);   // Below the application floor

    private final int minScore;
    private final int interestRateBps;

    RiskCategory(int minScore, int interestRateBps) {
        this.minScore = minScore;
        this.interestRateBps = interestRateBps;
    }

    public int getMinScore() {
        return minScore;
    }

    /**
     * Annual interest rate for this category, in basis points.
     */
    public int getInterestRateBps() {
        return interestRateBps;
    }

    public static RiskCategory fromScore(int score) {
        if (score >= LOW.minScore) {
            return LOW;
        } else if (score >= MEDIUM.minScore) {
            return MEDIUM;
        } else if (score >= HIGH.minScore) {
            return HIGH;
        }
        return VERY_HIGH;
    }
}

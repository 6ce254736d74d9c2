package com.creditledger.scoring;

import com.creditledger.math.FixedPointMath;
import com.creditledger.model.BorrowerProfile;
import com.creditledger.model.RiskCategory;
import org.springframework.stereotype.Component;

/**
 * Weighted multi-factor risk scoring.
 *
 * Two tiers, both pure functions of their arguments:
 *
 * CHEAP PATH (application time):
 * ==============================
 * One integer score -> category -> interest rate, via {@link RiskCategory}.
 *
 * COMPREHENSIVE PATH (on demand):
 * ===============================
 * Factor             | Weight | Sub-score (0-100)
 * -------------------|--------|--------------------------------------------
 * Credit score       |   35   | (score - 300) * 100 / 550
 * Debt-to-income     |   25   | 0 if DTI >= 50%, else 100 - dtiBps / 50
 * Payment history    |   20   | onTime * 100 / totalLoans, 50 with no loans
 * Employment         |   10   | min(years * 10, 100)
 * Prior defaults     |   10   | 0 -> 100, 1-2 -> 50, 3+ -> 0
 *
 * composite = sum(score * weight) / 100
 * If the request exceeds 50% of annual income the composite loses 5%.
 * final     = 500 + adjusted * 350 / 100
 *
 * This is a fixed heuristic, not a trained model.
 */
@Component
public class RiskScoringEngine {

    static final int CREDIT_WEIGHT = 35;
    static final int DTI_WEIGHT = 25;
    static final int PAYMENT_HISTORY_WEIGHT = 20;
    static final int EMPLOYMENT_WEIGHT = 10;
    static final int DEFAULT_WEIGHT = 10;

    static final long DTI_CUTOFF_BPS = 5_000L;
    static final long LTI_DISCOUNT_THRESHOLD_PERCENT = 50L;
    static final int NEUTRAL_PAYMENT_HISTORY = 50;
    static final int FINAL_SCORE_FLOOR = 500;
    static final int FINAL_SCORE_SPAN = 350;
    static final int MAX_LOAN_INCOME_PERCENT = 40;

    public RiskCategory deriveRiskCategory(int riskScore) {
        return RiskCategory.fromScore(riskScore);
    }

    /**
     * Annual rate in basis points for a score.
     */
    public int deriveInterestRate(int riskScore) {
        return RiskCategory.fromScore(riskScore).getInterestRateBps();
    }

    int normalizeCreditScore(int creditScore) {
        return (int) FixedPointMath.percentOf(
                creditScore - BorrowerProfile.MIN_CREDIT_SCORE, 100,
                BorrowerProfile.MAX_CREDIT_SCORE - BorrowerProfile.MIN_CREDIT_SCORE);
    }

    /**
     * Lower debt burden scores higher. Zero income counts as 100% DTI.
     */
    int debtToIncomeScore(long totalDebt, long annualIncome) {
        long dti = FixedPointMath.ratio(totalDebt, annualIncome, FixedPointMath.BASIS_POINTS);
        if (dti >= DTI_CUTOFF_BPS) {
            return 0;
        }
        return (int) (100 - dti / 50);
    }

    /**
     * No loan history is neutral, not penalized.
     */
    int paymentHistoryScore(int onTimePayments, int totalLoans) {
        long score = FixedPointMath.ratioOrDefault(onTimePayments, totalLoans, 100, NEUTRAL_PAYMENT_HISTORY);
        return (int) Math.min(score, 100);
    }

    int employmentScore(int employmentYears) {
        return (int) Math.min((long) employmentYears * 10, 100);
    }

    int defaultHistoryScore(int previousDefaults) {
        if (previousDefaults == 0) {
            return 100;
        } else if (previousDefaults <= 2) {
            return 50;
        }
        return 0;
    }

    /**
     * Loan-to-income as a whole percentage. Zero income is the worst case (100).
     */
    long loanToIncomePercent(long requestedAmount, long annualIncome) {
        return FixedPointMath.ratio(requestedAmount, annualIncome, 100);
    }

    public RiskAssessment assessComprehensiveRisk(BorrowerProfile profile, long requestedAmount,
                                                  String purpose, int modelVersion) {
        int credit = normalizeCreditScore(profile.getCreditScore());
        int dti = debtToIncomeScore(profile.getTotalDebt(), profile.getAnnualIncome());
        int history = paymentHistoryScore(profile.getOnTimePayments(), profile.getTotalLoans());
        int employment = employmentScore(profile.getEmploymentYears());
        int defaults = defaultHistoryScore(profile.getPreviousDefaults());

        int composite = (credit * CREDIT_WEIGHT
                + dti * DTI_WEIGHT
                + history * PAYMENT_HISTORY_WEIGHT
                + employment * EMPLOYMENT_WEIGHT
                + defaults * DEFAULT_WEIGHT) / 100;

        int adjusted = composite;
        if (loanToIncomePercent(requestedAmount, profile.getAnnualIncome()) > LTI_DISCOUNT_THRESHOLD_PERCENT) {
            adjusted = (int) FixedPointMath.percentOf(composite, 950, 1000);
        }

        int finalScore = FINAL_SCORE_FLOOR + (int) FixedPointMath.percentOf(adjusted, FINAL_SCORE_SPAN, 100);
        RiskCategory category = deriveRiskCategory(finalScore);

        return new RiskAssessment(
                profile.getBorrower(),
                requestedAmount,
                purpose,
                credit,
                dti,
                history,
                employment,
                defaults,
                composite,
                adjusted,
                finalScore,
                category,
                category.getInterestRateBps(),
                FixedPointMath.percentOf(profile.getAnnualIncome(), MAX_LOAN_INCOME_PERCENT, 100),
                finalScore >= FINAL_SCORE_FLOOR,
                modelVersion
        );
    }
}

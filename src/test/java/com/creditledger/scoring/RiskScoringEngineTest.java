package com.creditledger.scoring;

import com.creditledger.model.BorrowerProfile;
import com.creditledger.model.RiskCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RiskScoringEngine.
 *
 * Reference borrower: score 720, income 100000, debt 20000, 5 years employed,
 * no defaults, 18 of 20 loans paid on time.
 */
@DisplayName("RiskScoringEngine Unit Tests")
class RiskScoringEngineTest {

    private RiskScoringEngine engine;
    private BorrowerProfile profile;

    @BeforeEach
    void setUp() {
        engine = new RiskScoringEngine();
        profile = profile(720, 100_000, 20_000, 5, 0, 18, 20);
    }

    @Nested
    @DisplayName("Sub-scores")
    class SubScores {

        @Test
        @DisplayName("Should rescale credit score into 0-100")
        void shouldRescaleCreditScore() {
            assertThat(engine.normalizeCreditScore(300)).isZero();
            assertThat(engine.normalizeCreditScore(850)).isEqualTo(100);
            assertThat(engine.normalizeCreditScore(720)).isEqualTo(76);
        }

        @Test
        @DisplayName("Should zero the DTI score at 50% and treat zero income as worst case")
        void shouldScoreDebtToIncome() {
            assertThat(engine.debtToIncomeScore(20_000, 100_000)).isEqualTo(60);
            assertThat(engine.debtToIncomeScore(0, 100_000)).isEqualTo(100);
            assertThat(engine.debtToIncomeScore(49_999, 100_000)).isEqualTo(1);
            assertThat(engine.debtToIncomeScore(50_000, 100_000)).isZero();
            assertThat(engine.debtToIncomeScore(0, 0)).isZero();
        }

        @Test
        @DisplayName("Should treat no loan history as neutral")
        void shouldScorePaymentHistory() {
            assertThat(engine.paymentHistoryScore(0, 0)).isEqualTo(50);
            assertThat(engine.paymentHistoryScore(12, 0)).isEqualTo(50);
            assertThat(engine.paymentHistoryScore(18, 20)).isEqualTo(90);
            assertThat(engine.paymentHistoryScore(0, 20)).isZero();
        }

        @Test
        @DisplayName("Should cap payment history when on-time count exceeds total loans")
        void shouldCapPaymentHistory() {
            assertThat(engine.paymentHistoryScore(30, 20)).isEqualTo(100);
        }

        @Test
        @DisplayName("Should saturate employment at ten years")
        void shouldSaturateEmployment() {
            assertThat(engine.employmentScore(0)).isZero();
            assertThat(engine.employmentScore(5)).isEqualTo(50);
            assertThat(engine.employmentScore(10)).isEqualTo(100);
            assertThat(engine.employmentScore(40)).isEqualTo(100);
        }

        @Test
        @DisplayName("Should step default score at one and three defaults")
        void shouldStepDefaults() {
            assertThat(engine.defaultHistoryScore(0)).isEqualTo(100);
            assertThat(engine.defaultHistoryScore(1)).isEqualTo(50);
            assertThat(engine.defaultHistoryScore(2)).isEqualTo(50);
            assertThat(engine.defaultHistoryScore(3)).isZero();
            assertThat(engine.defaultHistoryScore(9)).isZero();
        }
    }

    @Nested
    @DisplayName("Comprehensive assessment")
    class Comprehensive {

        @Test
        @DisplayName("Should blend reference borrower without LTI discount at exactly 50%")
        void shouldAssessReferenceBorrower() {
            RiskAssessment assessment = engine.assessComprehensiveRisk(profile, 50_000, "car", 1);

            // (76*35 + 60*25 + 90*20 + 50*10 + 100*10) / 100 = 7460 / 100
            assertThat(assessment.compositeScore()).isEqualTo(74);
            assertThat(assessment.adjustedCompositeScore()).isEqualTo(74);
            // 500 + 74 * 350 / 100
            assertThat(assessment.finalRiskScore()).isEqualTo(759);
            assertThat(assessment.riskCategory()).isEqualTo(RiskCategory.LOW);
            assertThat(assessment.recommendedInterestRate()).isEqualTo(300);
            assertThat(assessment.maxRecommendedAmount()).isEqualTo(40_000L);
            assertThat(assessment.approvalRecommendation()).isTrue();
            assertThat(assessment.modelVersion()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should discount composite by 5% above 50% loan-to-income")
        void shouldDiscountHighLoanToIncome() {
            RiskAssessment assessment = engine.assessComprehensiveRisk(profile, 60_000, "car", 1);

            assertThat(assessment.compositeScore()).isEqualTo(74);
            assertThat(assessment.adjustedCompositeScore()).isEqualTo(70);
            assertThat(assessment.finalRiskScore()).isEqualTo(745);
        }

        @Test
        @DisplayName("Should discount any request when income is zero")
        void shouldDiscountOnZeroIncome() {
            BorrowerProfile noIncome = profile(850, 0, 0, 10, 0, 10, 10);

            RiskAssessment assessment = engine.assessComprehensiveRisk(noIncome, 1, null, 1);

            // credit 100, DTI 0 (worst case), history 100, employment 100, defaults 100
            assertThat(assessment.compositeScore()).isEqualTo(75);
            assertThat(assessment.adjustedCompositeScore()).isEqualTo(71);
            assertThat(assessment.maxRecommendedAmount()).isZero();
        }

        @Test
        @DisplayName("Should keep final score within 500-850")
        void shouldStayWithinRange() {
            BorrowerProfile worst = profile(300, 0, 1_000_000, 0, 9, 0, 10);
            BorrowerProfile best = profile(850, 1_000_000, 0, 20, 0, 40, 40);

            assertThat(engine.assessComprehensiveRisk(worst, 1_000, null, 1).finalRiskScore()).isEqualTo(500);
            assertThat(engine.assessComprehensiveRisk(best, 1_000, null, 1).finalRiskScore()).isEqualTo(850);
        }

        @Test
        @DisplayName("Should return equal results for repeated calls")
        void shouldBeIdempotent() {
            RiskAssessment first = engine.assessComprehensiveRisk(profile, 55_000, "car", 1);
            RiskAssessment second = engine.assessComprehensiveRisk(profile, 55_000, "car", 1);

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("Should never lower DTI score as income grows")
        void shouldBeMonotonicInIncome() {
            int previous = -1;
            for (long income = 0; income <= 200_000; income += 5_000) {
                int score = engine.debtToIncomeScore(20_000, income);
                assertThat(score).isGreaterThanOrEqualTo(previous);
                previous = score;
            }
        }

        @Test
        @DisplayName("Should never raise default score as defaults grow")
        void shouldBeMonotonicInDefaults() {
            int previous = Integer.MAX_VALUE;
            for (int defaults = 0; defaults <= 10; defaults++) {
                int score = engine.defaultHistoryScore(defaults);
                assertThat(score).isLessThanOrEqualTo(previous);
                previous = score;
            }
        }
    }

    @Nested
    @DisplayName("Extreme profiles")
    class ExtremeProfiles {

        @Test
        @DisplayName("Should zero the DTI sub-score for debt far beyond income")
        void shouldAssessHugeDebt() {
            BorrowerProfile indebted = profile(720, 1, Long.MAX_VALUE / 2, 5, 0, 18, 20);

            RiskAssessment assessment = engine.assessComprehensiveRisk(indebted, 1_000, null, 1);

            // (76*35 + 0*25 + 90*20 + 50*10 + 100*10) / 100 = 59, LTI discount -> 56
            assertThat(assessment.debtToIncomeComponent()).isZero();
            assertThat(assessment.compositeScore()).isEqualTo(59);
            assertThat(assessment.adjustedCompositeScore()).isEqualTo(56);
            assertThat(assessment.finalRiskScore()).isEqualTo(696);
            assertThat(assessment.riskCategory()).isEqualTo(RiskCategory.MEDIUM);
            assertThat(assessment.maxRecommendedAmount()).isZero();
        }

        @Test
        @DisplayName("Should assess an income near the top of the long range")
        void shouldAssessHugeIncome() {
            BorrowerProfile wealthy = profile(720, Long.MAX_VALUE / 10, 0, 5, 0, 18, 20);

            RiskAssessment assessment = engine.assessComprehensiveRisk(wealthy, 1_000, null, 1);

            assertThat(assessment.debtToIncomeComponent()).isEqualTo(100);
            assertThat(assessment.compositeScore()).isEqualTo(84);
            assertThat(assessment.adjustedCompositeScore()).isEqualTo(84);
            assertThat(assessment.finalRiskScore()).isEqualTo(794);
            assertThat(assessment.maxRecommendedAmount()).isEqualTo(368_934_881_474_191_032L);
        }

        @Test
        @DisplayName("Should discount a requested amount at the top of the long range")
        void shouldDiscountHugeRequest() {
            RiskAssessment assessment = engine.assessComprehensiveRisk(profile, Long.MAX_VALUE, null, 1);

            assertThat(assessment.compositeScore()).isEqualTo(74);
            assertThat(assessment.adjustedCompositeScore()).isEqualTo(70);
            assertThat(assessment.finalRiskScore()).isEqualTo(745);
        }
    }

    static BorrowerProfile profile(int creditScore, long income, long debt, int years,
                                   int defaults, int onTime, int totalLoans) {
        BorrowerProfile profile = new BorrowerProfile();
        profile.setBorrower("borrower-1");
        profile.setCreditScore(creditScore);
        profile.setAnnualIncome(income);
        profile.setTotalDebt(debt);
        profile.setEmploymentYears(years);
        profile.setPreviousDefaults(defaults);
        profile.setOnTimePayments(onTime);
        profile.setTotalLoans(totalLoans);
        profile.setRiskCategory(RiskCategory.fromScore(creditScore));
        profile.setLastUpdated(Instant.EPOCH);
        return profile;
    }
}

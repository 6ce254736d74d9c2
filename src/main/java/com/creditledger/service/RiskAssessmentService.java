package com.creditledger.service;

import com.creditledger.model.BorrowerProfile;
import com.creditledger.model.LoanApplication;
import com.creditledger.repository.BorrowerProfileRepository;
import com.creditledger.result.LendingError;
import com.creditledger.result.LendingResult;
import com.creditledger.scoring.RiskAssessment;
import com.creditledger.scoring.RiskScoringEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Comprehensive risk assessment for any registered borrower.
 *
 * Anyone may call this, at any time, for any amount. It reads the stored
 * profile and never writes anything, so two calls against the same profile
 * and amount return equal results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RiskAssessmentService {

    private final BorrowerProfileRepository profileRepository;
    private final RiskScoringEngine scoringEngine;
    private final LedgerStatsService ledgerStatsService;

    @Transactional(readOnly = true)
    public LendingResult<RiskAssessment> assessComprehensiveRisk(String borrower, long requestedAmount,
                                                                 String purpose) {
        Optional<BorrowerProfile> profile = profileRepository.findById(borrower);
        if (profile.isEmpty()) {
            return LendingResult.failure(LendingError.NOT_FOUND, "No profile registered for " + borrower);
        }
        if (requestedAmount <= 0) {
            return LendingResult.failure(LendingError.INVALID_AMOUNT, "Requested amount must be positive");
        }
        if (purpose != null && purpose.length() > LoanApplication.MAX_PURPOSE_LENGTH) {
            return LendingResult.failure(LendingError.INVALID_PARAMETERS,
                    "Purpose is limited to " + LoanApplication.MAX_PURPOSE_LENGTH + " characters");
        }

        RiskAssessment assessment = scoringEngine.assessComprehensiveRisk(
                profile.get(), requestedAmount, purpose, ledgerStatsService.currentModelVersion());
        log.info("Assessed {} for {}: final score {} ({})", borrower, requestedAmount,
                assessment.finalRiskScore(), assessment.riskCategory());
        return LendingResult.ok(assessment);
    }
}

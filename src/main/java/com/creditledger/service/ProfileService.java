package com.creditledger.service;

import com.creditledger.config.RedisConfig;
import com.creditledger.model.BorrowerProfile;
import com.creditledger.model.RiskCategory;
import com.creditledger.repository.BorrowerProfileRepository;
import com.creditledger.result.LendingError;
import com.creditledger.result.LendingResult;
import com.creditledger.security.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Owner of borrower profiles.
 *
 * A caller can only write their own profile. Registration is an upsert:
 * calling it again replaces every field and recomputes the risk category.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfileService {

    private final BorrowerProfileRepository profileRepository;
    private final LedgerStatsService ledgerStatsService;
    private final Clock clock;

    @Transactional
    @CacheEvict(value = RedisConfig.PROFILES, key = "#caller.identity()")
    public LendingResult<BorrowerProfile> registerProfile(Caller caller, ProfileCommand command) {
        ledgerStatsService.acquireLedgerLock();

        LendingResult<BorrowerProfile> invalid = validate(command);
        if (invalid != null) {
            log.warn("Rejected profile for {}: {} - {}", caller.identity(), invalid.error(), invalid.message());
            return invalid;
        }

        BorrowerProfile profile = profileRepository.findById(caller.identity())
                .orElseGet(BorrowerProfile::new);
        boolean created = profile.getBorrower() == null;

        profile.setBorrower(caller.identity());
        profile.setCreditScore(command.creditScore());
        profile.setAnnualIncome(command.annualIncome());
        profile.setTotalDebt(command.totalDebt());
        profile.setEmploymentYears(command.employmentYears());
        profile.setPreviousDefaults(command.previousDefaults());
        profile.setOnTimePayments(command.onTimePayments());
        profile.setTotalLoans(command.totalLoans());
        profile.setRiskCategory(RiskCategory.fromScore(command.creditScore()));
        profile.setLastUpdated(Instant.now(clock));

        BorrowerProfile saved = profileRepository.save(profile);
        log.info("{} profile for {}: score {} -> {}",
                created ? "Registered" : "Updated", saved.getBorrower(),
                saved.getCreditScore(), saved.getRiskCategory());
        return LendingResult.ok(saved);
    }

    private LendingResult<BorrowerProfile> validate(ProfileCommand command) {
        if (command.creditScore() < BorrowerProfile.MIN_CREDIT_SCORE
                || command.creditScore() > BorrowerProfile.MAX_CREDIT_SCORE) {
            return LendingResult.failure(LendingError.INVALID_PARAMETERS,
                    "Credit score must be between " + BorrowerProfile.MIN_CREDIT_SCORE
                            + " and " + BorrowerProfile.MAX_CREDIT_SCORE + ": " + command.creditScore());
        }
        if (command.annualIncome() < 0 || command.totalDebt() < 0) {
            return LendingResult.failure(LendingError.INVALID_PARAMETERS,
                    "Income and debt cannot be negative");
        }
        if (command.employmentYears() < 0 || command.previousDefaults() < 0
                || command.onTimePayments() < 0 || command.totalLoans() < 0) {
            return LendingResult.failure(LendingError.INVALID_PARAMETERS,
                    "History counters cannot be negative");
        }
        return null;
    }

    /**
     * Cache miss falls through to the database; absent profiles are not cached.
     */
    @Transactional(readOnly = true)
    @Cacheable(value = RedisConfig.PROFILES, key = "#identity", unless = "#result == null")
    public Optional<BorrowerProfile> getProfile(String identity) {
        log.debug("Cache miss - fetching profile from database: {}", identity);
        return profileRepository.findById(identity);
    }
}

package com.creditledger.service;

import com.creditledger.config.KafkaTopics;
import com.creditledger.config.RedisConfig;
import com.creditledger.event.LoanApplicationSubmitted;
import com.creditledger.event.LoanDisbursed;
import com.creditledger.event.LoanPaymentRecorded;
import com.creditledger.math.FixedPointMath;
import com.creditledger.model.ActiveLoan;
import com.creditledger.model.BorrowerProfile;
import com.creditledger.model.LedgerStats;
import com.creditledger.model.LoanApplication;
import com.creditledger.model.LoanApplication.ApplicationStatus;
import com.creditledger.model.RiskCategory;
import com.creditledger.repository.ActiveLoanRepository;
import com.creditledger.repository.BorrowerProfileRepository;
import com.creditledger.repository.LoanApplicationRepository;
import com.creditledger.result.LendingError;
import com.creditledger.result.LendingResult;
import com.creditledger.scoring.RiskScoringEngine;
import com.creditledger.security.Caller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Loan lifecycle state machine.
 *
 * STATES:
 * =======
 * PENDING -> APPROVED -> DISBURSED, then the active loan is REPAYING while
 * its balance is positive and REPAID once it reaches zero. No backward
 * transitions, no cancellation.
 *
 * ATOMICITY:
 * ==========
 * Every mutating method:
 * 1. Takes the global ledger lock (see LedgerStatsService)
 * 2. Checks ALL preconditions and returns the first failure
 * 3. Only then writes records, stats and the outbox event
 * A rejected call leaves no trace besides a WARN log line.
 *
 * CACHING:
 * ========
 * Reads of applications and loans are cached by id; each transition evicts
 * the key it touched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanLifecycleService {

    /** Applications below this stored credit score are rejected outright. */
    public static final int MIN_APPLICATION_SCORE = RiskCategory.HIGH.getMinScore();

    private final BorrowerProfileRepository profileRepository;
    private final LoanApplicationRepository applicationRepository;
    private final ActiveLoanRepository activeLoanRepository;
    private final LedgerStatsService ledgerStatsService;
    private final RiskScoringEngine scoringEngine;
    private final OutboxWriter outboxWriter;
    private final Clock clock;

    // ==================== APPLY ====================

    /**
     * Submit a loan application for the caller.
     *
     * The caller's stored credit score is snapshotted together with the rate of
     * its band. The id counter only advances when the application is saved.
     *
     * @return the new application id
     */
    @Transactional
    public LendingResult<Long> apply(Caller caller, long amount, String purpose, int termMonths) {
        LedgerStats stats = ledgerStatsService.acquireLedgerLock();

        Optional<BorrowerProfile> profile = profileRepository.findById(caller.identity());
        if (profile.isEmpty()) {
            return reject("apply", LendingError.NOT_FOUND, "No profile registered for " + caller.identity());
        }
        if (amount <= 0) {
            return reject("apply", LendingError.INVALID_AMOUNT, "Loan amount must be positive");
        }
        if (termMonths < LoanApplication.MIN_TERM_MONTHS || termMonths > LoanApplication.MAX_TERM_MONTHS) {
            return reject("apply", LendingError.INVALID_PARAMETERS,
                    "Term must be between " + LoanApplication.MIN_TERM_MONTHS
                            + " and " + LoanApplication.MAX_TERM_MONTHS + " months: " + termMonths);
        }
        if (purpose == null || purpose.isBlank() || purpose.length() > LoanApplication.MAX_PURPOSE_LENGTH) {
            return reject("apply", LendingError.INVALID_PARAMETERS,
                    "Purpose is required and limited to " + LoanApplication.MAX_PURPOSE_LENGTH + " characters");
        }

        int riskScore = profile.get().getCreditScore();
        if (riskScore < MIN_APPLICATION_SCORE) {
            return reject("apply", LendingError.INSUFFICIENT_SCORE,
                    "Credit score " + riskScore + " is below the minimum of " + MIN_APPLICATION_SCORE);
        }

        int interestRate = scoringEngine.deriveInterestRate(riskScore);
        try {
            // Disbursement recomputes this from the same snapshot; proving it fits now means it cannot fail later
            FixedPointMath.amortizedMonthlyPayment(amount, interestRate, termMonths);
        } catch (ArithmeticException e) {
            return reject("apply", LendingError.INVALID_AMOUNT, "Loan amount is out of range: " + amount);
        }

        long applicationId = ledgerStatsService.nextApplicationId(stats);
        Instant now = Instant.now(clock);

        LoanApplication application = new LoanApplication();
        application.setId(applicationId);
        application.setBorrower(caller.identity());
        application.setAmount(amount);
        application.setPurpose(purpose);
        application.setTermMonths(termMonths);
        application.setRiskScore(riskScore);
        application.setInterestRate(interestRate);
        application.setStatus(ApplicationStatus.PENDING);
        application.setAppliedAt(now);
        applicationRepository.save(application);

        outboxWriter.write(new LoanApplicationSubmitted(applicationId, caller.identity(), amount,
                        termMonths, riskScore, interestRate, now),
                "application-" + applicationId, KafkaTopics.LOAN_APPLICATION_SUBMITTED);

        log.info("Application {} submitted by {}: amount {}, term {}, score {}, rate {} bps",
                applicationId, caller.identity(), amount, termMonths, riskScore, interestRate);
        return LendingResult.ok(applicationId);
    }

    // ==================== APPROVE ====================

    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS, key = "#applicationId")
    public LendingResult<LoanApplication> approve(Caller caller, long applicationId) {
        ledgerStatsService.acquireLedgerLock();

        if (!caller.isOwner()) {
            return reject("approve", LendingError.UNAUTHORIZED, "Only the owner can approve applications");
        }
        Optional<LoanApplication> found = applicationRepository.findById(applicationId);
        if (found.isEmpty()) {
            return reject("approve", LendingError.NOT_FOUND, "Application not found: " + applicationId);
        }
        LoanApplication application = found.get();
        if (application.getStatus() != ApplicationStatus.PENDING) {
            return reject("approve", LendingError.INVALID_PARAMETERS,
                    "Application " + applicationId + " is " + application.getStatus() + ", expected PENDING");
        }

        application.setStatus(ApplicationStatus.APPROVED);
        application.setApprovedAt(Instant.now(clock));
        LoanApplication saved = applicationRepository.save(application);

        log.info("Application {} approved by {}", applicationId, caller.identity());
        return LendingResult.ok(saved);
    }

    // ==================== DISBURSE ====================

    /**
     * Release funds for an approved application.
     *
     * The application stays in place (DISBURSED) for audit history; the new
     * active loan reuses its id.
     */
    @Transactional
    @CacheEvict(value = RedisConfig.APPLICATIONS, key = "#applicationId")
    public LendingResult<ActiveLoan> disburse(Caller caller, long applicationId) {
        LedgerStats stats = ledgerStatsService.acquireLedgerLock();

        if (!caller.isOwner()) {
            return reject("disburse", LendingError.UNAUTHORIZED, "Only the owner can disburse loans");
        }
        Optional<LoanApplication> found = applicationRepository.findById(applicationId);
        if (found.isEmpty()) {
            return reject("disburse", LendingError.NOT_FOUND, "Application not found: " + applicationId);
        }
        LoanApplication application = found.get();
        if (application.getStatus() != ApplicationStatus.APPROVED) {
            return reject("disburse", LendingError.INVALID_PARAMETERS,
                    "Application " + applicationId + " is " + application.getStatus() + ", expected APPROVED");
        }
        if (activeLoanRepository.existsById(applicationId)) {
            return reject("disburse", LendingError.ALREADY_EXISTS, "Loan already disbursed: " + applicationId);
        }
        if (stats.getTotalAmountDisbursed() > Long.MAX_VALUE - application.getAmount()) {
            return reject("disburse", LendingError.INVALID_AMOUNT, "Disbursed total would overflow");
        }

        long monthlyPayment = FixedPointMath.amortizedMonthlyPayment(
                application.getAmount(), application.getInterestRate(), application.getTermMonths());
        Instant now = Instant.now(clock);

        ActiveLoan loan = new ActiveLoan();
        loan.setId(applicationId);
        loan.setBorrower(application.getBorrower());
        loan.setPrincipalAmount(application.getAmount());
        loan.setOutstandingBalance(application.getAmount());
        loan.setInterestRate(application.getInterestRate());
        loan.setMonthlyPayment(monthlyPayment);
        loan.setPaymentsMade(0);
        loan.setPaymentsMissed(0);
        loan.setTermMonths(application.getTermMonths());
        loan.setDisbursedAt(now);
        ActiveLoan saved = activeLoanRepository.save(loan);

        application.setStatus(ApplicationStatus.DISBURSED);
        applicationRepository.save(application);

        ledgerStatsService.recordDisbursement(stats, application.getAmount());

        outboxWriter.write(new LoanDisbursed(applicationId, saved.getBorrower(), saved.getPrincipalAmount(),
                        saved.getInterestRate(), monthlyPayment, saved.getTermMonths(), now),
                "loan-" + applicationId, KafkaTopics.LOAN_DISBURSED);

        log.info("Loan {} disbursed by {}: principal {}, monthly payment {}",
                applicationId, caller.identity(), saved.getPrincipalAmount(), monthlyPayment);
        return LendingResult.ok(saved);
    }

    // ==================== RECORD PAYMENT ====================

    /**
     * Apply a repayment from the loan's borrower.
     *
     * Any accepted payment counts as one payment made, whatever its size.
     * Overpayment clamps the balance to zero; the excess is not tracked.
     *
     * @return the balance after this payment
     */
    @Transactional
    @CacheEvict(value = RedisConfig.LOANS, key = "#loanId")
    public LendingResult<Long> recordPayment(Caller caller, long loanId, long paymentAmount) {
        ledgerStatsService.acquireLedgerLock();

        Optional<ActiveLoan> found = activeLoanRepository.findById(loanId);
        if (found.isEmpty()) {
            return reject("recordPayment", LendingError.NOT_FOUND, "Loan not found: " + loanId);
        }
        ActiveLoan loan = found.get();
        if (!loan.getBorrower().equals(caller.identity())) {
            return reject("recordPayment", LendingError.UNAUTHORIZED,
                    "Only the borrower can record payments on loan " + loanId);
        }
        if (paymentAmount <= 0) {
            return reject("recordPayment", LendingError.INVALID_AMOUNT, "Payment amount must be positive");
        }
        if (loan.isRepaid()) {
            return reject("recordPayment", LendingError.INVALID_AMOUNT, "Loan " + loanId + " is already repaid");
        }

        long previousBalance = loan.getOutstandingBalance();
        long newBalance = Math.max(0L, previousBalance - paymentAmount);
        loan.setOutstandingBalance(newBalance);
        loan.setPaymentsMade(loan.getPaymentsMade() + 1);
        activeLoanRepository.save(loan);

        outboxWriter.write(new LoanPaymentRecorded(loanId, loan.getBorrower(), paymentAmount,
                        previousBalance - newBalance, newBalance, loan.getPaymentsMade(), Instant.now(clock)),
                "loan-" + loanId + "-payment-" + loan.getPaymentsMade(), KafkaTopics.LOAN_PAYMENT_RECORDED);

        if (newBalance == 0L) {
            log.info("Loan {} fully repaid after {} payments", loanId, loan.getPaymentsMade());
        } else {
            log.info("Payment of {} recorded on loan {}: balance {} -> {}",
                    paymentAmount, loanId, previousBalance, newBalance);
        }
        return LendingResult.ok(newBalance);
    }

    // ==================== QUERIES ====================

    @Transactional(readOnly = true)
    @Cacheable(value = RedisConfig.APPLICATIONS, key = "#applicationId", unless = "#result == null")
    public Optional<LoanApplication> getApplication(long applicationId) {
        log.debug("Cache miss - fetching application from database: {}", applicationId);
        return applicationRepository.findById(applicationId);
    }

    @Transactional(readOnly = true)
    @Cacheable(value = RedisConfig.LOANS, key = "#loanId", unless = "#result == null")
    public Optional<ActiveLoan> getActiveLoan(long loanId) {
        log.debug("Cache miss - fetching loan from database: {}", loanId);
        return activeLoanRepository.findById(loanId);
    }

    @Transactional(readOnly = true)
    public List<LoanApplication> getApplicationsFor(String borrower) {
        return applicationRepository.findByBorrowerOrderByIdAsc(borrower);
    }

    private <T> LendingResult<T> reject(String operation, LendingError error, String message) {
        log.warn("Rejected {}: {} - {}", operation, error, message);
        return LendingResult.failure(error, message);
    }
}

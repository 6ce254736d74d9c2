package com.creditledger.service;

import com.creditledger.config.LendingProperties;
import com.creditledger.model.LedgerStats;
import com.creditledger.repository.LedgerStatsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owner of the singleton {@link LedgerStats} row.
 *
 * GLOBAL SERIALIZATION POINT:
 * ===========================
 * {@link #acquireLedgerLock()} takes a pessimistic write lock on the row.
 * Every mutating ledger operation calls it first, inside its own transaction,
 * so no two mutations ever interleave and the application id counter is
 * never read-then-written by two callers at once.
 *
 * WRITERS:
 * ========
 * - LoanLifecycleService.apply     -> nextApplicationId
 * - LoanLifecycleService.disburse  -> recordDisbursement
 * Nothing else mutates the counters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerStatsService {

    private final LedgerStatsRepository ledgerStatsRepository;
    private final LendingProperties lendingProperties;

    /**
     * Lock the stats row for the rest of the current transaction.
     * The row is seeded at startup by {@link LedgerStatsInitializer}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerStats acquireLedgerLock() {
        return ledgerStatsRepository.lockById(LedgerStats.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Ledger stats row has not been seeded"));
    }

    /**
     * Next application id. Call only once the application is certain to be saved.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public long nextApplicationId(LedgerStats lockedStats) {
        long next = Math.addExact(lockedStats.getLastApplicationId(), 1L);
        lockedStats.setLastApplicationId(next);
        ledgerStatsRepository.save(lockedStats);
        return next;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordDisbursement(LedgerStats lockedStats, long amount) {
        lockedStats.setTotalLoansIssued(lockedStats.getTotalLoansIssued() + 1);
        lockedStats.setTotalAmountDisbursed(Math.addExact(lockedStats.getTotalAmountDisbursed(), amount));
        ledgerStatsRepository.save(lockedStats);
        log.debug("Ledger stats now: {} loans, {} disbursed",
                lockedStats.getTotalLoansIssued(), lockedStats.getTotalAmountDisbursed());
    }

    @Transactional(readOnly = true)
    public LedgerStatsView getStats() {
        return ledgerStatsRepository.findById(LedgerStats.SINGLETON_ID)
                .map(stats -> new LedgerStatsView(
                        stats.getTotalLoansIssued(),
                        stats.getTotalAmountDisbursed(),
                        stats.getModelVersion()))
                .orElseGet(() -> new LedgerStatsView(0L, 0L, lendingProperties.getModelVersion()));
    }

    /**
     * Current model version, for assessments.
     */
    @Transactional(readOnly = true)
    public int currentModelVersion() {
        return getStats().modelVersion();
    }
}

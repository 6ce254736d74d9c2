package com.creditledger.service;

import com.creditledger.config.LendingProperties;
import com.creditledger.model.LedgerStats;
import com.creditledger.repository.LedgerStatsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Seeds the singleton {@link LedgerStats} row while the context starts.
 *
 * Runs after all singletons exist but before the embedded web server and the
 * outbox scheduler start, so no mutation can ever find the row missing.
 * Another instance sharing the database may seed it first; that insert
 * conflict is expected and leaves the existing row untouched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerStatsInitializer implements SmartInitializingSingleton {

    private final LedgerStatsRepository ledgerStatsRepository;
    private final LendingProperties lendingProperties;
    private final TransactionTemplate transactionTemplate;

    @Override
    public void afterSingletonsInstantiated() {
        try {
            transactionTemplate.executeWithoutResult(status -> seedIfMissing());
        } catch (DataIntegrityViolationException e) {
            log.info("Ledger stats row was seeded concurrently by another instance");
        }
    }

    void seedIfMissing() {
        if (ledgerStatsRepository.existsById(LedgerStats.SINGLETON_ID)) {
            log.debug("Ledger stats row already present");
            return;
        }
        log.info("Initialising ledger stats with model version {}", lendingProperties.getModelVersion());
        ledgerStatsRepository.saveAndFlush(LedgerStats.initial(lendingProperties.getModelVersion()));
    }
}
